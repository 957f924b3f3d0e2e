package com.carepilot.orchestrator.api.dto;

import com.carepilot.orchestrator.model.CarePlan;
import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.ConditionHypothesis;
import com.carepilot.orchestrator.model.ImagingFinding;
import com.carepilot.orchestrator.model.ImagingOrder;
import com.carepilot.orchestrator.model.PatientInfo;
import com.carepilot.orchestrator.model.TriageAssessment;
import com.carepilot.orchestrator.model.UrgencyLevel;

import java.util.List;
import java.util.SortedSet;

/**
 * The partial CaseRecord as exposed over HTTP.
 * Image bytes are replaced by their size; the report has its own endpoint.
 */
public record CaseRecordView(
        PatientInfo               patient,
        String                    complaint,
        SortedSet<String>         symptomTags,
        UrgencyLevel              urgency,
        TriageAssessment          triage,
        List<ConditionHypothesis> diagnosis,
        CarePlan                  carePlan,
        ImagingOrder              imagingOrder,
        ImagingFinding            imagingFinding,
        Integer                   imageBytes
) {
    public static CaseRecordView from(CaseRecord r) {
        return new CaseRecordView(
                r.patient(),
                r.complaint(),
                r.symptoms().tags(),
                r.urgency(),
                r.triage(),
                r.diagnosis(),
                r.carePlan(),
                r.imagingOrder(),
                r.imagingFinding(),
                r.hasImage() ? r.image().size() : null
        );
    }
}
