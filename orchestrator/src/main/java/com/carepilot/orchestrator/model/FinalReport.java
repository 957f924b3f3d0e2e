package com.carepilot.orchestrator.model;

import java.util.List;
import java.util.SortedSet;

/**
 * The structured output of ReportSynthesis.
 *
 * imagingOrder and imagingFinding are null when no imaging was indicated.
 * timeline is the StageHistory as it stood when synthesis started; markdown
 * is the same content rendered for display.
 */
public record FinalReport(
        String                    caseId,
        PatientInfo               patient,
        String                    complaint,
        SortedSet<String>         symptomTags,
        UrgencyLevel              urgency,
        TriageAssessment          triage,
        List<ConditionHypothesis> diagnosis,
        CarePlan                  carePlan,
        ImagingOrder              imagingOrder,
        ImagingFinding            imagingFinding,
        List<StageHistoryEntry>   timeline,
        String                    markdown
) {
    public FinalReport {
        diagnosis = List.copyOf(diagnosis);
        timeline  = List.copyOf(timeline);
    }
}
