package com.carepilot.orchestrator.service;

import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.ConditionHypothesis;
import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.StageName;
import com.carepilot.orchestrator.model.UrgencyOverride;
import com.carepilot.orchestrator.stage.StageException;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a stage's result against the record it started from before the
 * orchestrator adopts it. Any violation fails the stage with INVARIANT_VIOLATED.
 */
public class RecordValidator {

    public void validate(StageName stage, CaseRecord before, CaseRecord after) {
        if (after == null) {
            throw violation(stage, List.of("stage returned no record"));
        }
        List<String> problems = new ArrayList<>();

        if (!after.caseId().equals(before.caseId())) {
            problems.add("case id changed from " + before.caseId() + " to " + after.caseId());
        }
        if (!after.history().equals(before.history())) {
            problems.add("stage history was modified by the stage");
        }

        if (before.urgency() != null) {
            if (after.urgency() == null) {
                problems.add("urgency was cleared");
            } else if (after.urgency().isLowerThan(before.urgency())) {
                UrgencyOverride o = after.pendingOverride();
                if (o == null || o.from() != before.urgency() || o.to() != after.urgency()) {
                    problems.add("urgency lowered from " + before.urgency() + " to " + after.urgency()
                            + " without an override");
                }
            }
        }

        if (after.imagingFinding() != null && after.imagingOrder() == null) {
            problems.add("imaging finding present without an imaging order");
        }

        List<ConditionHypothesis> diagnosis = after.diagnosis();
        for (int i = 1; i < diagnosis.size(); i++) {
            if (ConditionHypothesis.BY_CONFIDENCE.compare(diagnosis.get(i - 1), diagnosis.get(i)) > 0) {
                problems.add("diagnosis is not sorted by confidence");
                break;
            }
        }

        switch (stage) {
            case INTAKE -> {
                if (after.urgency() == null) problems.add("intake did not set urgency");
            }
            case EXAMINATION -> {
                if (diagnosis.isEmpty()) problems.add("examination produced no diagnosis");
            }
            case IMAGING -> {
                if (after.imagingFinding() == null) problems.add("imaging produced no finding");
            }
            case REPORT_SYNTHESIS -> {
                if (after.report() == null) problems.add("report synthesis produced no report");
            }
        }

        if (!problems.isEmpty()) {
            throw violation(stage, problems);
        }
    }

    private static StageException violation(StageName stage, List<String> problems) {
        return new StageException(stage, FailureReason.INVARIANT_VIOLATED, String.join("; ", problems));
    }
}
