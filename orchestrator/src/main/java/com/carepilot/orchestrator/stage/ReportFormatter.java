package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.ConditionHypothesis;
import com.carepilot.orchestrator.model.StageHistoryEntry;

import java.util.List;
import java.util.Locale;

/**
 * Renders a completed case as the markdown assessment report.
 *
 * Output depends only on the record and the supplied timeline, so rendering
 * the same record twice yields the same text.
 */
final class ReportFormatter {

    private ReportFormatter() {}

    static String toMarkdown(CaseRecord record, List<StageHistoryEntry> timeline) {
        StringBuilder md = new StringBuilder();
        md.append("# Medical Assessment Report\n\n");
        md.append("Case: ").append(record.caseId()).append("\n\n");

        md.append("## Patient Information\n").append(record.patient().describe()).append("\n\n");

        md.append("## Complaint\n").append(record.complaint()).append("\n\n");
        if (!record.medicalHistory().isBlank()) {
            md.append("## Medical History\n").append(record.medicalHistory()).append("\n\n");
        }

        md.append("## Triage\n");
        md.append("- Urgency: ").append(record.urgency()).append("\n");
        md.append("- Symptoms: ").append(String.join(", ", record.symptoms().tags())).append("\n");
        if (record.triage() != null) {
            md.append("- Department: ").append(record.triage().department()).append("\n");
            md.append("- Summary: ").append(record.triage().summary()).append("\n");
        }
        md.append("\n");

        md.append("## Differential Diagnosis\n");
        int rank = 1;
        for (ConditionHypothesis h : record.diagnosis()) {
            md.append(String.format(Locale.ROOT, "%d. **%s** (%.2f): %s\n",
                    rank++, h.condition(), h.confidence(), h.rationale()));
        }
        md.append("\n");

        if (record.carePlan() != null) {
            md.append("## Care Plan\n");
            for (String test : record.carePlan().recommendedTests()) {
                md.append("- Test: ").append(test).append("\n");
            }
            md.append("- Treatment: ").append(record.carePlan().treatmentPlan()).append("\n\n");
        }

        md.append("## Imaging\n");
        if (record.imagingOrder() == null) {
            md.append("Not indicated.\n\n");
        } else {
            md.append("- Order: ").append(record.imagingOrder().modality()).append(" of ")
              .append(record.imagingOrder().bodyRegion()).append("\n");
            if (record.imagingFinding() != null) {
                md.append(String.format(Locale.ROOT, "- Finding: %s (%.2f)\n",
                        record.imagingFinding().label(), record.imagingFinding().confidence()));
                md.append("- Narrative: ").append(record.imagingFinding().narrative()).append("\n");
                md.append("- Impression: ").append(record.imagingFinding().impression()).append("\n");
            } else {
                md.append("- Status: pending image (no image was supplied)\n");
            }
            md.append("\n");
        }

        md.append("## Processing Log\n");
        for (StageHistoryEntry e : timeline) {
            md.append("- ").append(e.timestamp()).append(" ").append(e.stage())
              .append(" attempt ").append(e.attempt()).append(": ").append(e.outcome());
            if (e.reason() != null) {
                md.append(" (").append(e.reason()).append(")");
            }
            if (e.override() != null) {
                md.append(" urgency ").append(e.override().from()).append(" -> ").append(e.override().to())
                  .append(": ").append(e.override().reason());
            }
            md.append("\n");
        }
        return md.toString();
    }
}
