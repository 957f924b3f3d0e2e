package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.FinalReport;
import com.carepilot.orchestrator.model.KnowledgeContext;
import com.carepilot.orchestrator.model.StageName;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Assembles the {@link FinalReport} from the accumulated record.
 *
 * Deterministic: no retrieval, no model call, no clock. The timeline is the
 * history as it stood when synthesis started.
 */
@Component
public class ReportSynthesisAgent implements StageAgent {

    @Override
    public StageName stage() {
        return StageName.REPORT_SYNTHESIS;
    }

    @Override
    public Optional<String> knowledgeQuery(CaseRecord record) {
        return Optional.empty();
    }

    @Override
    public CaseRecord process(CaseRecord record, KnowledgeContext context, PromptMode mode) {
        if (!record.hasCompleted(StageName.EXAMINATION)) {
            throw StageException.precondition(StageName.REPORT_SYNTHESIS, "examination has not completed");
        }
        if (record.diagnosis().isEmpty()) {
            throw StageException.precondition(StageName.REPORT_SYNTHESIS, "diagnosis is empty");
        }

        FinalReport report = new FinalReport(
                record.caseId(),
                record.patient(),
                record.complaint(),
                record.symptoms().tags(),
                record.urgency(),
                record.triage(),
                record.diagnosis(),
                record.carePlan(),
                record.imagingOrder(),
                record.imagingFinding(),
                record.history(),
                ReportFormatter.toMarkdown(record, record.history()));

        return record.toBuilder().report(report).build();
    }
}
