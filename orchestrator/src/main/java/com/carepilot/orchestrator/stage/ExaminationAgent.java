package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.config.PipelineSettings;
import com.carepilot.orchestrator.inference.OutputSchema;
import com.carepilot.orchestrator.model.CarePlan;
import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.ConditionHypothesis;
import com.carepilot.orchestrator.model.ImagingOrder;
import com.carepilot.orchestrator.model.KnowledgeContext;
import com.carepilot.orchestrator.model.StageName;
import com.carepilot.orchestrator.model.UrgencyLevel;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Physician: builds the differential diagnosis, the care plan and, when the
 * leading hypothesis matches a configured indication, an imaging order.
 *
 * The model may propose an urgency. A higher level is adopted as an escalation;
 * a lower one only together with a non-blank override reason.
 */
@Component
public class ExaminationAgent implements StageAgent {

    private static final Logger log = LoggerFactory.getLogger(ExaminationAgent.class);

    private static final List<String> URGENCY_LABELS = List.of("LOW", "MODERATE", "HIGH", "CRITICAL");

    private static final OutputSchema HYPOTHESIS = OutputSchema.builder("hypothesis")
            .requiredString("condition", "Name of the suspected condition")
            .requiredNumber("confidence", 0.0, 1.0, "Confidence between 0 and 1")
            .requiredString("rationale", "Supporting reasoning, citing reference source ids")
            .build();

    static final OutputSchema SCHEMA = OutputSchema.builder("examination")
            .requiredObjectArray("hypotheses", 1, HYPOTHESIS, "Differential diagnosis")
            .requiredStringArray("recommendedTests", 0, "Follow-up tests")
            .requiredString("treatmentPlan", "Initial treatment plan")
            .optionalEnum("urgency", URGENCY_LABELS, "Proposed urgency, if different from triage")
            .optionalString("urgencyOverrideReason", "Required when proposing a lower urgency")
            .build();

    private final GroundedGenerator          generator;
    private final PipelineSettings.Imaging   imaging;

    public ExaminationAgent(GroundedGenerator generator, PipelineSettings settings) {
        this.generator = generator;
        this.imaging   = settings.imaging();
    }

    @Override
    public StageName stage() {
        return StageName.EXAMINATION;
    }

    @Override
    public Optional<String> knowledgeQuery(CaseRecord record) {
        String tags = String.join(" ", record.symptoms().tags());
        return Optional.of(("differential diagnosis " + tags + " " + record.complaint()).strip());
    }

    @Override
    public CaseRecord process(CaseRecord record, KnowledgeContext context, PromptMode mode) {
        if (record.urgency() == null || record.triage() == null) {
            throw StageException.precondition(StageName.EXAMINATION, "case has not been through intake");
        }

        JsonNode out = generator.generate(StageName.EXAMINATION, SCHEMA, buildPrompt(record), context, mode);

        List<ConditionHypothesis> hypotheses = new ArrayList<>();
        for (JsonNode h : out.get("hypotheses")) {
            hypotheses.add(new ConditionHypothesis(
                    h.get("condition").asText(),
                    h.get("confidence").asDouble(),
                    h.get("rationale").asText()));
        }
        hypotheses.sort(ConditionHypothesis.BY_CONFIDENCE);

        List<String> tests = new ArrayList<>();
        out.get("recommendedTests").forEach(n -> tests.add(n.asText()));

        CaseRecord next = record.toBuilder()
                .diagnosis(hypotheses)
                .carePlan(new CarePlan(tests, out.get("treatmentPlan").asText()))
                .imagingOrder(imagingOrderFor(hypotheses.get(0)))
                .knowledgeContext(context)
                .build();

        return applyProposedUrgency(next, out);
    }

    /** First configured indication found in the leading hypothesis, or null. */
    ImagingOrder imagingOrderFor(ConditionHypothesis top) {
        for (PipelineSettings.ImagingIndication indication : imaging.indications()) {
            if (indication.matches(top.condition()) || indication.matches(top.rationale())) {
                return new ImagingOrder(indication.modality(), indication.bodyRegion(), indication.condition());
            }
        }
        return null;
    }

    private CaseRecord applyProposedUrgency(CaseRecord record, JsonNode out) {
        JsonNode urgencyNode = out.get("urgency");
        if (urgencyNode == null || urgencyNode.isNull()) {
            return record;
        }
        UrgencyLevel proposed = UrgencyLevel.fromLabel(urgencyNode.asText()).orElse(null);
        if (proposed == null) {
            return record;
        }
        if (!proposed.isLowerThan(record.urgency())) {
            return record.withEscalatedUrgency(proposed);
        }
        JsonNode reasonNode = out.get("urgencyOverrideReason");
        String reason = reasonNode == null || reasonNode.isNull() ? "" : reasonNode.asText();
        if (reason.isBlank()) {
            log.info("Ignoring proposed urgency {} below {}: no override reason given",
                    proposed, record.urgency());
            return record;
        }
        return record.withUrgencyOverride(proposed, reason);
    }

    private static String buildPrompt(CaseRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append("PATIENT:\n").append(record.patient().describe()).append("\n\n");
        sb.append("COMPLAINT:\n").append(record.complaint()).append("\n\n");
        sb.append("SYMPTOMS: ").append(String.join(", ", record.symptoms().tags())).append("\n");
        sb.append("TRIAGE URGENCY: ").append(record.urgency()).append("\n");
        sb.append("DEPARTMENT: ").append(record.triage().department()).append("\n");
        sb.append("TRIAGE SUMMARY: ").append(record.triage().summary()).append("\n");
        if (!record.medicalHistory().isBlank()) {
            sb.append("\nMEDICAL HISTORY:\n").append(record.medicalHistory()).append("\n");
        }
        return sb.toString();
    }
}
