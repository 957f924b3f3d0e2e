package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.inference.OutputSchema;
import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.KnowledgeContext;
import com.carepilot.orchestrator.model.StageName;
import com.carepilot.orchestrator.model.TriageAssessment;
import com.carepilot.orchestrator.model.UrgencyLevel;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Front desk: turns the free-text complaint into symptom tags, an urgency
 * level and a department routing.
 *
 * Urgency starts from the model's level. {@link UrgencyRubric} can raise it
 * when a severity term matches, and can settle a mildly worded complaint at
 * LOW, but never lowers a HIGH or CRITICAL model level.
 */
@Component
public class IntakeAgent implements StageAgent {

    private static final Logger log = LoggerFactory.getLogger(IntakeAgent.class);

    static final OutputSchema SCHEMA = OutputSchema.builder("intake")
            .requiredStringArray("symptoms", 1, "Symptom tags, short and lower case")
            .requiredEnum("urgency", List.of("LOW", "MODERATE", "HIGH", "CRITICAL"), "Triage urgency")
            .requiredString("department", "Department that should see the patient")
            .requiredString("summary", "Two or three sentence summary for the physician")
            .build();

    private final GroundedGenerator generator;

    public IntakeAgent(GroundedGenerator generator) {
        this.generator = generator;
    }

    @Override
    public StageName stage() {
        return StageName.INTAKE;
    }

    @Override
    public Optional<String> knowledgeQuery(CaseRecord record) {
        return Optional.of("triage " + record.complaint());
    }

    @Override
    public CaseRecord process(CaseRecord record, KnowledgeContext context, PromptMode mode) {
        if (record.complaint().isBlank()) {
            throw StageException.precondition(StageName.INTAKE, "complaint is blank");
        }

        JsonNode out = generator.generate(StageName.INTAKE, SCHEMA, buildPrompt(record), context, mode);

        List<String> tags = new ArrayList<>();
        out.get("symptoms").forEach(n -> tags.add(n.asText()));

        UrgencyRubric.Assessment rubric = UrgencyRubric.assess(record.complaint());
        tags.addAll(rubric.matchedTerms());

        UrgencyLevel modelLevel = UrgencyLevel.fromLabel(out.get("urgency").asText())
                .orElseThrow(() -> new StageException(StageName.INTAKE,
                        FailureReason.MALFORMED_OUTPUT,
                        "unknown urgency label " + out.get("urgency").asText()));
        UrgencyLevel level = rubric.apply(modelLevel);
        if (level != modelLevel) {
            log.info("Rubric ({}) moves model urgency {} to {} (matched {})",
                    rubric.basis(), modelLevel, level, rubric.matchedTerms());
        }

        return record.toBuilder()
                .symptoms(record.symptoms().withTags(tags))
                .triage(new TriageAssessment(out.get("department").asText(), out.get("summary").asText()))
                .knowledgeContext(context)
                .build()
                .withEscalatedUrgency(level);
    }

    private static String buildPrompt(CaseRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append("PATIENT:\n").append(record.patient().describe()).append("\n\n");
        sb.append("COMPLAINT:\n").append(record.complaint()).append("\n");
        if (!record.medicalHistory().isBlank()) {
            sb.append("\nMEDICAL HISTORY:\n").append(record.medicalHistory()).append("\n");
        }
        return sb.toString();
    }
}
