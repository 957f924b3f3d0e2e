package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.config.PipelineSettings;
import com.carepilot.orchestrator.inference.InferenceClient;
import com.carepilot.orchestrator.inference.InferenceException;
import com.carepilot.orchestrator.inference.InferenceRequest;
import com.carepilot.orchestrator.inference.ModelParameters;
import com.carepilot.orchestrator.inference.OutputSchema;
import com.carepilot.orchestrator.model.KnowledgeContext;
import com.carepilot.orchestrator.model.StageName;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Shared model call for the stages that generate text.
 *
 * Every call carries the retrieved REFERENCE KNOWLEDGE block (possibly the
 * "nothing retrieved" marker) and the output schema, and every reply is
 * validated against that schema before a stage sees it. Inference failures
 * come back as {@link StageException}s with the matching reason.
 */
@Component
public class GroundedGenerator {

    private static final Logger log = LoggerFactory.getLogger(GroundedGenerator.class);

    private final InferenceClient          client;
    private final PipelineSettings.Model   model;

    public GroundedGenerator(InferenceClient client, PipelineSettings settings) {
        this.client = client;
        this.model  = settings.model();
    }

    public JsonNode generate(StageName stage, OutputSchema schema, String userPrompt,
                             KnowledgeContext context, PromptMode mode) {
        String system = StagePrompts.system(stage)
                + "\nOUTPUT FORMAT:\nRespond with a single JSON object that satisfies this JSON Schema:\n"
                + schema.toJsonSchema().toPrettyString()
                + (mode == PromptMode.STRICT ? StagePrompts.STRICT_SUFFIX : "");

        String user = userPrompt
                + "\n\nREFERENCE KNOWLEDGE:\n" + context.toPromptBlock();

        double temperature = mode == PromptMode.STRICT ? model.strictTemperature() : model.temperature();
        InferenceRequest request = new InferenceRequest(system, user, schema,
                new ModelParameters(model.name(), temperature, model.maxTokens()));

        JsonNode output;
        try {
            output = client.generate(request);
        } catch (InferenceException e) {
            throw StageException.from(stage, e);
        }

        List<String> violations = schema.validate(output);
        if (!violations.isEmpty()) {
            log.debug("{} output rejected by schema {}: {}", stage, schema.name(), violations);
            throw StageException.malformed(stage, schema.name(), violations);
        }
        return output;
    }
}
