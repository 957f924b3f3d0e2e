package com.carepilot.orchestrator.inference;

import java.util.Objects;

/**
 * One generation call: prompts, the schema the output must satisfy, and
 * the model parameters to use.
 */
public record InferenceRequest(
        String          systemPrompt,
        String          userPrompt,
        OutputSchema    schema,
        ModelParameters parameters
) {
    public InferenceRequest {
        Objects.requireNonNull(systemPrompt, "systemPrompt");
        Objects.requireNonNull(userPrompt, "userPrompt");
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(parameters, "parameters");
    }
}
