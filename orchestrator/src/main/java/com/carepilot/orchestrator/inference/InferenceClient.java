package com.carepilot.orchestrator.inference;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Capability contract for the text-generation service.
 *
 * Implementations either return the model's structured output as a JSON
 * object or throw {@link InferenceException}. They do not check the output
 * against {@link InferenceRequest#schema()}; that is the caller's job, so a
 * returned value may still be missing fields.
 */
public interface InferenceClient {

    /**
     * @throws InferenceException on timeout, rate limiting, unavailability,
     *                            or output that is not a JSON object
     */
    JsonNode generate(InferenceRequest request);
}
