package com.carepilot.orchestrator.stage;

/**
 * STANDARD for normal attempts; STRICT for the single retry after the model's
 * output failed schema validation (reformulated prompt, zero temperature).
 */
public enum PromptMode {
    STANDARD,
    STRICT
}
