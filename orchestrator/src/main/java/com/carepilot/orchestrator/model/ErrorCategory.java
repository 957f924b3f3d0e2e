package com.carepilot.orchestrator.model;

/**
 * Governs retry versus escalation for a failed stage attempt.
 *
 * TRANSIENT     retried up to the configured budget with exponential backoff.
 * STRUCTURAL    model output failed schema validation; retried once with a
 *               stricter prompt, then treated as FATAL.
 * PRECONDITION  the stage was invoked on a record it cannot process.
 *               Indicates an orchestration bug; never retried.
 * FATAL         the run fails immediately.
 */
public enum ErrorCategory {
    TRANSIENT,
    STRUCTURAL,
    PRECONDITION,
    FATAL;

    public boolean isRetryable() {
        return this == TRANSIENT || this == STRUCTURAL;
    }
}
