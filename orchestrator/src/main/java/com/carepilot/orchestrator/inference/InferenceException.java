package com.carepilot.orchestrator.inference;

/**
 * Thrown when a generation call fails.
 *
 * Unchecked so stage agents only catch it at the point where they translate
 * it into a StageException; the Kind decides how the orchestrator reacts.
 */
public class InferenceException extends RuntimeException {

    public enum Kind { TIMEOUT, RATE_LIMITED, MALFORMED_OUTPUT, UNAVAILABLE, REJECTED }

    private final Kind kind;

    public InferenceException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public InferenceException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
