package com.carepilot.orchestrator.vision;

/**
 * Thrown when image classification fails.
 *
 * UNAVAILABLE is transient (service down, timed out, overloaded).
 * UNSUPPORTED_FORMAT means the image itself is unusable and retrying will not help.
 */
public class ClassifierException extends RuntimeException {

    public enum Kind { UNAVAILABLE, UNSUPPORTED_FORMAT }

    private final Kind kind;

    public ClassifierException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ClassifierException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
