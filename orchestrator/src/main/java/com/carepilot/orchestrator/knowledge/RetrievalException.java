package com.carepilot.orchestrator.knowledge;

/**
 * Thrown when the knowledge store cannot be queried.
 * An empty result is never reported this way.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
