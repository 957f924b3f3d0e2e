package com.carepilot.orchestrator.model;

/**
 * Why a stage attempt failed. Each reason belongs to exactly one ErrorCategory,
 * so the retry policy never has to inspect exception messages.
 */
public enum FailureReason {
    TIMEOUT(ErrorCategory.TRANSIENT),
    RATE_LIMITED(ErrorCategory.TRANSIENT),
    UNAVAILABLE(ErrorCategory.TRANSIENT),
    REQUEST_REJECTED(ErrorCategory.FATAL),
    MALFORMED_OUTPUT(ErrorCategory.STRUCTURAL),
    PRECONDITION_VIOLATED(ErrorCategory.PRECONDITION),
    IMAGE_NOT_SUPPLIED(ErrorCategory.PRECONDITION),
    UNSUPPORTED_FORMAT(ErrorCategory.FATAL),
    UNSUPPORTED_STUDY(ErrorCategory.FATAL),
    INVARIANT_VIOLATED(ErrorCategory.FATAL),
    INTERNAL_ERROR(ErrorCategory.FATAL);

    private final ErrorCategory category;

    FailureReason(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() { return category; }
}
