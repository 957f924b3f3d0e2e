package com.carepilot.orchestrator.model;

/**
 * States of one case run.
 *
 * Transitions (see StageTransitions for the guarded table):
 *   CREATED → INTAKE → EXAMINATION → (IMAGING | skip) → REPORT_SYNTHESIS → COMPLETED
 *
 * FAILED is reachable from any non-terminal state once a stage exhausts its
 * retry budget or hits a non-retryable error. CANCELLED is reached when the
 * caller cancels and the run arrives at the next stage boundary.
 */
public enum RunState {
    CREATED,
    INTAKE,
    EXAMINATION,
    IMAGING,
    REPORT_SYNTHESIS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** The state a run is in while the given stage is active. */
    public static RunState of(StageName stage) {
        return switch (stage) {
            case INTAKE           -> INTAKE;
            case EXAMINATION      -> EXAMINATION;
            case IMAGING          -> IMAGING;
            case REPORT_SYNTHESIS -> REPORT_SYNTHESIS;
        };
    }

    /** The stage that is active in this state, or null for CREATED and terminal states. */
    public StageName activeStage() {
        return switch (this) {
            case INTAKE           -> StageName.INTAKE;
            case EXAMINATION      -> StageName.EXAMINATION;
            case IMAGING          -> StageName.IMAGING;
            case REPORT_SYNTHESIS -> StageName.REPORT_SYNTHESIS;
            default               -> null;
        };
    }
}
