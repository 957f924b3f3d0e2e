package com.carepilot.orchestrator.model;

/**
 * Outcome of a single stage attempt, as recorded in the StageHistory.
 *
 *   SUCCEEDED: the stage result was validated and adopted
 *   RETRIED  : the attempt failed and another attempt follows
 *   FAILED   : the attempt failed and the run moves to FAILED
 */
public enum StageOutcome {
    SUCCEEDED,
    RETRIED,
    FAILED
}
