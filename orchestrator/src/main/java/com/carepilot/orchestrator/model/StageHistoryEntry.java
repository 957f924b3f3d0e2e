package com.carepilot.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One audit-trail row: a single stage invocation and how it ended.
 *
 * Retried attempts are separate rows with outcome RETRIED, so the history
 * length always equals the number of stage invocations.
 *
 * @param attempt  1-based attempt number within the stage
 * @param reason   failure reason for RETRIED/FAILED rows, null on success
 * @param detail   human-readable detail (error message or success note)
 * @param override set when this successful attempt lowered the urgency
 */
public record StageHistoryEntry(
        StageName       stage,
        Instant         timestamp,
        StageOutcome    outcome,
        int             attempt,
        FailureReason   reason,
        String          detail,
        UrgencyOverride override
) {
    public StageHistoryEntry {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(outcome, "outcome");
        if (outcome != StageOutcome.SUCCEEDED && reason == null) {
            throw new IllegalArgumentException(outcome + " entry needs a failure reason");
        }
    }

    public static StageHistoryEntry succeeded(StageName stage, Instant at, int attempt,
                                              UrgencyOverride override) {
        return new StageHistoryEntry(stage, at, StageOutcome.SUCCEEDED, attempt, null, null, override);
    }

    public static StageHistoryEntry retried(StageName stage, Instant at, int attempt,
                                            FailureReason reason, String detail) {
        return new StageHistoryEntry(stage, at, StageOutcome.RETRIED, attempt, reason, detail, null);
    }

    public static StageHistoryEntry failed(StageName stage, Instant at, int attempt,
                                           FailureReason reason, String detail) {
        return new StageHistoryEntry(stage, at, StageOutcome.FAILED, attempt, reason, detail, null);
    }

    public boolean isSuccess() {
        return outcome == StageOutcome.SUCCEEDED;
    }
}
