package com.carepilot.orchestrator.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of a finished run: either a final report or a failure reason,
 * always with the StageHistory and the last committed record.
 *
 * A FAILED or CANCELLED outcome never exposes a report; callers inspect
 * {@link #record()} for diagnostics instead.
 */
public record RunOutcome(
        String        runId,
        RunState      state,
        CaseRecord    record,
        FailureReason failureReason,
        String        failureDetail
) {
    public boolean isCompleted() {
        return state == RunState.COMPLETED;
    }

    public Optional<FinalReport> report() {
        return isCompleted() ? Optional.ofNullable(record.report()) : Optional.empty();
    }

    public Optional<FailureReason> failure() {
        return Optional.ofNullable(failureReason);
    }

    public List<StageHistoryEntry> history() {
        return record.history();
    }
}
