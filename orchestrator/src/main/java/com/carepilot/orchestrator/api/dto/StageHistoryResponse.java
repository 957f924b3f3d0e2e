package com.carepilot.orchestrator.api.dto;

import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.StageHistoryEntry;
import com.carepilot.orchestrator.model.StageName;
import com.carepilot.orchestrator.model.StageOutcome;
import com.carepilot.orchestrator.model.UrgencyOverride;

import java.time.Instant;

/** One row of GET /cases/{id}/history. */
public record StageHistoryResponse(
        StageName       stage,
        StageOutcome    outcome,
        int             attempt,
        Instant         timestamp,
        FailureReason   reason,
        String          detail,
        UrgencyOverride override
) {
    public static StageHistoryResponse from(StageHistoryEntry e) {
        return new StageHistoryResponse(
                e.stage(),
                e.outcome(),
                e.attempt(),
                e.timestamp(),
                e.reason(),
                e.detail(),
                e.override()
        );
    }
}
