package com.carepilot.orchestrator.api.dto;

import com.carepilot.orchestrator.model.RunState;
import com.carepilot.orchestrator.model.RunStatus;

import java.time.Instant;

/** Response body for POST /cases and POST /cases/{id}/cancel. */
public record CaseRunResponse(
        String   runId,
        RunState state,
        boolean  cancelRequested,
        Instant  createdAt
) {
    public static CaseRunResponse from(RunStatus status) {
        return new CaseRunResponse(status.runId(), status.state(), status.cancelRequested(), status.createdAt());
    }
}
