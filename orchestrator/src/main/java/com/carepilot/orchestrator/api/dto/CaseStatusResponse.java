package com.carepilot.orchestrator.api.dto;

import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.RunState;
import com.carepilot.orchestrator.model.RunStatus;
import com.carepilot.orchestrator.model.StageName;

import java.time.Instant;

/** Response body for GET /cases/{id}. */
public record CaseStatusResponse(
        String         runId,
        RunState       state,
        StageName      activeStage,
        FailureReason  failureReason,
        String         failureDetail,
        boolean        cancelRequested,
        Instant        createdAt,
        Instant        updatedAt,
        CaseRecordView record
) {
    public static CaseStatusResponse from(RunStatus s) {
        return new CaseStatusResponse(
                s.runId(),
                s.state(),
                s.activeStage(),
                s.failureReason(),
                s.failureDetail(),
                s.cancelRequested(),
                s.createdAt(),
                s.updatedAt(),
                CaseRecordView.from(s.record())
        );
    }
}
