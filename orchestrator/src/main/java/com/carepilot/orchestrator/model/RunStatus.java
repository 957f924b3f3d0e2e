package com.carepilot.orchestrator.model;

import java.time.Instant;

/**
 * Point-in-time view of a run for status polling.
 * The record is the partial CaseRecord as last committed.
 */
public record RunStatus(
        String        runId,
        RunState      state,
        StageName     activeStage,
        CaseRecord    record,
        FailureReason failureReason,
        String        failureDetail,
        boolean       cancelRequested,
        Instant       createdAt,
        Instant       updatedAt
) {}
