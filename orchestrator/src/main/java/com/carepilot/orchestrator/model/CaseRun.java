package com.carepilot.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One case moving through the pipeline.
 *
 * A CaseRun owns the authoritative CaseRecord for its case. Stages never
 * touch it directly: the orchestrator reads {@link #record()}, hands a copy
 * to the stage, and adopts the result with {@link #commit}. All mutators are
 * synchronized; readers see a consistent snapshot via {@link #status()}.
 *
 * Guarantees:
 *   - at most one active stage at a time ({@link #beginStage} / {@link #endStage})
 *   - a commit must be based on the current record, so a stale or replayed
 *     result can never overwrite a newer version
 *   - no commit is accepted once the run is terminal
 */
public class CaseRun {

    private final String  runId;
    private final Instant createdAt;

    private RunState      state = RunState.CREATED;
    private CaseRecord    record;
    private StageName     activeStage;
    private FailureReason failureReason;
    private String        failureDetail;
    private Instant       updatedAt;
    private Instant       finishedAt;

    // Read outside the lock at every stage boundary.
    private volatile boolean cancelRequested;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public CaseRun(String runId, CaseIntake intake, Instant createdAt) {
        this.runId     = Objects.requireNonNull(runId, "runId");
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.record    = CaseRecord.create(runId, intake);
    }

    // ------------------------------------------------------------------
    // Stage bracketing
    // ------------------------------------------------------------------

    /**
     * Mark a stage as active and move the run into that stage's state.
     *
     * @throws IllegalStateException if another stage is still active or the run is terminal
     */
    public synchronized void beginStage(StageName stage, Instant at) {
        requireActive();
        if (activeStage != null) {
            throw new IllegalStateException(
                    "Run " + runId + " already has active stage " + activeStage + ", cannot start " + stage);
        }
        activeStage = stage;
        state       = RunState.of(stage);
        updatedAt   = at;
    }

    public synchronized void endStage(StageName stage) {
        if (activeStage != stage) {
            throw new IllegalStateException(
                    "Run " + runId + " has active stage " + activeStage + ", not " + stage);
        }
        activeStage = null;
    }

    // ------------------------------------------------------------------
    // Record adoption
    // ------------------------------------------------------------------

    /**
     * Adopt {@code next} as the current record.
     *
     * @param base the record the producer started from; must still be current
     * @throws IllegalStateException if the run is terminal or {@code base} is stale
     */
    public synchronized void commit(CaseRecord base, CaseRecord next, Instant at) {
        requireActive();
        if (base != record) {
            throw new IllegalStateException("Stale commit rejected for run " + runId);
        }
        record    = Objects.requireNonNull(next, "next");
        updatedAt = at;
    }

    // ------------------------------------------------------------------
    // Terminal transitions
    // ------------------------------------------------------------------

    public synchronized void complete(Instant at) {
        finish(RunState.COMPLETED, at);
    }

    public synchronized void fail(FailureReason reason, String detail, Instant at) {
        failureReason = reason;
        failureDetail = detail;
        finish(RunState.FAILED, at);
    }

    public synchronized void cancelled(Instant at) {
        finish(RunState.CANCELLED, at);
    }

    /** Ask the run to stop at its next stage boundary. No effect once terminal. */
    public void requestCancel() {
        cancelRequested = true;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    private void finish(RunState terminal, Instant at) {
        requireActive();
        state       = terminal;
        activeStage = null;
        updatedAt   = at;
        finishedAt  = at;
    }

    private void requireActive() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is already " + state);
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String                 getRunId()      { return runId; }
    public Instant                getCreatedAt()  { return createdAt; }
    public synchronized RunState   getState()      { return state; }
    public synchronized CaseRecord record()        { return record; }
    public synchronized Instant    getUpdatedAt()  { return updatedAt; }
    public synchronized Instant    getFinishedAt() { return finishedAt; }

    public synchronized RunStatus status() {
        return new RunStatus(runId, state, activeStage, record, failureReason, failureDetail,
                cancelRequested, createdAt, updatedAt);
    }

    public synchronized RunOutcome outcome() {
        if (!state.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " has not finished (state=" + state + ")");
        }
        return new RunOutcome(runId, state, record, failureReason, failureDetail);
    }
}
