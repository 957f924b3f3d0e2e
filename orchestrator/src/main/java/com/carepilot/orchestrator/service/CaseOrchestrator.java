package com.carepilot.orchestrator.service;

import com.carepilot.orchestrator.config.PipelineSettings;
import com.carepilot.orchestrator.model.CaseIntake;
import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.CaseRun;
import com.carepilot.orchestrator.model.ErrorCategory;
import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.RunOutcome;
import com.carepilot.orchestrator.model.RunState;
import com.carepilot.orchestrator.model.StageHistoryEntry;
import com.carepilot.orchestrator.model.StageName;
import com.carepilot.orchestrator.model.StageOutcome;
import com.carepilot.orchestrator.model.UrgencyOverride;
import com.carepilot.orchestrator.stage.PromptMode;
import com.carepilot.orchestrator.stage.StageAgent;
import com.carepilot.orchestrator.stage.StageException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The state machine that drives one case through the stages.
 *
 * For each stage the orchestrator:
 *   1. checks for cancellation
 *   2. runs one attempt through {@link StageExecutor}
 *   3. validates the result against the current record
 *   4. commits the result with a SUCCEEDED entry, or records RETRIED/FAILED
 *
 * Retry policy by error category:
 *   TRANSIENT     up to retry.budget attempts, exponential backoff between them
 *   STRUCTURAL    one extra attempt with the strict prompt, then FAILED
 *   PRECONDITION  FAILED immediately
 *   FATAL         FAILED immediately
 *
 * Every attempt appends exactly one history entry; nothing is overwritten.
 */
public class CaseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CaseOrchestrator.class);

    private final Map<StageName, StageAgent> agents = new EnumMap<>(StageName.class);
    private final StageExecutor              executor;
    private final RecordValidator            validator;
    private final PipelineSettings.Retry     retry;
    private final Sleeper                    sleeper;
    private final Clock                      clock;
    private final MeterRegistry              meters;

    public CaseOrchestrator(List<StageAgent> stageAgents,
                            StageExecutor executor,
                            RecordValidator validator,
                            PipelineSettings settings,
                            Sleeper sleeper,
                            Clock clock,
                            MeterRegistry meters) {
        for (StageAgent agent : stageAgents) {
            if (agents.put(agent.stage(), agent) != null) {
                throw new IllegalArgumentException("Two agents registered for " + agent.stage());
            }
        }
        for (StageName stage : StageName.values()) {
            if (!agents.containsKey(stage)) {
                throw new IllegalArgumentException("No agent registered for " + stage);
            }
        }
        this.executor  = executor;
        this.validator = validator;
        this.retry     = settings.retry();
        this.sleeper   = sleeper;
        this.clock     = clock;
        this.meters    = meters;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /** Run a case synchronously from a bare complaint. */
    public RunOutcome run(String complaint) {
        return run(CaseIntake.of(complaint));
    }

    /** Run a case synchronously and return its outcome. */
    public RunOutcome run(CaseIntake intake) {
        CaseRun run = new CaseRun(UUID.randomUUID().toString(), intake, clock.instant());
        execute(run);
        return run.outcome();
    }

    /**
     * Drive an existing run until it reaches a terminal state.
     * Called on a worker thread by {@link CaseRunService}.
     */
    public void execute(CaseRun run) {
        MDC.put("runId", run.getRunId());
        try {
            log.info("Case run {} started", run.getRunId());
            RunState state = run.getState();
            while (!state.isTerminal()) {
                RunState next = StageTransitions.next(state, run.record());
                if (next == RunState.COMPLETED) {
                    run.complete(clock.instant());
                    break;
                }
                if (!executeStage(run, next.activeStage())) {
                    break;
                }
                state = run.getState();
            }
            RunState finalState = run.getState();
            meters.counter("carepilot.runs.finished", "state", finalState.name()).increment();
            log.info("Case run {} finished in state {}", run.getRunId(), finalState);
        } finally {
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // One stage, all attempts
    // ------------------------------------------------------------------

    /** @return true when the stage succeeded and the run can advance */
    private boolean executeStage(CaseRun run, StageName stage) {
        StageAgent agent = agents.get(stage);
        MDC.put("stage", stage.name());
        run.beginStage(stage, clock.instant());
        int attempt           = 0;
        int transientFailures = 0;
        boolean strictUsed    = false;
        PromptMode mode       = PromptMode.STANDARD;
        try {
            while (true) {
                if (run.isCancelRequested()) {
                    run.endStage(stage);
                    run.cancelled(clock.instant());
                    log.info("Case run {} cancelled before {} attempt {}", run.getRunId(), stage, attempt + 1);
                    return false;
                }
                attempt++;
                MDC.put("attempt", String.valueOf(attempt));

                CaseRecord base = run.record();
                StageException failure;
                Timer.Sample sample = Timer.start(meters);
                try {
                    CaseRecord result = executor.execute(agent, base, mode);
                    validator.validate(stage, base, result);
                    adopt(run, stage, base, result, attempt);
                    return true;
                } catch (StageException e) {
                    failure = e;
                } catch (RuntimeException e) {
                    log.error("Unexpected error in {} attempt {}: {}", stage, attempt, e.getMessage(), e);
                    failure = new StageException(stage, FailureReason.INTERNAL_ERROR, e.toString(), e);
                } finally {
                    sample.stop(meters.timer("carepilot.stage.duration", "stage", stage.name()));
                }

                ErrorCategory category = failure.category();
                boolean retryable = switch (category) {
                    case TRANSIENT  -> ++transientFailures < retry.budget();
                    case STRUCTURAL -> !strictUsed;
                    default         -> false;
                };

                if (!retryable) {
                    record(run, base, StageHistoryEntry.failed(stage, clock.instant(), attempt,
                            failure.getReason(), failure.getMessage()));
                    run.endStage(stage);
                    run.fail(failure.getReason(), failure.getMessage(), clock.instant());
                    log.error("{} failed permanently on attempt {} ({}): {}",
                            stage, attempt, failure.getReason(), failure.getMessage());
                    return false;
                }

                record(run, base, StageHistoryEntry.retried(stage, clock.instant(), attempt,
                        failure.getReason(), failure.getMessage()));
                if (category == ErrorCategory.STRUCTURAL) {
                    strictUsed = true;
                    mode       = PromptMode.STRICT;
                    log.warn("{} attempt {} produced malformed output, retrying with strict prompt: {}",
                            stage, attempt, failure.getMessage());
                } else {
                    Duration delay = retry.backoffAfter(transientFailures);
                    log.warn("{} attempt {} failed ({}), retrying in {} ms",
                            stage, attempt, failure.getReason(), delay.toMillis());
                    if (!backoff(delay)) {
                        run.endStage(stage);
                        run.cancelled(clock.instant());
                        return false;
                    }
                }
            }
        } finally {
            MDC.remove("stage");
            MDC.remove("attempt");
        }
    }

    /** Commit a validated result with its SUCCEEDED entry, moving any pending override onto that entry. */
    private void adopt(CaseRun run, StageName stage, CaseRecord base, CaseRecord result, int attempt) {
        UrgencyOverride override = result.pendingOverride();
        if (override != null) {
            log.warn("{} lowered urgency {} -> {}: {}", stage, override.from(), override.to(), override.reason());
        }
        CaseRecord adopted = result.toBuilder()
                .pendingOverride(null)
                .build()
                .withHistoryEntry(StageHistoryEntry.succeeded(stage, clock.instant(), attempt, override));
        run.commit(base, adopted, clock.instant());
        run.endStage(stage);
        count(stage, StageOutcome.SUCCEEDED);
        log.info("{} succeeded on attempt {}", stage, attempt);
    }

    private void record(CaseRun run, CaseRecord base, StageHistoryEntry entry) {
        run.commit(base, base.withHistoryEntry(entry), clock.instant());
        count(entry.stage(), entry.outcome());
    }

    private void count(StageName stage, StageOutcome outcome) {
        meters.counter("carepilot.stage.attempts", "stage", stage.name(), "outcome", outcome.name()).increment();
    }

    /** @return false if the worker was interrupted while waiting */
    private boolean backoff(Duration delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during backoff, cancelling run");
            return false;
        }
    }
}
