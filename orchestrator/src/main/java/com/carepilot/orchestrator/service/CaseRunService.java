package com.carepilot.orchestrator.service;

import com.carepilot.orchestrator.model.CaseIntake;
import com.carepilot.orchestrator.model.CaseRun;
import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.RunOutcome;
import com.carepilot.orchestrator.model.RunStatus;
import com.carepilot.orchestrator.model.StageHistoryEntry;
import com.carepilot.orchestrator.repository.CaseRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Asynchronous entry point for case runs.
 *
 * startRun() registers the run and hands it to a fixed worker pool, so the
 * number of concurrently executing cases is capped by carepilot.pipeline.runs.workers.
 * Everything else is a read or a cancellation flag on the stored run.
 */
@Service
public class CaseRunService {

    private static final Logger log = LoggerFactory.getLogger(CaseRunService.class);

    private final CaseRunRepository repository;
    private final CaseOrchestrator  orchestrator;
    private final ExecutorService   workers;
    private final Clock             clock;

    public CaseRunService(CaseRunRepository repository,
                          CaseOrchestrator orchestrator,
                          @Qualifier("caseWorkers") ExecutorService workers,
                          Clock clock) {
        this.repository   = repository;
        this.orchestrator = orchestrator;
        this.workers      = workers;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    public CaseRun startRun(CaseIntake intake) {
        CaseRun run = repository.save(
                new CaseRun(UUID.randomUUID().toString(), intake, clock.instant()));
        log.info("Case run {} queued", run.getRunId());

        workers.submit(() -> {
            try {
                orchestrator.execute(run);
            } catch (Exception e) {
                log.error("Unhandled error in case run {}: {}", run.getRunId(), e.getMessage(), e);
                if (!run.getState().isTerminal()) {
                    run.fail(FailureReason.INTERNAL_ERROR, "Unhandled exception: " + e.getMessage(), clock.instant());
                }
            }
        });
        return run;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<CaseRun> find(String runId) {
        return repository.findById(runId);
    }

    public Optional<RunStatus> getStatus(String runId) {
        return repository.findById(runId).map(CaseRun::status);
    }

    public Optional<List<StageHistoryEntry>> history(String runId) {
        return repository.findById(runId).map(run -> run.record().history());
    }

    /** The outcome of a finished run; empty while the run is unknown or still running. */
    public Optional<RunOutcome> outcome(String runId) {
        return repository.findById(runId)
                .filter(run -> run.getState().isTerminal())
                .map(CaseRun::outcome);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Request cancellation. Takes effect at the run's next stage boundary;
     * a stage call already in flight is allowed to finish or time out.
     */
    public Optional<RunStatus> cancel(String runId) {
        return repository.findById(runId).map(run -> {
            if (!run.getState().isTerminal()) {
                run.requestCancel();
                log.info("Cancellation requested for case run {}", runId);
            }
            return run.status();
        });
    }
}
