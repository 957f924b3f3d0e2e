package com.carepilot.orchestrator.repository;

import com.carepilot.orchestrator.model.CaseRun;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of case runs, keyed by run id.
 * Runs are lost on restart; nothing here is durable.
 */
@Repository
public class CaseRunRepository {

    private final Map<String, CaseRun> runs = new ConcurrentHashMap<>();

    public CaseRun save(CaseRun run) {
        runs.put(run.getRunId(), run);
        return run;
    }

    public Optional<CaseRun> findById(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public Collection<CaseRun> findAll() {
        return List.copyOf(runs.values());
    }

    /**
     * Remove terminal runs that finished before the cutoff.
     *
     * @return number of runs removed
     */
    public int deleteFinishedBefore(Instant cutoff) {
        int before = runs.size();
        runs.values().removeIf(run -> run.getState().isTerminal()
                && run.getFinishedAt() != null
                && run.getFinishedAt().isBefore(cutoff));
        return before - runs.size();
    }

    public int count() {
        return runs.size();
    }
}
