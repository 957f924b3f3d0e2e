package com.carepilot.orchestrator.service;

import com.carepilot.orchestrator.config.PipelineSettings;
import com.carepilot.orchestrator.repository.CaseRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Evicts finished runs once they are older than the retention window,
 * so the in-memory repository does not grow without bound.
 */
@Component
@EnableScheduling
public class CaseRunJanitor {

    private static final Logger log = LoggerFactory.getLogger(CaseRunJanitor.class);

    private final CaseRunRepository repository;
    private final Duration          retention;
    private final Clock             clock;

    public CaseRunJanitor(CaseRunRepository repository, PipelineSettings settings, Clock clock) {
        this.repository = repository;
        this.retention  = settings.runs().retention();
        this.clock      = clock;
    }

    @Scheduled(fixedDelay = 60_000)
    public void evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = repository.deleteFinishedBefore(cutoff);
        if (removed > 0) {
            log.info("Evicted {} finished case runs older than {}", removed, retention);
        }
    }
}
