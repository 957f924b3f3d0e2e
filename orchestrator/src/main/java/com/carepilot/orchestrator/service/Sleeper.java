package com.carepilot.orchestrator.service;

import java.time.Duration;

/** Backoff delay between stage attempts. Tests pass a no-op. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return d -> Thread.sleep(d.toMillis());
    }
}
