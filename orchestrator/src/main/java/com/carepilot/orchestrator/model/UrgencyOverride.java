package com.carepilot.orchestrator.model;

import java.util.Objects;

/**
 * Explicit record of a stage lowering the case urgency.
 * Without one, urgency may only stay the same or rise between stages.
 */
public record UrgencyOverride(UrgencyLevel from, UrgencyLevel to, String reason) {

    public UrgencyOverride {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("an urgency override needs a reason");
        }
    }
}
