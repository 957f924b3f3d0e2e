package com.carepilot.orchestrator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordered triage urgency. Declaration order is severity order, so
 * {@link #compareTo} can be used directly for escalation checks.
 */
public enum UrgencyLevel {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL;

    public boolean isLowerThan(UrgencyLevel other) {
        return compareTo(other) < 0;
    }

    /** The more severe of the two levels; a null argument leaves this level unchanged. */
    public UrgencyLevel max(UrgencyLevel other) {
        return other == null || compareTo(other) >= 0 ? this : other;
    }

    /**
     * Parse a model-supplied urgency label. Accepts the enum names in any case
     * and "medium" as a synonym for MODERATE.
     */
    public static Optional<UrgencyLevel> fromLabel(String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        String normalized = label.strip().toUpperCase(Locale.ROOT);
        if (normalized.equals("MEDIUM")) return Optional.of(MODERATE);
        for (UrgencyLevel level : values()) {
            if (level.name().equals(normalized)) return Optional.of(level);
        }
        return Optional.empty();
    }
}
