package com.carepilot.orchestrator.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * One entry of the differential diagnosis.
 *
 * @param condition  name of the suspected condition
 * @param confidence model confidence in [0, 1]
 * @param rationale  supporting reasoning text
 */
public record ConditionHypothesis(String condition, double confidence, String rationale) {

    /** Descending confidence, ties broken by condition name so ordering is stable. */
    public static final Comparator<ConditionHypothesis> BY_CONFIDENCE =
            Comparator.comparingDouble(ConditionHypothesis::confidence).reversed()
                      .thenComparing(ConditionHypothesis::condition);

    public ConditionHypothesis {
        Objects.requireNonNull(condition, "condition");
        if (condition.isBlank()) {
            throw new IllegalArgumentException("condition must not be blank");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        rationale = rationale == null ? "" : rationale;
    }

    /** Case-insensitive check whether this hypothesis names or discusses the given term. */
    public boolean mentions(String term) {
        String needle = term.toLowerCase(Locale.ROOT);
        return condition.toLowerCase(Locale.ROOT).contains(needle)
            || rationale.toLowerCase(Locale.ROOT).contains(needle);
    }
}
