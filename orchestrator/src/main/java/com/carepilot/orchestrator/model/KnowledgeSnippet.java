package com.carepilot.orchestrator.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A retrieved reference passage. Immutable once retrieved.
 *
 * @param relevance similarity score in [0, 1]; higher is more relevant
 */
public record KnowledgeSnippet(String sourceId, String text, double relevance) {

    /** Descending relevance, ties broken by source id ascending. */
    public static final Comparator<KnowledgeSnippet> BY_RELEVANCE =
            Comparator.comparingDouble(KnowledgeSnippet::relevance).reversed()
                      .thenComparing(KnowledgeSnippet::sourceId);

    public KnowledgeSnippet {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(text, "text");
    }
}
