package com.carepilot.orchestrator.knowledge;

import com.carepilot.orchestrator.model.KnowledgeSnippet;

import java.util.List;

/**
 * Query contract of the clinical knowledge store.
 *
 * Implementations must be deterministic: the same (text, k) against an
 * unchanged store returns the same list in the same order.
 */
public interface KnowledgeRetriever {

    /**
     * Return at most {@code k} snippets by descending relevance, ties broken by
     * source id ascending. Returns an empty list, not an error, when nothing
     * clears the store's minimum relevance.
     *
     * @throws RetrievalException if the store cannot be queried at all
     */
    List<KnowledgeSnippet> query(String text, int k);
}
