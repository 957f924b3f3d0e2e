package com.carepilot.orchestrator.model;

import java.util.List;

/**
 * Snippets used to ground the most recent stage's reasoning, together with
 * the query that retrieved them.
 */
public record KnowledgeContext(String query, List<KnowledgeSnippet> snippets) {

    private static final KnowledgeContext EMPTY = new KnowledgeContext("", List.of());

    public KnowledgeContext {
        query    = query == null ? "" : query;
        snippets = snippets == null ? List.of() : List.copyOf(snippets);
    }

    public static KnowledgeContext empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return snippets.isEmpty();
    }

    /**
     * Render the snippets as the REFERENCE KNOWLEDGE block of a prompt.
     * Each snippet is tagged with its source id so the model can cite it.
     */
    public String toPromptBlock() {
        if (snippets.isEmpty()) {
            return "(no reference material retrieved)";
        }
        StringBuilder sb = new StringBuilder();
        for (KnowledgeSnippet s : snippets) {
            sb.append("[").append(s.sourceId()).append("] ").append(s.text().strip()).append("\n");
        }
        return sb.toString().stripTrailing();
    }
}
