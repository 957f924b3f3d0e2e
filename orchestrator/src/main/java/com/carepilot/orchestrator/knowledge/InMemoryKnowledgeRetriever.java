package com.carepilot.orchestrator.knowledge;

import com.carepilot.orchestrator.model.KnowledgeSnippet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * In-process knowledge store scored by token overlap.
 *
 * Each document is reduced to its set of content tokens (lower case,
 * alphanumeric, stop words removed). Relevance is the cosine similarity of
 * the query and document token sets:
 *
 *   |Q ∩ D| / sqrt(|Q| * |D|)
 *
 * which lies in [0, 1]. Documents below {@code minRelevance} are dropped.
 * Ordering is descending relevance then source id, so results are stable
 * across calls and across JVMs.
 *
 * The document list is fixed at construction; the class is immutable and
 * safe to share between concurrent runs.
 */
public class InMemoryKnowledgeRetriever implements KnowledgeRetriever {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKnowledgeRetriever.class);

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "have",
            "in", "is", "it", "its", "no", "not", "of", "on", "or", "that", "the", "this",
            "to", "was", "were", "which", "with", "without");

    /** A stored reference document. */
    public record Document(String sourceId, String topic, String text) {}

    private record Indexed(Document doc, Set<String> tokens) {}

    private final List<Indexed> index;
    private final double        minRelevance;

    public InMemoryKnowledgeRetriever(List<Document> documents, double minRelevance) {
        if (minRelevance < 0.0 || minRelevance > 1.0) {
            throw new IllegalArgumentException("minRelevance must be in [0, 1], got " + minRelevance);
        }
        List<Indexed> built = new ArrayList<>(documents.size());
        for (Document d : documents) {
            built.add(new Indexed(d, tokenize(Objects.toString(d.topic(), "") + " " + d.text())));
        }
        this.index        = List.copyOf(built);
        this.minRelevance = minRelevance;
        log.info("Knowledge store indexed {} documents (minRelevance={})", index.size(), minRelevance);
    }

    @Override
    public List<KnowledgeSnippet> query(String text, int k) {
        if (k <= 0 || text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> queryTokens = tokenize(text);
        if (queryTokens.isEmpty()) {
            return List.of();
        }

        List<KnowledgeSnippet> scored = new ArrayList<>();
        for (Indexed entry : index) {
            double score = cosine(queryTokens, entry.tokens());
            if (score > 0.0 && score >= minRelevance) {
                scored.add(new KnowledgeSnippet(entry.doc().sourceId(), entry.doc().text(), score));
            }
        }
        scored.sort(KnowledgeSnippet.BY_RELEVANCE);
        List<KnowledgeSnippet> top = List.copyOf(scored.subList(0, Math.min(k, scored.size())));
        log.debug("Query '{}' matched {} documents, returning {}", text, scored.size(), top.size());
        return top;
    }

    public int size() {
        return index.size();
    }

    // ------------------------------------------------------------------
    // Scoring
    // ------------------------------------------------------------------

    static Set<String> tokenize(String text) {
        Set<String> tokens = new HashSet<>();
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (raw.length() > 1 && !STOP_WORDS.contains(raw)) {
                tokens.add(raw);
            }
        }
        return tokens;
    }

    private static double cosine(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger  = smaller == a ? b : a;
        int overlap = 0;
        for (String t : smaller) {
            if (larger.contains(t)) overlap++;
        }
        return overlap / Math.sqrt((double) a.size() * b.size());
    }
}
