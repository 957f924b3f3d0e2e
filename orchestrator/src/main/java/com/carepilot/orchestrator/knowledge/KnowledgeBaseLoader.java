package com.carepilot.orchestrator.knowledge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the reference documents for {@link InMemoryKnowledgeRetriever} from a
 * JSON array of {@code {sourceId, topic, text}} objects.
 */
public final class KnowledgeBaseLoader {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseLoader.class);

    private static final TypeReference<List<InMemoryKnowledgeRetriever.Document>> DOC_LIST =
            new TypeReference<>() {};

    private KnowledgeBaseLoader() {}

    /**
     * @throws RetrievalException if the resource is missing, unreadable, or
     *                            contains duplicate source ids
     */
    public static List<InMemoryKnowledgeRetriever.Document> load(Resource resource, ObjectMapper json) {
        try (InputStream in = resource.getInputStream()) {
            List<InMemoryKnowledgeRetriever.Document> docs = json.readValue(in, DOC_LIST);
            Set<String> seen = new HashSet<>();
            for (InMemoryKnowledgeRetriever.Document d : docs) {
                if (d.sourceId() == null || d.text() == null) {
                    throw new RetrievalException("Knowledge document without sourceId or text in " + resource);
                }
                if (!seen.add(d.sourceId())) {
                    throw new RetrievalException("Duplicate sourceId '" + d.sourceId() + "' in " + resource);
                }
            }
            log.info("Loaded {} knowledge documents from {}", docs.size(), resource.getDescription());
            return docs;
        } catch (IOException e) {
            throw new RetrievalException("Cannot load knowledge base from " + resource.getDescription(), e);
        }
    }
}
