package com.carepilot.orchestrator.config;

import com.carepilot.orchestrator.knowledge.InMemoryKnowledgeRetriever;
import com.carepilot.orchestrator.knowledge.KnowledgeBaseLoader;
import com.carepilot.orchestrator.knowledge.KnowledgeRetriever;
import com.carepilot.orchestrator.service.CaseOrchestrator;
import com.carepilot.orchestrator.service.RecordValidator;
import com.carepilot.orchestrator.service.Sleeper;
import com.carepilot.orchestrator.service.StageExecutor;
import com.carepilot.orchestrator.stage.StageAgent;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for the pipeline core. The core classes take everything through
 * their constructors; this is the only place that knows about Spring.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    /** One thread per concurrently executing case run. */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("caseWorkers")
    public ExecutorService caseWorkers(PipelineSettings settings) {
        return Executors.newFixedThreadPool(settings.runs().workers(), named("case-worker"));
    }

    /**
     * Retrieval, preparation and stage processing. Unbounded because a
     * timed-out call keeps its thread until it returns on its own.
     */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("collaborators")
    public ExecutorService collaborators() {
        return Executors.newCachedThreadPool(named("collaborator"));
    }

    @Bean
    public KnowledgeRetriever knowledgeRetriever(@Value("${carepilot.knowledge.location}") Resource location,
                                                 ObjectMapper objectMapper,
                                                 PipelineSettings settings) {
        List<InMemoryKnowledgeRetriever.Document> documents = KnowledgeBaseLoader.load(location, objectMapper);
        return new InMemoryKnowledgeRetriever(documents, settings.knowledge().minRelevance());
    }

    @Bean
    public StageExecutor stageExecutor(KnowledgeRetriever retriever,
                                       @Qualifier("collaborators") ExecutorService collaborators,
                                       PipelineSettings settings) {
        return new StageExecutor(retriever, collaborators, settings);
    }

    @Bean
    public RecordValidator recordValidator() {
        return new RecordValidator();
    }

    @Bean
    public CaseOrchestrator caseOrchestrator(List<StageAgent> agents,
                                             StageExecutor executor,
                                             RecordValidator validator,
                                             PipelineSettings settings,
                                             Sleeper sleeper,
                                             Clock clock,
                                             MeterRegistry meters) {
        return new CaseOrchestrator(agents, executor, validator, settings, sleeper, clock, meters);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
