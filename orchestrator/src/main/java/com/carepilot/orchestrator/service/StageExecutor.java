package com.carepilot.orchestrator.service;

import com.carepilot.orchestrator.config.PipelineSettings;
import com.carepilot.orchestrator.knowledge.KnowledgeRetriever;
import com.carepilot.orchestrator.knowledge.RetrievalException;
import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.KnowledgeContext;
import com.carepilot.orchestrator.model.KnowledgeSnippet;
import com.carepilot.orchestrator.model.StageName;
import com.carepilot.orchestrator.stage.PromptMode;
import com.carepilot.orchestrator.stage.StageAgent;
import com.carepilot.orchestrator.stage.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one attempt of one stage against the collaborator pool.
 *
 *   1. knowledge retrieval and the stage's preparation are submitted together
 *   2. both are awaited, each bounded by its own timeout
 *   3. process() is submitted with the retrieved context and bounded by the stage timeout
 *
 * A timed-out task is not interrupted. It may still finish in the background;
 * its result is never returned, so it cannot be applied to the case.
 */
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final KnowledgeRetriever         retriever;
    private final ExecutorService            collaborators;
    private final PipelineSettings.Timeouts  timeouts;
    private final int                        topK;

    public StageExecutor(KnowledgeRetriever retriever, ExecutorService collaborators, PipelineSettings settings) {
        this.retriever     = retriever;
        this.collaborators = collaborators;
        this.timeouts      = settings.timeouts();
        this.topK          = settings.knowledge().topK();
    }

    /**
     * @throws StageException for every failure, including timeouts and
     *                        unexpected exceptions inside the stage
     */
    public CaseRecord execute(StageAgent agent, CaseRecord record, PromptMode mode) {
        StageName stage = agent.stage();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        Optional<String> query = agent.knowledgeQuery(record);
        Future<KnowledgeContext> retrieval = query.isPresent()
                ? collaborators.submit(withMdc(mdc, () -> retrieve(query.get())))
                : CompletableFuture.completedFuture(KnowledgeContext.empty());
        Future<Void> preparation = collaborators.submit(StageExecutor.<Void>withMdc(mdc, () -> {
            agent.prepare(record);
            return null;
        }));

        // Preparation errors (preconditions, bad images) outrank retrieval errors.
        await(stage, preparation, timeouts.preparation(), "preparation");
        KnowledgeContext context = await(stage, retrieval, timeouts.retrieval(), "knowledge retrieval");

        Future<CaseRecord> processing = collaborators.submit(withMdc(mdc, () -> agent.process(record, context, mode)));
        return await(stage, processing, timeouts.stage(), "stage processing");
    }

    private KnowledgeContext retrieve(String query) {
        List<KnowledgeSnippet> snippets = retriever.query(query, topK);
        log.debug("Retrieved {} snippets for '{}'", snippets.size(), query);
        return new KnowledgeContext(query, snippets);
    }

    private static <T> T await(StageName stage, Future<T> future, Duration timeout, String what) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new StageException(stage, FailureReason.TIMEOUT, what + " exceeded " + timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageException(stage, FailureReason.INTERNAL_ERROR, what + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StageException se) {
                throw se;
            }
            if (cause instanceof RetrievalException re) {
                throw StageException.from(stage, re);
            }
            throw new StageException(stage, FailureReason.INTERNAL_ERROR,
                    what + " threw " + cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
    }

    private static <T> Callable<T> withMdc(Map<String, String> mdc,
                                              Callable<T> task) {
        return () -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }
}
