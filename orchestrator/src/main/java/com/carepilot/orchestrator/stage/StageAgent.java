package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.KnowledgeContext;
import com.carepilot.orchestrator.model.StageName;

import java.util.Optional;

/**
 * One clinical processing step.
 *
 * Implementations are pure functions of their inputs: given the same record,
 * context and collaborator responses they return an equal record, and they
 * never mutate shared state. That is what makes a retried or replayed stage
 * safe: nothing is applied until the orchestrator adopts the returned record.
 *
 * The orchestrator drives each attempt as:
 *   1. {@link #knowledgeQuery}: build the retrieval query from the record
 *   2. retrieval and {@link #prepare} run concurrently; both must finish
 *   3. {@link #process} with the retrieved context
 */
public interface StageAgent {

    StageName stage();

    /**
     * Query for grounding snippets, derived from the current record.
     * Empty means this stage does not retrieve and gets an empty context.
     */
    Optional<String> knowledgeQuery(CaseRecord record);

    /**
     * Independent preparatory checks that can overlap with retrieval.
     *
     * @throws StageException if the record or its attachments cannot be processed
     */
    default void prepare(CaseRecord record) {}

    /**
     * Produce the next version of the record.
     *
     * @throws StageException on precondition violations and collaborator failures;
     *                        never returns a defaulted record in place of an error
     */
    CaseRecord process(CaseRecord record, KnowledgeContext context, PromptMode mode);

    default CaseRecord process(CaseRecord record, KnowledgeContext context) {
        return process(record, context, PromptMode.STANDARD);
    }
}
