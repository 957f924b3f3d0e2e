package com.carepilot.orchestrator.service;

import com.carepilot.orchestrator.model.CaseRecord;
import com.carepilot.orchestrator.model.RunState;

import java.util.List;
import java.util.function.Predicate;

/**
 * The pipeline's forward transitions as an explicit table.
 *
 *   CREATED          → INTAKE            always
 *   INTAKE           → EXAMINATION       once Intake succeeded
 *   EXAMINATION      → IMAGING           an imaging order and an image are present
 *   EXAMINATION      → REPORT_SYNTHESIS  no imaging order, or the image is still pending
 *   IMAGING          → REPORT_SYNTHESIS  once Imaging succeeded (normal findings included)
 *   REPORT_SYNTHESIS → COMPLETED         a final report is present
 *
 * FAILED and CANCELLED are reachable from every non-terminal state and are
 * not listed; the orchestrator takes them on error or cancellation.
 */
public final class StageTransitions {

    public record Transition(RunState from, RunState to, String guard, Predicate<CaseRecord> condition) {
        public boolean allows(CaseRecord record) {
            return condition.test(record);
        }
    }

    private static final List<Transition> TABLE = List.of(
            new Transition(RunState.CREATED, RunState.INTAKE, "always", r -> true),
            new Transition(RunState.INTAKE, RunState.EXAMINATION, "intake succeeded",
                    r -> r.urgency() != null),
            new Transition(RunState.EXAMINATION, RunState.IMAGING, "imaging ordered and image supplied",
                    StageTransitions::imageReady),
            new Transition(RunState.EXAMINATION, RunState.REPORT_SYNTHESIS, "no imaging order or image pending",
                    r -> !imageReady(r)),
            new Transition(RunState.IMAGING, RunState.REPORT_SYNTHESIS, "imaging succeeded",
                    r -> r.imagingFinding() != null),
            new Transition(RunState.REPORT_SYNTHESIS, RunState.COMPLETED, "report present",
                    r -> r.report() != null)
    );

    private StageTransitions() {}

    private static boolean imageReady(CaseRecord record) {
        return record.hasImagingOrder() && record.hasImage();
    }

    public static List<Transition> table() {
        return TABLE;
    }

    /**
     * The state that follows {@code from} for the given record.
     *
     * @throws IllegalStateException if no guarded transition applies; that is
     *                               an orchestration bug, not a stage failure
     */
    public static RunState next(RunState from, CaseRecord record) {
        for (Transition t : TABLE) {
            if (t.from() == from && t.allows(record)) {
                return t.to();
            }
        }
        throw new IllegalStateException("No transition from " + from + " for case " + record.caseId());
    }
}
