package com.carepilot.orchestrator.stage;

import com.carepilot.orchestrator.inference.InferenceException;
import com.carepilot.orchestrator.knowledge.RetrievalException;
import com.carepilot.orchestrator.model.ErrorCategory;
import com.carepilot.orchestrator.model.FailureReason;
import com.carepilot.orchestrator.model.StageName;
import com.carepilot.orchestrator.vision.ClassifierException;

import java.util.List;

/**
 * A typed stage failure. The {@link FailureReason} fixes the
 * {@link ErrorCategory}, which in turn decides whether the orchestrator
 * retries, retries with a stricter prompt, or fails the run.
 *
 * Collaborator exceptions are translated here, at the stage boundary, so the
 * orchestrator only ever deals with this one type.
 */
public class StageException extends RuntimeException {

    private final StageName     stage;
    private final FailureReason reason;

    public StageException(StageName stage, FailureReason reason, String message) {
        super("[" + stage + "/" + reason + "] " + message);
        this.stage  = stage;
        this.reason = reason;
    }

    public StageException(StageName stage, FailureReason reason, String message, Throwable cause) {
        super("[" + stage + "/" + reason + "] " + message, cause);
        this.stage  = stage;
        this.reason = reason;
    }

    public StageName     getStage()  { return stage; }
    public FailureReason getReason() { return reason; }
    public ErrorCategory category()  { return reason.category(); }

    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    public static StageException precondition(StageName stage, String message) {
        return new StageException(stage, FailureReason.PRECONDITION_VIOLATED, message);
    }

    public static StageException malformed(StageName stage, String what, List<String> violations) {
        return new StageException(stage, FailureReason.MALFORMED_OUTPUT,
                what + " failed validation: " + String.join("; ", violations));
    }

    public static StageException from(StageName stage, InferenceException e) {
        FailureReason reason = switch (e.getKind()) {
            case TIMEOUT          -> FailureReason.TIMEOUT;
            case RATE_LIMITED     -> FailureReason.RATE_LIMITED;
            case UNAVAILABLE      -> FailureReason.UNAVAILABLE;
            case MALFORMED_OUTPUT -> FailureReason.MALFORMED_OUTPUT;
            case REJECTED         -> FailureReason.REQUEST_REJECTED;
        };
        return new StageException(stage, reason, "Inference failed: " + e.getMessage(), e);
    }

    public static StageException from(StageName stage, ClassifierException e) {
        FailureReason reason = switch (e.getKind()) {
            case UNAVAILABLE        -> FailureReason.UNAVAILABLE;
            case UNSUPPORTED_FORMAT -> FailureReason.UNSUPPORTED_FORMAT;
        };
        return new StageException(stage, reason, "Classification failed: " + e.getMessage(), e);
    }

    public static StageException from(StageName stage, RetrievalException e) {
        return new StageException(stage, FailureReason.UNAVAILABLE,
                "Knowledge retrieval failed: " + e.getMessage(), e);
    }
}
