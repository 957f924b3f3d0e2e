package com.carepilot.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * All tunables of the case pipeline, bound once from {@code carepilot.pipeline.*}
 * and passed explicitly to the orchestrator and the stage agents.
 *
 * Nothing here is mutable; tests build an instance with {@link #defaults()}
 * and override single sections through the record constructors.
 */
@ConfigurationProperties(prefix = "carepilot.pipeline")
public record PipelineSettings(
        Retry     retry,
        Timeouts  timeouts,
        Model     model,
        Knowledge knowledge,
        Imaging   imaging,
        Runs      runs
) {
    public PipelineSettings {
        Objects.requireNonNull(retry, "retry");
        Objects.requireNonNull(timeouts, "timeouts");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(knowledge, "knowledge");
        Objects.requireNonNull(imaging, "imaging");
        Objects.requireNonNull(runs, "runs");
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(
                new Retry(3, Duration.ofMillis(500), Duration.ofSeconds(8)),
                new Timeouts(Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(90)),
                new Model("llama-3.3-70b-versatile", 0.7, 0.0, 2048),
                new Knowledge(5, 0.1),
                new Imaging(
                        List.of(new ImagingIndication("pneumonia", "X-RAY", "CHEST")),
                        new Study("X-RAY", "CHEST"),
                        List.of("Normal", "Pneumonia"),
                        "Normal",
                        0.8),
                new Runs(4, Duration.ofHours(1)));
    }

    public PipelineSettings withRetry(Retry retry) {
        return new PipelineSettings(retry, timeouts, model, knowledge, imaging, runs);
    }

    public PipelineSettings withTimeouts(Timeouts timeouts) {
        return new PipelineSettings(retry, timeouts, model, knowledge, imaging, runs);
    }

    // ------------------------------------------------------------------
    // Sections
    // ------------------------------------------------------------------

    /**
     * @param budget         maximum attempts per stage for transient failures
     * @param initialBackoff delay before the second attempt; doubles per attempt
     * @param maxBackoff     upper bound on a single delay
     */
    public record Retry(int budget, Duration initialBackoff, Duration maxBackoff) {
        public Retry {
            if (budget < 1) {
                throw new IllegalArgumentException("retry budget must be at least 1, got " + budget);
            }
        }

        /** Delay after the given failed attempt (1-based). */
        public Duration backoffAfter(int attempt) {
            long factor = 1L << Math.min(Math.max(attempt - 1, 0), 20);
            Duration delay = initialBackoff.multipliedBy(factor);
            return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
        }
    }

    /**
     * @param retrieval   one KnowledgeRetriever query
     * @param preparation a stage's preparatory work (image pre-validation)
     * @param stage       one StageAgent process call, including its external calls
     */
    public record Timeouts(Duration retrieval, Duration preparation, Duration stage) {}

    /** Generation parameters; strictTemperature is used for the structural retry. */
    public record Model(String name, double temperature, double strictTemperature, int maxTokens) {}

    public record Knowledge(int topK, double minRelevance) {}

    /**
     * @param indications          conditions that trigger an imaging order
     * @param classifierStudy      the only study the classifier can read
     * @param labels               the classifier's fixed label set
     * @param normalLabel          the label meaning "nothing abnormal found"
     * @param escalationConfidence abnormal findings at or above this confidence raise urgency to HIGH
     */
    public record Imaging(List<ImagingIndication> indications, Study classifierStudy, List<String> labels,
                          String normalLabel, double escalationConfidence) {
        public Imaging {
            Objects.requireNonNull(classifierStudy, "imaging.classifier-study");
            indications = indications == null ? List.of() : List.copyOf(indications);
            labels      = labels == null ? List.of() : List.copyOf(labels);
        }

        public boolean classifies(String modality, String bodyRegion) {
            return classifierStudy.modality().equalsIgnoreCase(modality)
                    && classifierStudy.bodyRegion().equalsIgnoreCase(bodyRegion);
        }

        /** The canonical spelling of a label from the fixed set, matched case-insensitively. */
        public Optional<String> canonicalLabel(String label) {
            if (label == null) return Optional.empty();
            return labels.stream().filter(l -> l.equalsIgnoreCase(label.strip())).findFirst();
        }

        public boolean isNormal(String label) {
            return normalLabel != null && normalLabel.equalsIgnoreCase(label);
        }
    }

    public record Study(String modality, String bodyRegion) {}

    /** A condition that, when it heads the differential, warrants imaging. */
    public record ImagingIndication(String condition, String modality, String bodyRegion) {
        public boolean matches(String text) {
            return text != null && text.toLowerCase(Locale.ROOT).contains(condition.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * @param workers   concurrent case runs
     * @param retention how long finished runs stay queryable
     */
    public record Runs(int workers, Duration retention) {}
}
