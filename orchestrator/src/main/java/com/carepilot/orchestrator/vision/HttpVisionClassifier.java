package com.carepilot.orchestrator.vision;

import com.carepilot.orchestrator.model.MedicalImage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * HTTP client for an image-classification inference endpoint.
 *
 * Posts the raw image bytes and expects the usual classifier reply, a JSON
 * array of {@code {label, score}} objects (e.g. a ViT chest X-ray pneumonia
 * model behind a hosted inference API). The highest-scoring entry wins; its
 * label is mapped case-insensitively onto the expected label set.
 *
 *   415 / 400 → UNSUPPORTED_FORMAT
 *   anything else non-2xx, timeouts, transport errors → UNAVAILABLE
 *
 * A label that does not map onto the expected set is returned as-is; the
 * Imaging stage rejects it as malformed output.
 */
@Component
public class HttpVisionClassifier implements VisionClassifier {

    private static final Logger log = LoggerFactory.getLogger(HttpVisionClassifier.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LabelScore(String label, double score) {}

    private static final TypeReference<List<LabelScore>> LABEL_SCORES = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       endpoint;
    private final String       apiKey;
    private final Duration     requestTimeout;

    public HttpVisionClassifier(@Value("${carepilot.vision.endpoint}") String endpoint,
                                @Value("${carepilot.vision.api-key:}") String apiKey,
                                @Value("${carepilot.vision.request-timeout:30s}") Duration requestTimeout,
                                ObjectMapper objectMapper) {
        this.endpoint       = endpoint;
        this.apiKey         = apiKey;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public Classification classify(MedicalImage image, List<String> expectedLabels) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .timeout(requestTimeout)
                .header("Content-Type", "application/octet-stream")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(image.data()));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ClassifierException(ClassifierException.Kind.UNAVAILABLE,
                    "No response within " + requestTimeout, e);
        } catch (IOException e) {
            throw new ClassifierException(ClassifierException.Kind.UNAVAILABLE,
                    "Transport error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClassifierException(ClassifierException.Kind.UNAVAILABLE, "Interrupted", e);
        }

        int status = response.statusCode();
        if (status == 400 || status == 415) {
            throw new ClassifierException(ClassifierException.Kind.UNSUPPORTED_FORMAT,
                    "HTTP " + status + ": " + response.body());
        }
        if (status < 200 || status >= 300) {
            throw new ClassifierException(ClassifierException.Kind.UNAVAILABLE,
                    "HTTP " + status + ": " + response.body());
        }

        List<LabelScore> scores;
        try {
            scores = json.readValue(response.body(), LABEL_SCORES);
        } catch (JsonProcessingException e) {
            throw new ClassifierException(ClassifierException.Kind.UNAVAILABLE,
                    "Unreadable classifier response", e);
        }
        LabelScore top = scores.stream()
                .filter(s -> s.label() != null)
                .max(Comparator.comparingDouble(LabelScore::score))
                .orElseThrow(() -> new ClassifierException(ClassifierException.Kind.UNAVAILABLE,
                        "Classifier returned no labels"));

        String label = expectedLabels.stream()
                .filter(l -> l.equalsIgnoreCase(top.label().strip()))
                .findFirst()
                .orElse(top.label());
        log.info("Classified {} as '{}' ({})", image, label, top.score());
        return new Classification(label, top.score());
    }
}
