package com.carepilot.orchestrator.inference;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around an OpenAI-compatible chat-completions endpoint
 * (Groq by default).
 *
 * Every call asks for {@code response_format = json_object} and returns the
 * parsed object. HTTP and transport failures are mapped onto
 * {@link InferenceException.Kind} so the orchestrator's retry policy can act
 * on them without looking at status codes:
 *
 *   429                        → RATE_LIMITED
 *   5xx, connect fail          → UNAVAILABLE
 *   408, 504, request timeout  → TIMEOUT
 *   reply not JSON             → MALFORMED_OUTPUT
 *   400 json_validate_failed   → MALFORMED_OUTPUT
 *   other 4xx (bad key, etc.)  → REJECTED
 *
 * Uses java.net.http.HttpClient directly so every header and byte on the
 * wire is visible when debugging a stage.
 */
@Component
public class GroqInferenceClient implements InferenceClient {

    private static final Logger log = LoggerFactory.getLogger(GroqInferenceClient.class);

    private static final String JSON_VALIDATE_FAILED = "json_validate_failed";

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** A single chat message; role is "system" or "user". */
    public record Message(String role, String content) {}

    /** The subset of the completion response we read. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompletionResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(ChoiceMessage message, String finish_reason) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ChoiceMessage(String role, String content) {}

        /** Text of the first choice, or null when the service returned none. */
        public String firstContent() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
                return null;
            }
            return choices.get(0).message().content();
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final Duration     requestTimeout;

    public GroqInferenceClient(@Value("${carepilot.inference.base-url}") String baseUrl,
                               @Value("${carepilot.inference.api-key:}") String apiKey,
                               @Value("${carepilot.inference.request-timeout:60s}") Duration requestTimeout,
                               ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl;
        this.apiKey         = apiKey;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // InferenceClient
    // -------------------------------------------------------------------------

    @Override
    public JsonNode generate(InferenceRequest request) {
        String body = requestBody(request);

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .timeout(requestTimeout)
                .header("Content-Type",  "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new InferenceException(InferenceException.Kind.TIMEOUT,
                    "No response within " + requestTimeout, e);
        } catch (ConnectException e) {
            throw new InferenceException(InferenceException.Kind.UNAVAILABLE,
                    "Cannot connect to " + baseUrl, e);
        } catch (IOException e) {
            throw new InferenceException(InferenceException.Kind.UNAVAILABLE,
                    "Transport error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException(InferenceException.Kind.UNAVAILABLE, "Interrupted", e);
        }

        int status = response.statusCode();
        if (status == 429) {
            throw new InferenceException(InferenceException.Kind.RATE_LIMITED,
                    "Rate limited: " + response.body());
        }
        if (status == 408 || status == 504) {
            throw new InferenceException(InferenceException.Kind.TIMEOUT,
                    "HTTP " + status + ": " + response.body());
        }
        if (status >= 500) {
            throw new InferenceException(InferenceException.Kind.UNAVAILABLE,
                    "HTTP " + status + ": " + response.body());
        }
        if (status == 400 && JSON_VALIDATE_FAILED.equals(errorCode(response.body()))) {
            // The model's reply failed the server-side JSON check.
            throw new InferenceException(InferenceException.Kind.MALFORMED_OUTPUT,
                    "HTTP 400 " + JSON_VALIDATE_FAILED + ": " + response.body());
        }
        if (status != 200) {
            throw new InferenceException(InferenceException.Kind.REJECTED,
                    "HTTP " + status + ": " + response.body());
        }
        return parseContent(response.body(), request.schema().name());
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private String errorCode(String body) {
        try {
            return json.readTree(body).at("/error/code").asText("");
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
            return "";
        }
    }

    private String requestBody(InferenceRequest request) {
        ModelParameters p = request.parameters();
        try {
            return json.writeValueAsString(Map.of(
                    "model",           p.model(),
                    "temperature",     p.temperature(),
                    "max_tokens",      p.maxTokens(),
                    "response_format", Map.of("type", "json_object"),
                    "messages",        List.of(
                            new Message("system", request.systemPrompt()),
                            new Message("user",   request.userPrompt()))
            ));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise inference request", e);
        }
    }

    private JsonNode parseContent(String responseBody, String schemaName) {
        String content;
        try {
            content = json.readValue(responseBody, CompletionResponse.class).firstContent();
        } catch (JsonProcessingException e) {
            throw new InferenceException(InferenceException.Kind.UNAVAILABLE,
                    "Unreadable completion envelope", e);
        }
        if (content == null) {
            throw new InferenceException(InferenceException.Kind.MALFORMED_OUTPUT,
                    "Completion for " + schemaName + " has no content");
        }

        String objectText = StructuredOutputParser.extractJsonObject(content)
                .orElseThrow(() -> new InferenceException(InferenceException.Kind.MALFORMED_OUTPUT,
                        "No JSON object in completion for " + schemaName));
        try {
            JsonNode node = json.readTree(objectText);
            log.debug("Completion for {} parsed ({} chars)", schemaName, objectText.length());
            return node;
        } catch (JsonProcessingException e) {
            throw new InferenceException(InferenceException.Kind.MALFORMED_OUTPUT,
                    "Invalid JSON in completion for " + schemaName + ": " + e.getOriginalMessage(), e);
        }
    }
}
