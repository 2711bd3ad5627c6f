package com.openforge.mnemo.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Stateless embedding HTTP client for an OpenAI-compatible /embeddings endpoint.
 *
 * Raw {@link HttpClient} + Jackson, same as the chat client.
 */
@Slf4j
public class EmbeddingClient {

    private static final int MAX_INPUT_CHARS = 8000;

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * @return float vector, length = {@link EmbeddingProperties#dimensions()}
     */
    public List<Float> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        String input = truncate(text);
        log.debug("[Embed] → POST /embeddings model={} input-length={}", props.model(), input.length());
        return send(EmbeddingRequest.single(input, props.model(), props.dimensions())).get(0);
    }

    /**
     * One round trip for several texts.
     *
     * @return vectors in input order
     */
    public List<List<Float>> embedBatch(List<String> texts) {
        if (texts.isEmpty()) return List.of();
        if (texts.stream().anyMatch(t -> t == null || t.isBlank())) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        List<String> inputs = texts.stream().map(EmbeddingClient::truncate).toList();
        log.debug("[Embed] → POST /embeddings model={} batch={}", props.model(), inputs.size());
        List<List<Float>> vectors = send(EmbeddingRequest.batch(inputs, props.model(), props.dimensions()));
        if (vectors.size() != inputs.size()) {
            throw new EmbeddingException("Embedding API returned %d vectors for %d inputs"
                    .formatted(vectors.size(), inputs.size()));
        }
        return vectors;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<List<Float>> send(EmbeddingRequest request) {
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(serialize(request)))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling embedding API", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while calling embedding API", e);
        }
        return parseResponse(response);
    }

    private List<List<Float>> parseResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status == 429) throw new EmbeddingException("Embedding API rate-limited");
        if (status >= 400 && status < 500)
            throw new EmbeddingRejectedException("Embedding API rejected the request with HTTP %d: %s".formatted(status, body));
        if (status < 200 || status >= 300)
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, body));

        try {
            EmbeddingResponse resp = objectMapper.readValue(body, EmbeddingResponse.class);
            List<List<Float>> vectors = resp.embeddingsInOrder();
            log.debug("[Embed] ← {} vector(s) dim={}", vectors.size(), vectors.get(0).size());
            return vectors;
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new EmbeddingException("Failed to parse embedding response: " + body, e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }

    // Trim to a safe length to avoid exceeding model token limits
    private static String truncate(String text) {
        return text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class EmbeddingException extends RuntimeException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }

    /** A 4xx other than 429: bad input or credentials, the same request will fail again. */
    public static class EmbeddingRejectedException extends EmbeddingException {
        public EmbeddingRejectedException(String message) { super(message); }
    }
}
