package com.openforge.mnemo.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mnemo.llm.model.ChatRequest;
import com.openforge.mnemo.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Stateless chat-completion client for one OpenAI-compatible provider.
 *
 * Blocking by design: the engines call it from their own worker threads and
 * wait for the whole reply.
 */
@Slf4j
public class LlmClient {

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public ChatResponse chat(ChatRequest request) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()));
        }
        String requestBody = serialize(request);
        log.debug("[LlmClient:{}] → chat POST body-length={}", config.name(), requestBody.length());

        HttpResponse<String> httpResponse = sendBlocking(buildHttpRequest(requestBody));
        return parseFullResponse(httpResponse);
    }

    /** The model name configured for this provider (e.g. "gpt-4o"). */
    public String modelName() {
        return config.model();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]".formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted calling provider [%s]".formatted(config.name()), e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException(
                "Rate-limited by provider [%s].".formatted(config.name()));
        if (status < 200 || status >= 300) throw new LlmException(
                "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, body));

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]: %s".formatted(config.name(), body), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
