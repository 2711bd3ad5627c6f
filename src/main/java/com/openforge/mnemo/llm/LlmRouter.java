package com.openforge.mnemo.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mnemo.llm.model.ChatRequest;
import com.openforge.mnemo.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Supplier;

/**
 * High-availability LLM request router.
 *
 * Call graph:
 *
 *   chat(request)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primaryLlmClient.chat(request)
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallbackLlmClient.chat(request)
 *
 * If both providers fail the caller gets an {@link LlmClient.LlmException}.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this.primaryClient  = new LlmClient(httpClient, objectMapper, properties.primary());
        this.fallbackClient = new LlmClient(httpClient, objectMapper, properties.fallback());
        this.primaryCb      = primaryLlmCircuitBreaker;
        this.fallbackCb     = fallbackLlmCircuitBreaker;
        this.primaryRetry   = primaryLlmRetry;
        this.fallbackRetry  = fallbackLlmRetry;
    }

    /**
     * Route a chat request through primary → fallback with full resilience.
     *
     * The model field is overridden by each provider's configured model name,
     * so callers only pass messages and sampling options.
     */
    public ChatResponse chat(ChatRequest request) {
        try {
            ChatRequest primaryRequest = request.toBuilder().model(primaryClient.modelName()).build();
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primaryClient.chat(primaryRequest), "primary");
        } catch (Exception primaryException) {
            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest fallbackRequest = request.toBuilder().model(fallbackClient.modelName()).build();
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallbackClient.chat(fallbackRequest), "fallback");
        }
    }

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               String label) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (Exception e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }
}
