package com.openforge.mnemo.config;

import com.openforge.mnemo.embedding.EmbeddingClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * Named instances:
 *   • "primaryLlm"  / "fallbackLlm" : circuit breaker + retry per chat provider (see LlmRouter)
 *   • "embedding"                   : retry around every embedding HTTP call
 */
@Configuration
public class Resilience4jConfig {

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // treat slow calls (>60 s) as failures
                .slowCallDurationThreshold(Duration.ofSeconds(60))
                .slowCallRateThreshold(80)
                // allow 2 trial calls while HALF-OPEN
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(IOException.class, RuntimeException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker("primaryLlm");
        registry.circuitBreaker("fallbackLlm");
        return registry;
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("primaryLlm");
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("fallbackLlm");
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(1))
                .retryExceptions(IOException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry("primaryLlm");
        registry.retry("fallbackLlm");
        return registry;
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry("primaryLlm");
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry("fallbackLlm");
    }

    /**
     * Transport errors, 429 and 5xx are retried twice. Blank input and other 4xx
     * responses fail on the first attempt.
     */
    @Bean
    public Retry embeddingRetry(RetryRegistry registry) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(500))
                .retryExceptions(EmbeddingClient.EmbeddingException.class)
                .ignoreExceptions(IllegalArgumentException.class, EmbeddingClient.EmbeddingRejectedException.class)
                .build();
        return registry.retry("embedding", config);
    }
}
