package com.openforge.mnemo.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - memory task executor  → runs background extraction and HTTP I/O
 *  - Java HttpClient       → the only HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper  → snake_case ↔ camelCase, Java time, tolerant deserialization
 *  - Clock                 → every timestamp the engines write
 */
@Configuration
public class AppConfig {

    /**
     * Cached pool of daemon threads. Extraction jobs block on provider I/O for
     * seconds at a time, so threads are created on demand rather than queued.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService memoryTaskExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread t = new Thread(runnable, "mnemo-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(factory);
    }

    /**
     * Single, shared HttpClient instance.
     * 30 s connect timeout; per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient(ExecutorService memoryTaskExecutor) {
        return HttpClient.newBuilder()
                .executor(memoryTaskExecutor)
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper configured for OpenAI-compatible JSON:
     *  - snake_case property names (finish_reason, response_format …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (API can add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
