package com.openforge.mnemo.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Memory engine tuning, bound from "mnemo.memory".
 *
 * mnemo:
 *   memory:
 *     working:     { ttl-seconds: 1800, max-sessions: 1000, max-messages: 50 }
 *     extraction:  { window-size: 8, overlap: 2, min-confidence: 0.6 }
 *     retrieval:   { top-k: 5, score-threshold: 0.5, rrf-k: 60 }
 *     forgetting:  { importance-threshold: 0.3, time-decay-factor: 0.95,
 *                    access-boost-factor: 0.1, similarity-threshold: 0.85,
 *                    max-memories-per-user: 10000 }
 */
@Validated
@ConfigurationProperties(prefix = "mnemo.memory")
public record MemoryProperties(
        @Valid @DefaultValue Working    working,
        @Valid @DefaultValue Extraction extraction,
        @Valid @DefaultValue Retrieval  retrieval,
        @Valid @DefaultValue Forgetting forgetting
) {

    public record Working(
            @Min(1) @DefaultValue("1800") int ttlSeconds,
            @Min(1) @DefaultValue("1000") int maxSessions,
            @Min(2) @DefaultValue("50")   int maxMessages
    ) {}

    /**
     * @param windowSize messages per extraction window; also the session size that triggers extraction
     */
    public record Extraction(
            @Min(2) @DefaultValue("8") int windowSize,
            @Min(0) @DefaultValue("2") int overlap,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.6") double minConfidence
    ) {}

    public record Retrieval(
            @Min(1) @DefaultValue("5") int topK,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.5") double scoreThreshold,
            @Min(1) @DefaultValue("60") int rrfK
    ) {}

    public record Forgetting(
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.3")  double importanceThreshold,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.95") double timeDecayFactor,
            @DecimalMin("0.0") @DefaultValue("0.1") double accessBoostFactor,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.85") double similarityThreshold,
            @Min(1) @DefaultValue("10000") int maxMemoriesPerUser
    ) {}

    /** The values application.yml ships with. */
    public static MemoryProperties defaults() {
        return new MemoryProperties(
                new Working(1800, 1000, 50),
                new Extraction(8, 2, 0.6),
                new Retrieval(5, 0.5, 60),
                new Forgetting(0.3, 0.95, 0.1, 0.85, 10_000));
    }
}
