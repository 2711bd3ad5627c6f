package com.openforge.mnemo.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the OpenAI-compatible text embedding endpoint.
 *
 * application.yml:
 *
 * mnemo:
 *   embedding:
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:sk-placeholder}
 *     model: text-embedding-3-small
 *     dimensions: 1536
 *     timeout-seconds: 30
 *
 * {@code dimensions} must match {@code mnemo.milvus.vector-dimensions} in milvus mode.
 */
@ConfigurationProperties(prefix = "mnemo.embedding")
public record EmbeddingProperties(
        @DefaultValue("https://api.openai.com/v1") String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String model,
        @DefaultValue("1536") int dimensions,
        @DefaultValue("30") int timeoutSeconds
) {}
