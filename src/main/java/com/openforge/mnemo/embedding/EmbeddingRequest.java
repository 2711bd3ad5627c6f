package com.openforge.mnemo.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Request body for POST /v1/embeddings (OpenAI-compatible).
 *
 * Wire format:
 * {
 *   "input": "text to embed" | ["text a", "text b"],
 *   "model": "text-embedding-3-small",
 *   "dimensions": 1536
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
        Object input,
        String model,
        Integer dimensions
) {
    public static EmbeddingRequest single(String input, String model, int dimensions) {
        return new EmbeddingRequest(input, model, dimensions);
    }

    public static EmbeddingRequest batch(List<String> inputs, String model, int dimensions) {
        return new EmbeddingRequest(List.copyOf(inputs), model, dimensions);
    }
}
