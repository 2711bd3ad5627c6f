package com.openforge.mnemo.embedding;

import java.util.List;

/**
 * Text → vector capability.
 *
 * Failures surface as {@link EmbeddingClient.EmbeddingException}; callers decide
 * whether that costs them a single item or the whole step.
 */
public interface EmbeddingService {

    List<Float> embed(String text);

    /** One vector per input, in input order. */
    List<List<Float>> embedBatch(List<String> texts);

    /** Cosine similarity of the two texts' embeddings, clamped to [0, 1]. */
    double similarity(String a, String b);
}
