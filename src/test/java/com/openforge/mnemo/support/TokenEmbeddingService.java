package com.openforge.mnemo.support;

import com.openforge.mnemo.embedding.EmbeddingService;
import com.openforge.mnemo.embedding.VectorMath;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Deterministic embedding for tests: a hashed bag of words. {@link #similarity}
 * is 1.0 for texts that are equal ignoring case and 0.0 otherwise, so tests can
 * reason about duplicates exactly.
 */
public class TokenEmbeddingService implements EmbeddingService {

    private static final int DIMENSIONS = 64;

    private final Set<String> failing = new CopyOnWriteArraySet<>();

    /** Makes {@link #embed} throw for this exact text. */
    public TokenEmbeddingService failOn(String text) {
        failing.add(text);
        return this;
    }

    @Override
    public List<Float> embed(String text) {
        if (failing.contains(text)) throw new IllegalStateException("embedding unavailable");
        float[] vector = new float[DIMENSIONS];
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isEmpty()) continue;
            vector[Math.floorMod(token.hashCode(), DIMENSIONS)] += 1f;
        }
        if (allZero(vector)) vector[0] = 1f;
        List<Float> out = new ArrayList<>(DIMENSIONS);
        for (float v : vector) out.add(v);
        return out;
    }

    @Override
    public List<List<Float>> embedBatch(List<String> texts) {
        return texts.stream().map(this::embed).toList();
    }

    @Override
    public double similarity(String a, String b) {
        return a.equalsIgnoreCase(b) ? 1.0 : 0.0;
    }

    public double cosine(String a, String b) {
        return VectorMath.cosine(embed(a), embed(b));
    }

    private static boolean allZero(float[] vector) {
        float[] zeros = new float[vector.length];
        return Arrays.equals(vector, zeros);
    }
}
