package com.openforge.mnemo.embedding;

import java.util.List;

public final class VectorMath {

    private VectorMath() {
    }

    public static float[] toArray(List<Float> vector) {
        float[] out = new float[vector.size()];
        for (int i = 0; i < out.length; i++) {
            Float v = vector.get(i);
            out[i] = v == null ? 0f : v;
        }
        return out;
    }

    /**
     * Cosine similarity clamped to [0, 1]. Zero vectors and mismatched
     * dimensions score 0.
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length || a.length == 0) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot   += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0.0;
        double cos = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(0.0, Math.min(1.0, cos));
    }

    public static double cosine(List<Float> a, List<Float> b) {
        return cosine(toArray(a), toArray(b));
    }
}
