package com.openforge.mnemo.memory.model;

/**
 * Every importance, confidence and relevance score lives in [0, 1].
 */
public final class Scores {

    private Scores() {
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
