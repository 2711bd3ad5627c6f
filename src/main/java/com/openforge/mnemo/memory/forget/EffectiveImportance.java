package com.openforge.mnemo.memory.forget;

import com.openforge.mnemo.memory.model.ForgettingConfig;
import com.openforge.mnemo.memory.model.Scores;

import java.time.Duration;
import java.time.Instant;

/**
 * {@code clamp(base * decay^days + min(boost * accessCount, 0.3), 0, 1)}
 *
 * {@code days} is the whole-day floor of the memory's age; an unknown or future
 * creation time counts as zero days.
 */
public final class EffectiveImportance {

    static final double MAX_ACCESS_BOOST = 0.3;

    private EffectiveImportance() {
    }

    public static double of(double baseImportance, int accessCount, Instant createdAt,
                            Instant now, ForgettingConfig config) {
        long days = daysOld(createdAt, now);
        double decayed = baseImportance * Math.pow(config.timeDecayFactor(), days);
        double boost   = Math.min(config.accessBoostFactor() * Math.max(0, accessCount), MAX_ACCESS_BOOST);
        return Scores.clamp(decayed + boost);
    }

    static long daysOld(Instant createdAt, Instant now) {
        if (createdAt == null || now == null) return 0;
        return Math.max(0, Duration.between(createdAt, now).toDays());
    }
}
