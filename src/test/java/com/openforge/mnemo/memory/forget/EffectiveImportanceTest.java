package com.openforge.mnemo.memory.forget;

import com.openforge.mnemo.memory.model.ForgettingConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EffectiveImportanceTest {

    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    private static final ForgettingConfig CONFIG = ForgettingConfig.builder()
            .importanceThreshold(0.3)
            .timeDecayFactor(0.95)
            .accessBoostFactor(0.1)
            .similarityThreshold(0.85)
            .maxMemoriesPerUser(100)
            .archiveInsteadOfDelete(true)
            .build();

    @Test
    void freshUnaccessedMemoryKeepsItsBaseImportance() {
        assertThat(EffectiveImportance.of(0.6, 0, NOW, NOW, CONFIG)).isEqualTo(0.6);
    }

    @Test
    void decaysStrictlyWithWholeDaysOfAge() {
        double previous = EffectiveImportance.of(0.8, 0, NOW, NOW, CONFIG);
        for (int days = 1; days <= 30; days++) {
            double current = EffectiveImportance.of(0.8, 0, NOW.minus(Duration.ofDays(days)), NOW, CONFIG);
            assertThat(current).isLessThan(previous);
            previous = current;
        }
        assertThat(EffectiveImportance.of(0.8, 0, NOW.minus(Duration.ofDays(10)), NOW, CONFIG))
                .isCloseTo(0.8 * Math.pow(0.95, 10), within(1e-12));
    }

    @Test
    void partialDaysAreFloored() {
        Instant almostTwoDays = NOW.minus(Duration.ofHours(47));
        assertThat(EffectiveImportance.of(0.8, 0, almostTwoDays, NOW, CONFIG))
                .isCloseTo(0.8 * 0.95, within(1e-12));
    }

    @Test
    void accessBoostIsCappedAndResultClamped() {
        assertThat(EffectiveImportance.of(0.2, 2, NOW, NOW, CONFIG)).isCloseTo(0.4, within(1e-12));
        assertThat(EffectiveImportance.of(0.2, 50, NOW, NOW, CONFIG)).isCloseTo(0.5, within(1e-12));
        assertThat(EffectiveImportance.of(0.95, 50, NOW, NOW, CONFIG)).isEqualTo(1.0);
    }

    @Test
    void unknownOrFutureCreationCountsAsZeroDays() {
        assertThat(EffectiveImportance.daysOld(null, NOW)).isZero();
        assertThat(EffectiveImportance.daysOld(NOW.plus(Duration.ofDays(3)), NOW)).isZero();
    }
}
