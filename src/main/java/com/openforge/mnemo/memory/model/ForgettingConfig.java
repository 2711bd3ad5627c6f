package com.openforge.mnemo.memory.model;

import lombok.Builder;

/**
 * Tuning for one forgetting cycle. Callers that pass nothing get the configured defaults.
 *
 * @param importanceThreshold    archive below this effective importance
 * @param timeDecayFactor        per-day multiplier, 1.0 disables aging
 * @param accessBoostFactor      boost per recorded access, total boost capped at 0.3
 * @param similarityThreshold    restatement similarity above which two memories are merged
 * @param archiveInsteadOfDelete soft delete when true
 */
@Builder(toBuilder = true)
public record ForgettingConfig(
        double  importanceThreshold,
        double  timeDecayFactor,
        double  accessBoostFactor,
        double  similarityThreshold,
        int     maxMemoriesPerUser,
        boolean archiveInsteadOfDelete
) {

    public ForgettingConfig {
        if (maxMemoriesPerUser < 1) {
            throw new IllegalArgumentException("maxMemoriesPerUser must be positive");
        }
    }
}
