package com.openforge.mnemo.memory.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One vector search hit.
 *
 * @param score similarity already normalized to [0, 1], never a raw distance
 */
public record VectorHit(
        String              memoryId,
        double              score,
        Map<String, Object> metadata
) {

    public VectorHit {
        score    = Scores.clamp(score);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
