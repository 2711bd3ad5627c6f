package com.openforge.mnemo.memory.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One fused retrieval hit. Produced per call and never persisted.
 *
 * @param score   fused relevance, capped at 1.0
 * @param sources every strategy that ranked this memory
 * @param raw     the re-hydrated document as stored
 */
public record ScoredMemory(
        String               memoryId,
        MemoryType           memoryType,
        String               content,
        double               score,
        Set<RetrievalSource> sources,
        Map<String, Object>  raw
) {

    public ScoredMemory {
        score   = Scores.clamp(score);
        sources = sources == null || sources.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(sources));
        raw     = raw == null ? Map.of() : Collections.unmodifiableMap(raw);
    }

    /** e.g. {@code "semantic+lexical"}, in strategy order. */
    public String sourceLabel() {
        return sources.stream().map(RetrievalSource::tag).collect(Collectors.joining("+"));
    }
}
