package com.openforge.mnemo.memory.retrieve;

import com.openforge.mnemo.memory.model.RetrievalSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reciprocal Rank Fusion over independently scored candidate lists.
 *
 * Each strategy ranks its own candidates by its own score, highest first, ranks
 * starting at 1. A memory's fused score is the sum of {@code 1 / (k + rank)} over
 * every strategy that ranked it. Raw strategy scores only decide the order inside
 * a strategy; they never cross strategies.
 */
public final class RrfFusion {

    public static final int DEFAULT_K = 60;

    /** A fused candidate. */
    public record Fused(String memoryId, double score, Set<RetrievalSource> sources) {}

    private final int k;
    private final Map<RetrievalSource, Map<String, Double>> candidates = new EnumMap<>(RetrievalSource.class);

    public RrfFusion(int k) {
        if (k < 1) throw new IllegalArgumentException("k must be positive, got " + k);
        this.k = k;
    }

    /**
     * Records a candidate for one strategy. A strategy that proposes the same id twice
     * keeps the higher score.
     */
    public RrfFusion add(RetrievalSource source, String memoryId, double score) {
        candidates.computeIfAbsent(source, s -> new LinkedHashMap<>())
                .merge(memoryId, score, Math::max);
        return this;
    }

    public int candidateCount(RetrievalSource source) {
        return candidates.getOrDefault(source, Map.of()).size();
    }

    /** Fused candidates, best first. Ties keep the order in which ids were first fused. */
    public List<Fused> fuse() {
        Map<String, Double>               scores  = new LinkedHashMap<>();
        Map<String, Set<RetrievalSource>> sources = new LinkedHashMap<>();

        for (Map.Entry<RetrievalSource, Map<String, Double>> strategy : candidates.entrySet()) {
            List<Map.Entry<String, Double>> ranking = new ArrayList<>(strategy.getValue().entrySet());
            ranking.sort(Map.Entry.<String, Double>comparingByValue().reversed());

            int rank = 1;
            for (Map.Entry<String, Double> entry : ranking) {
                scores.merge(entry.getKey(), 1.0 / (k + rank), Double::sum);
                sources.computeIfAbsent(entry.getKey(), id -> EnumSet.noneOf(RetrievalSource.class))
                        .add(strategy.getKey());
                rank++;
            }
        }

        List<Fused> fused = new ArrayList<>(scores.size());
        scores.forEach((id, score) -> fused.add(new Fused(id, score, sources.get(id))));
        fused.sort(Comparator.comparingDouble(Fused::score).reversed());
        return fused;
    }
}
