package com.openforge.mnemo.storage.local;

import com.openforge.mnemo.embedding.VectorMath;
import com.openforge.mnemo.memory.model.VectorHit;
import com.openforge.mnemo.storage.MemoryCollections;
import com.openforge.mnemo.storage.VectorRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute-force cosine search. Fine for a single process and a few thousand memories per user.
 */
@Slf4j
public class InMemoryVectorRepository implements VectorRepository {

    private final Map<String, Map<String, Entry>> collections = new ConcurrentHashMap<>();

    @Override
    public void upsert(String memoryId, List<Float> embedding, Map<String, Object> metadata, String collection) {
        if (embedding == null || embedding.isEmpty()) {
            throw new IllegalArgumentException("Embedding for " + memoryId + " is empty");
        }
        entries(collection).put(memoryId,
                new Entry(VectorMath.toArray(embedding), metadata == null ? Map.of() : new HashMap<>(metadata)));
    }

    @Override
    public List<VectorHit> search(List<Float> queryEmbedding,
                                  int topK,
                                  String collection,
                                  Map<String, Object> filters,
                                  double scoreFloor) {
        float[] query = VectorMath.toArray(queryEmbedding);
        List<VectorHit> hits = entries(collection).entrySet().stream()
                .filter(e -> matches(e.getValue().metadata(), filters))
                .map(e -> new VectorHit(e.getKey(),
                        VectorMath.cosine(query, e.getValue().vector()),
                        e.getValue().metadata()))
                .filter(hit -> hit.score() >= scoreFloor)
                .sorted(Comparator.comparingDouble(VectorHit::score).reversed()
                        .thenComparing(VectorHit::memoryId))
                .limit(Math.max(0, topK))
                .toList();
        log.debug("[Vector] {} search → {} hits (floor={})", collection, hits.size(), scoreFloor);
        return hits;
    }

    @Override
    public boolean delete(String memoryId, String collection) {
        return entries(collection).remove(memoryId) != null;
    }

    private Map<String, Entry> entries(String collection) {
        MemoryCollections.requireVectorCollection(collection);
        return collections.computeIfAbsent(collection, c -> new ConcurrentHashMap<>());
    }

    private static boolean matches(Map<String, Object> metadata, Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) return true;
        for (Map.Entry<String, Object> f : filters.entrySet()) {
            if (f.getValue() == null) continue;
            if (!Objects.equals(String.valueOf(f.getValue()), Objects.toString(metadata.get(f.getKey()), null))) {
                return false;
            }
        }
        return true;
    }

    private record Entry(float[] vector, Map<String, Object> metadata) {}
}
