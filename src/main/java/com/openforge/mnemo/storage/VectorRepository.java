package com.openforge.mnemo.storage;

import com.openforge.mnemo.memory.model.VectorHit;

import java.util.List;
import java.util.Map;

/**
 * Vector index keyed by memory id, partitioned by collection
 * ({@link MemoryCollections#EPISODIC_VECTORS}, {@link MemoryCollections#SEMANTIC_VECTORS}).
 */
public interface VectorRepository {

    void upsert(String memoryId, List<Float> embedding, Map<String, Object> metadata, String collection);

    default void batchUpsert(List<VectorEntry> entries, String collection) {
        for (VectorEntry entry : entries) {
            upsert(entry.memoryId(), entry.embedding(), entry.metadata(), collection);
        }
    }

    /**
     * @param filters    equality filters on metadata; null or empty means none
     * @param scoreFloor hits scoring below this are dropped
     * @return hits ordered by score descending, scores normalized to [0, 1]
     */
    List<VectorHit> search(List<Float> queryEmbedding,
                           int topK,
                           String collection,
                           Map<String, Object> filters,
                           double scoreFloor);

    boolean delete(String memoryId, String collection);

    record VectorEntry(String memoryId, List<Float> embedding, Map<String, Object> metadata) {}
}
