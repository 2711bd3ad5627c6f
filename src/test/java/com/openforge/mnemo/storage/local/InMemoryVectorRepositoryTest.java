package com.openforge.mnemo.storage.local;

import com.openforge.mnemo.memory.model.VectorHit;
import com.openforge.mnemo.storage.MemoryCollections;
import com.openforge.mnemo.storage.UnsupportedCollectionException;
import com.openforge.mnemo.storage.VectorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryVectorRepositoryTest {

    private static final String EPISODIC = MemoryCollections.EPISODIC_VECTORS;

    private InMemoryVectorRepository vectors;

    @BeforeEach
    void setUp() {
        vectors = new InMemoryVectorRepository();
        vectors.batchUpsert(List.of(
                new VectorRepository.VectorEntry("east", List.of(1f, 0f), Map.of("user_id", "u1", "event_type", "navigation")),
                new VectorRepository.VectorEntry("diag", List.of(1f, 1f), Map.of("user_id", "u1", "event_type", "music_playback")),
                new VectorRepository.VectorEntry("west", List.of(-1f, 0f), Map.of("user_id", "u1", "event_type", "navigation")),
                new VectorRepository.VectorEntry("other", List.of(1f, 0f), Map.of("user_id", "u2", "event_type", "navigation"))),
                EPISODIC);
    }

    @Test
    void resultsAreOrderedByCosineAndFiltered() {
        List<VectorHit> hits = vectors.search(List.of(1f, 0f), 10, EPISODIC, Map.of("user_id", "u1"), 0.0);

        assertThat(hits).extracting(VectorHit::memoryId).containsExactly("east", "diag", "west");
        assertThat(hits.get(0).score()).isEqualTo(1.0);
        assertThat(hits.get(2).score()).isZero();
    }

    @Test
    void scoreFloorAndTopKApply() {
        assertThat(vectors.search(List.of(1f, 0f), 10, EPISODIC, Map.of("user_id", "u1"), 0.5))
                .extracting(VectorHit::memoryId).containsExactly("east", "diag");
        assertThat(vectors.search(List.of(1f, 0f), 1, EPISODIC, Map.of("user_id", "u1"), 0.0))
                .extracting(VectorHit::memoryId).containsExactly("east");
    }

    @Test
    void nullFilterValueIsIgnored() {
        Map<String, Object> filters = new HashMap<>();
        filters.put("user_id", "u1");
        filters.put("event_type", null);

        assertThat(vectors.search(List.of(1f, 0f), 10, EPISODIC, filters, 0.0)).hasSize(3);
    }

    @Test
    void deleteRemovesTheVector() {
        assertThat(vectors.delete("east", EPISODIC)).isTrue();
        assertThat(vectors.delete("east", EPISODIC)).isFalse();
        assertThat(vectors.search(List.of(1f, 0f), 10, EPISODIC, Map.of("user_id", "u1"), 0.9)).isEmpty();
    }

    @Test
    void collectionsAreIsolatedAndValidated() {
        assertThat(vectors.search(List.of(1f, 0f), 10, MemoryCollections.SEMANTIC_VECTORS, Map.of(), 0.0)).isEmpty();
        assertThatThrownBy(() -> vectors.search(List.of(1f, 0f), 10, "profiles", Map.of(), 0.0))
                .isInstanceOf(UnsupportedCollectionException.class);
    }
}
