package com.openforge.mnemo.storage.milvus;

import com.google.gson.JsonObject;
import com.openforge.mnemo.config.AppConfig;
import com.openforge.mnemo.memory.model.VectorHit;
import com.openforge.mnemo.storage.MemoryCollections;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.response.DeleteResp;
import io.milvus.v2.service.vector.response.SearchResp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MilvusVectorRepositoryTest {

    private static final String PHYSICAL = "mnemo_episodic_vectors";

    private MilvusClientV2         milvusClient;
    private MilvusVectorRepository vectors;

    @BeforeEach
    void setUp() {
        milvusClient = mock(MilvusClientV2.class);
        MilvusCollectionManager collections = mock(MilvusCollectionManager.class);
        when(collections.ensureCollection(MemoryCollections.EPISODIC_VECTORS)).thenReturn(PHYSICAL);
        vectors = new MilvusVectorRepository(milvusClient, collections, new AppConfig().objectMapper());
    }

    @Test
    void scalarFiltersArePushedDownAsOneExpression() {
        SearchResp empty = results();
        when(milvusClient.search(any())).thenReturn(empty);
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("user_id", "alice \"the\" tester");
        filters.put("event_type", "chat");
        filters.put("agent_id", "car-7");

        vectors.search(List.of(1.0f, 0.0f), 5, MemoryCollections.EPISODIC_VECTORS, filters, 0.0);

        SearchReq sent = sentSearch();
        assertThat(sent.getCollectionName()).isEqualTo(PHYSICAL);
        assertThat(sent.getTopK()).isEqualTo(5);
        assertThat(sent.getFilter())
                .isEqualTo("user_id == \"alice \\\"the\\\" tester\" and event_type == \"chat\"")
                .doesNotContain("agent_id");
    }

    @Test
    void noScalarFilterMeansNoExpression() {
        SearchResp empty = results();
        when(milvusClient.search(any())).thenReturn(empty);

        vectors.search(List.of(1.0f, 0.0f), 3, MemoryCollections.EPISODIC_VECTORS, Map.of("agent_id", "car-7"), 0.0);

        assertThat(sentSearch().getFilter()).isNull();
    }

    @Test
    void otherFilterKeysAreMatchedAgainstDecodedMetadata() {
        SearchResp resp = results(
                hit("m-1", 0.9f, "{\"user_id\": \"alice\", \"agent_id\": \"car-7\"}"),
                hit("m-2", 0.8f, "{\"user_id\": \"alice\", \"agent_id\": \"car-9\"}"),
                hit("m-3", 0.7f, "{\"user_id\": \"alice\"}"));
        when(milvusClient.search(any())).thenReturn(resp);

        List<VectorHit> hits = vectors.search(List.of(1.0f, 0.0f), 5, MemoryCollections.EPISODIC_VECTORS,
                Map.of("user_id", "alice", "agent_id", "car-7"), 0.0);

        assertThat(hits).extracting(VectorHit::memoryId).containsExactly("m-1");
    }

    @Test
    void hitsBelowTheScoreFloorAreDropped() {
        SearchResp resp = results(
                hit("m-1", 0.92f, "{}"),
                hit("m-2", 0.41f, "{}"),
                hit("m-3", null, "{}"));
        when(milvusClient.search(any())).thenReturn(resp);

        List<VectorHit> hits = vectors.search(List.of(1.0f, 0.0f), 5, MemoryCollections.EPISODIC_VECTORS, Map.of(), 0.5);

        assertThat(hits).extracting(VectorHit::memoryId).containsExactly("m-1");
        assertThat(hits.get(0).score()).isCloseTo(0.92, within(1e-6));
    }

    @Test
    void metadataIsDecodedAndUnreadableMetadataBecomesEmpty() {
        SearchResp resp = results(
                hit("m-1", 0.9f, "{\"user_id\": \"alice\", \"importance\": 0.7, \"event_type\": \"chat\"}"),
                hit("m-2", 0.8f, "not json"));
        when(milvusClient.search(any())).thenReturn(resp);

        List<VectorHit> hits = vectors.search(List.of(1.0f, 0.0f), 5, MemoryCollections.EPISODIC_VECTORS, null, 0.0);

        assertThat(hits).hasSize(2);
        assertThat(hits.get(0).metadata())
                .containsEntry("user_id", "alice")
                .containsEntry("importance", 0.7)
                .containsEntry("event_type", "chat");
        assertThat(hits.get(1).metadata()).isEmpty();
    }

    @Test
    void emptyResponseYieldsNoHits() {
        when(milvusClient.search(any())).thenReturn(null);

        assertThat(vectors.search(List.of(1.0f), 5, MemoryCollections.EPISODIC_VECTORS, Map.of(), 0.0)).isEmpty();
    }

    @Test
    void upsertWritesScalarColumnsAndMetadataJson() {
        vectors.upsert("m-1", List.of(0.6f, 0.8f),
                Map.of("user_id", "alice", "event_type", "chat", "importance", 0.7),
                MemoryCollections.EPISODIC_VECTORS);

        ArgumentCaptor<UpsertReq> captor = ArgumentCaptor.forClass(UpsertReq.class);
        verify(milvusClient).upsert(captor.capture());
        assertThat(captor.getValue().getCollectionName()).isEqualTo(PHYSICAL);
        JsonObject row = captor.getValue().getData().get(0);
        assertThat(row.get("memory_id").getAsString()).isEqualTo("m-1");
        assertThat(row.get("user_id").getAsString()).isEqualTo("alice");
        assertThat(row.get("category").getAsString()).isEmpty();
        assertThat(row.get("metadata_json").getAsString()).contains("\"importance\":0.7");
        assertThat(row.getAsJsonArray("embedding")).hasSize(2);
    }

    @Test
    void deleteReportsWhetherARowWasRemoved() {
        DeleteResp removed = mock(DeleteResp.class);
        when(removed.getDeleteCnt()).thenReturn(1L);
        DeleteResp missing = mock(DeleteResp.class);
        when(missing.getDeleteCnt()).thenReturn(0L);
        when(milvusClient.delete(any(DeleteReq.class))).thenReturn(removed, missing);

        assertThat(vectors.delete("m-1", MemoryCollections.EPISODIC_VECTORS)).isTrue();
        assertThat(vectors.delete("m-1", MemoryCollections.EPISODIC_VECTORS)).isFalse();
    }

    private SearchReq sentSearch() {
        ArgumentCaptor<SearchReq> captor = ArgumentCaptor.forClass(SearchReq.class);
        verify(milvusClient).search(captor.capture());
        return captor.getValue();
    }

    private static SearchResp results(SearchResp.SearchResult... hits) {
        SearchResp resp = mock(SearchResp.class);
        when(resp.getSearchResults()).thenReturn(List.of(List.of(hits)));
        return resp;
    }

    private static SearchResp.SearchResult hit(String id, Float score, String metadataJson) {
        SearchResp.SearchResult hit = mock(SearchResp.SearchResult.class);
        when(hit.getId()).thenReturn(id);
        when(hit.getScore()).thenReturn(score);
        when(hit.getEntity()).thenReturn(Map.of("metadata_json", metadataJson));
        return hit;
    }
}
