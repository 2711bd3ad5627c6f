package com.openforge.mnemo.storage.milvus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.openforge.mnemo.memory.model.VectorHit;
import com.openforge.mnemo.storage.VectorRepository;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.DeleteResp;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Vector index backed by Milvus.
 *
 * {@code user_id}, {@code event_type} and {@code category} filters are pushed down
 * as a boolean expression; any other filter key is checked against the decoded
 * metadata of each hit. The IP score of normalized embeddings is cosine, clamped to [0, 1].
 */
@Slf4j
public class MilvusVectorRepository implements VectorRepository {

    private static final Set<String> SCALAR_FIELDS = Set.of(
            MilvusCollectionManager.F_USER_ID,
            MilvusCollectionManager.F_EVENT_TYPE,
            MilvusCollectionManager.F_CATEGORY);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final MilvusClientV2          milvusClient;
    private final MilvusCollectionManager collectionManager;
    private final ObjectMapper            objectMapper;

    public MilvusVectorRepository(MilvusClientV2 milvusClient,
                                  MilvusCollectionManager collectionManager,
                                  ObjectMapper objectMapper) {
        this.milvusClient      = milvusClient;
        this.collectionManager = collectionManager;
        this.objectMapper      = objectMapper;
    }

    @Override
    public void upsert(String memoryId, List<Float> embedding, Map<String, Object> metadata, String collection) {
        milvusClient.upsert(UpsertReq.builder()
                .collectionName(collectionManager.ensureCollection(collection))
                .data(List.of(toRow(memoryId, embedding, metadata)))
                .build());
        log.debug("[Milvus] Upserted {} into {}", memoryId, collection);
    }

    @Override
    public void batchUpsert(List<VectorEntry> entries, String collection) {
        if (entries.isEmpty()) return;
        List<JsonObject> rows = entries.stream()
                .map(e -> toRow(e.memoryId(), e.embedding(), e.metadata()))
                .toList();
        milvusClient.upsert(UpsertReq.builder()
                .collectionName(collectionManager.ensureCollection(collection))
                .data(rows)
                .build());
        log.debug("[Milvus] Upserted {} rows into {}", rows.size(), collection);
    }

    @Override
    public List<VectorHit> search(List<Float> queryEmbedding,
                                  int topK,
                                  String collection,
                                  Map<String, Object> filters,
                                  double scoreFloor) {
        SearchReq.SearchReqBuilder builder = SearchReq.builder()
                .collectionName(collectionManager.ensureCollection(collection))
                .data(List.of(new FloatVec(queryEmbedding)))
                .annsField(MilvusCollectionManager.F_EMBEDDING)
                .topK(topK)
                .outputFields(List.of(MilvusCollectionManager.F_METADATA));

        String expression = buildFilter(filters);
        if (expression != null) builder.filter(expression);

        SearchResp resp = milvusClient.search(builder.build());

        List<VectorHit> hits = new ArrayList<>();
        if (resp == null || resp.getSearchResults() == null) return hits;

        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                Float scoreF = hit.getScore();
                double score = scoreF == null ? 0.0 : scoreF.doubleValue();
                if (score < scoreFloor) continue;
                Map<String, Object> metadata = decode(hit.getEntity().get(MilvusCollectionManager.F_METADATA));
                if (!matchesRemaining(metadata, filters)) continue;
                hits.add(new VectorHit(String.valueOf(hit.getId()), score, metadata));
            }
        }
        return hits;
    }

    @Override
    public boolean delete(String memoryId, String collection) {
        DeleteResp resp = milvusClient.delete(DeleteReq.builder()
                .collectionName(collectionManager.ensureCollection(collection))
                .ids(List.of(memoryId))
                .build());
        long deleted = resp == null ? 0L : resp.getDeleteCnt();
        log.debug("[Milvus] Deleted {} from {} (count={})", memoryId, collection, deleted);
        return deleted > 0;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private JsonObject toRow(String memoryId, List<Float> embedding, Map<String, Object> metadata) {
        Map<String, Object> meta = metadata == null ? Map.of() : metadata;
        JsonObject row = new JsonObject();
        row.addProperty(MilvusCollectionManager.F_MEMORY_ID,  memoryId);
        row.addProperty(MilvusCollectionManager.F_USER_ID,    text(meta.get(MilvusCollectionManager.F_USER_ID)));
        row.addProperty(MilvusCollectionManager.F_EVENT_TYPE, text(meta.get(MilvusCollectionManager.F_EVENT_TYPE)));
        row.addProperty(MilvusCollectionManager.F_CATEGORY,   text(meta.get(MilvusCollectionManager.F_CATEGORY)));
        row.addProperty(MilvusCollectionManager.F_METADATA,   encode(meta));

        JsonArray embeddingArray = new JsonArray();
        for (Float f : embedding) embeddingArray.add(f);
        row.add(MilvusCollectionManager.F_EMBEDDING, embeddingArray);
        return row;
    }

    /**
     * Build a Milvus filter expression from the pushed-down keys.
     * Combines multiple conditions with AND.
     */
    private String buildFilter(Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) return null;
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, Object> f : filters.entrySet()) {
            if (f.getValue() == null || !SCALAR_FIELDS.contains(f.getKey())) continue;
            parts.add("%s == \"%s\"".formatted(f.getKey(), escape(String.valueOf(f.getValue()))));
        }
        return parts.isEmpty() ? null : String.join(" and ", parts);
    }

    private static boolean matchesRemaining(Map<String, Object> metadata, Map<String, Object> filters) {
        if (filters == null) return true;
        for (Map.Entry<String, Object> f : filters.entrySet()) {
            if (f.getValue() == null || SCALAR_FIELDS.contains(f.getKey())) continue;
            if (!Objects.equals(String.valueOf(f.getValue()), Objects.toString(metadata.get(f.getKey()), null))) {
                return false;
            }
        }
        return true;
    }

    private String encode(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Vector metadata is not serializable", e);
        }
    }

    private Map<String, Object> decode(Object raw) {
        if (!(raw instanceof String json) || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[Milvus] Unreadable metadata_json, ignoring: {}", e.getMessage());
            return Map.of();
        }
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
