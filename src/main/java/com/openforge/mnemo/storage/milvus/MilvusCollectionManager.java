package com.openforge.mnemo.storage.milvus;

import com.openforge.mnemo.storage.MemoryCollections;
import com.openforge.mnemo.storage.UnsupportedCollectionException;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps the logical vector collections onto Milvus collections and creates them on first use.
 *
 * Collection schema (one per memory kind):
 * ┌──────────────────┬─────────────────┬──────────────────────────────────────┐
 * │ Field            │ Type            │ Notes                                │
 * ├──────────────────┼─────────────────┼──────────────────────────────────────┤
 * │ memory_id        │ VARCHAR(64) PK  │ mem_ep_… / mem_sem_…, no auto id     │
 * │ user_id          │ VARCHAR(64)     │ filtered on every search             │
 * │ event_type       │ VARCHAR(64)     │ episodic only, "" otherwise          │
 * │ category         │ VARCHAR(32)     │ semantic only, "" otherwise          │
 * │ metadata_json    │ VARCHAR(8192)   │ full metadata bag as JSON            │
 * │ embedding        │ FLOAT_VECTOR    │ dim = vectorDimensions               │
 * └──────────────────┴─────────────────┴──────────────────────────────────────┘
 *
 * Index: HNSW on embedding with IP metric (cosine for normalized vectors), TRIE on user_id.
 */
@Slf4j
public class MilvusCollectionManager {

    static final String F_MEMORY_ID  = "memory_id";
    static final String F_USER_ID    = "user_id";
    static final String F_EVENT_TYPE = "event_type";
    static final String F_CATEGORY   = "category";
    static final String F_METADATA   = "metadata_json";
    static final String F_EMBEDDING  = "embedding";

    @Nullable
    private final MilvusClientV2   milvusClient;
    private final MilvusProperties props;

    /** Collection names already confirmed to exist. */
    private final Set<String> existingCollections = ConcurrentHashMap.newKeySet();

    public MilvusCollectionManager(@Nullable MilvusClientV2 milvusClient, MilvusProperties props) {
        this.milvusClient = milvusClient;
        this.props        = props;
    }

    public boolean available() {
        return milvusClient != null;
    }

    /** Physical Milvus collection for a logical vector collection. */
    public String physicalName(String logicalCollection) {
        return switch (MemoryCollections.requireVectorCollection(logicalCollection)) {
            case MemoryCollections.EPISODIC_VECTORS -> props.episodicCollection();
            case MemoryCollections.SEMANTIC_VECTORS -> props.semanticCollection();
            default -> throw new UnsupportedCollectionException("vector", logicalCollection);
        };
    }

    /**
     * Ensures the backing collection exists.
     *
     * @return the physical collection name
     */
    public String ensureCollection(String logicalCollection) {
        if (milvusClient == null) {
            throw new IllegalStateException("Milvus client is not connected");
        }
        String name = physicalName(logicalCollection);
        if (existingCollections.contains(name)) return name;

        boolean exists = milvusClient.hasCollection(
                HasCollectionReq.builder().collectionName(name).build());
        if (exists) {
            log.info("[Milvus] Collection '{}' confirmed existing.", name);
        } else {
            log.info("[Milvus] Creating collection '{}' (dim={})...", name, props.vectorDimensions());
            createCollection(name);
        }
        existingCollections.add(name);
        return name;
    }

    private void createCollection(String name) {
        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();

        schema.addField(AddFieldReq.builder().fieldName(F_MEMORY_ID)
                .dataType(DataType.VarChar).maxLength(64).isPrimaryKey(true).autoID(false).build());
        schema.addField(AddFieldReq.builder().fieldName(F_USER_ID)
                .dataType(DataType.VarChar).maxLength(64).build());
        schema.addField(AddFieldReq.builder().fieldName(F_EVENT_TYPE)
                .dataType(DataType.VarChar).maxLength(64).build());
        schema.addField(AddFieldReq.builder().fieldName(F_CATEGORY)
                .dataType(DataType.VarChar).maxLength(32).build());
        schema.addField(AddFieldReq.builder().fieldName(F_METADATA)
                .dataType(DataType.VarChar).maxLength(8192).build());
        schema.addField(AddFieldReq.builder().fieldName(F_EMBEDDING)
                .dataType(DataType.FloatVector).dimension(props.vectorDimensions()).build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName(F_EMBEDDING)
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.IP)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();
        IndexParam userIndex = IndexParam.builder()
                .fieldName(F_USER_ID)
                .indexType(IndexParam.IndexType.TRIE)
                .build();

        milvusClient.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex, userIndex))
                .build());

        log.info("[Milvus] Collection '{}' created successfully.", name);
    }
}
