package com.openforge.mnemo.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.mnemo.storage.DocumentRepository;
import com.openforge.mnemo.storage.GraphRepository;
import com.openforge.mnemo.storage.StorageMode;
import com.openforge.mnemo.storage.VectorRepository;
import com.openforge.mnemo.storage.WorkingMemoryRepository;
import com.openforge.mnemo.storage.local.InMemoryDocumentRepository;
import com.openforge.mnemo.storage.local.InMemoryGraphRepository;
import com.openforge.mnemo.storage.local.InMemoryVectorRepository;
import com.openforge.mnemo.storage.local.InMemoryWorkingMemoryRepository;
import com.openforge.mnemo.storage.milvus.MilvusCollectionManager;
import com.openforge.mnemo.storage.milvus.MilvusVectorRepository;
import io.milvus.v2.client.MilvusClientV2;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Picks the repository implementations for the configured storage mode.
 *
 *   local   all four repositories in process memory
 *   milvus  vector index in Milvus; session, document and graph stores in memory
 *
 * The mode is parsed when this configuration is created, so an unknown value
 * fails the context before any engine is built.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({StorageProperties.class, MemoryProperties.class})
public class StorageConfig {

    private final StorageMode mode;

    public StorageConfig(StorageProperties storageProperties) {
        this.mode = StorageMode.parse(storageProperties.mode());
        log.info("[Storage] Mode: {}", mode);
    }

    @Bean
    public StorageMode storageMode() {
        return mode;
    }

    @Bean
    public WorkingMemoryRepository workingMemoryRepository(Clock clock, MemoryProperties memoryProperties) {
        MemoryProperties.Working working = memoryProperties.working();
        return new InMemoryWorkingMemoryRepository(clock, working.maxSessions(), working.maxMessages());
    }

    /** Closed on shutdown through the inferred {@code close()} of the Lucene-backed store. */
    @Bean
    public DocumentRepository documentRepository() {
        return new InMemoryDocumentRepository();
    }

    @Bean
    public GraphRepository graphRepository() {
        return new InMemoryGraphRepository();
    }

    @Bean
    public VectorRepository vectorRepository(ObjectProvider<MilvusClientV2> milvusClient,
                                             ObjectProvider<MilvusCollectionManager> collectionManager,
                                             ObjectMapper objectMapper) {
        if (mode == StorageMode.LOCAL) {
            return new InMemoryVectorRepository();
        }
        MilvusClientV2 client = milvusClient.getIfAvailable();
        MilvusCollectionManager manager = collectionManager.getIfAvailable();
        if (client == null || manager == null) {
            throw new IllegalStateException(
                    "mnemo.storage.mode=milvus but no Milvus client is available; check mnemo.milvus.host/port");
        }
        return new MilvusVectorRepository(client, manager, objectMapper);
    }
}
