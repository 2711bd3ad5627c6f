package com.openforge.mnemo.storage.milvus;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Milvus client bean. Only loaded in milvus storage mode.
 *
 * A failed connection yields no client; the storage wiring then refuses to start
 * rather than silently falling back to the in-process index.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MilvusProperties.class)
@ConditionalOnProperty(name = "mnemo.storage.mode", havingValue = "milvus")
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(15_000)
                            .build()
            );
            log.info("[Milvus] Connected successfully.");
            return client;
        } catch (Exception e) {
            log.error("[Milvus] Connection to {}:{} failed: {}", props.host(), props.port(), e.getMessage());
            return null;
        }
    }

    @Bean
    public MilvusCollectionManager milvusCollectionManager(@Nullable MilvusClientV2 milvusClient,
                                                           MilvusProperties props) {
        return new MilvusCollectionManager(milvusClient, props);
    }
}
