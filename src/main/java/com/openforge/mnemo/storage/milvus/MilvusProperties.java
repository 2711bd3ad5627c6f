package com.openforge.mnemo.storage.milvus;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection parameters for the Milvus vector database, used when
 * {@code mnemo.storage.mode=milvus}.
 *
 * application.yml:
 *
 * mnemo:
 *   milvus:
 *     host: localhost
 *     port: 19530
 *     episodic-collection: mnemo_episodic
 *     semantic-collection: mnemo_semantic
 *     vector-dimensions: 1536
 */
@ConfigurationProperties(prefix = "mnemo.milvus")
public record MilvusProperties(
        @DefaultValue("localhost")      String host,
        @DefaultValue("19530")          int    port,
        @DefaultValue("mnemo_episodic") String episodicCollection,
        @DefaultValue("mnemo_semantic") String semanticCollection,
        @DefaultValue("1536")           int    vectorDimensions
) {}
