package com.openforge.mnemo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * mnemo.storage.mode: local | milvus. Anything else aborts startup.
 */
@ConfigurationProperties(prefix = "mnemo.storage")
public record StorageProperties(
        @DefaultValue("local") String mode
) {}
