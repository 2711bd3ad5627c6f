package com.openforge.mnemo.chat;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;

@Configuration
public class ChatConfig {

    /** No profile source configured: turns run without a profile block. */
    @Bean
    @ConditionalOnMissingBean
    public ProfileSnapshotProvider profileSnapshotProvider() {
        return userId -> Optional.empty();
    }
}
