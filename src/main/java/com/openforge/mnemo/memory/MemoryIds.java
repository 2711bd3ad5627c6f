package com.openforge.mnemo.memory;

import java.util.UUID;

/**
 * Memory ids carry their kind as a prefix; the graph relies on it to tell
 * event nodes from entity nodes.
 */
public final class MemoryIds {

    public static final String EPISODIC_PREFIX = "mem_ep_";
    public static final String SEMANTIC_PREFIX = "mem_sem_";

    private MemoryIds() {
    }

    public static String newEpisodicId() {
        return EPISODIC_PREFIX + randomSuffix();
    }

    public static String newSemanticId() {
        return SEMANTIC_PREFIX + randomSuffix();
    }

    public static boolean isEpisodic(String id) {
        return id != null && id.startsWith(EPISODIC_PREFIX);
    }

    private static String randomSuffix() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
