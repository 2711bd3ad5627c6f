package com.openforge.mnemo.memory.inspect;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Per-user memory statistics.
 *
 * @param oldestAt null when the user has no episodic memories
 * @param topKeywords most frequent episodic keywords, most frequent first
 */
public record MemoryStats(
        String                 userId,
        long                   totalEpisodic,
        long                   activeEpisodic,
        long                   archivedEpisodic,
        long                   compressedEpisodic,
        long                   totalSemantic,
        Instant                oldestAt,
        Instant                newestAt,
        Map<String, Integer>   eventTypeDistribution,
        List<KeywordCount>     topKeywords
) {

    public record KeywordCount(String keyword, int count) {}

    public MemoryStats {
        eventTypeDistribution = Map.copyOf(eventTypeDistribution);
        topKeywords           = List.copyOf(topKeywords);
    }
}
