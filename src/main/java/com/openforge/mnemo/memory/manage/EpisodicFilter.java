package com.openforge.mnemo.memory.manage;

import com.openforge.mnemo.memory.model.EventType;
import lombok.Builder;

import java.util.List;

/**
 * Narrows an episodic listing. Null fields do not filter.
 *
 * @param keywords matches memories carrying any of them, case-insensitively
 */
@Builder
public record EpisodicFilter(
        EventType    eventType,
        Double       minImportance,
        List<String> keywords,
        boolean      includeArchived
) {

    public EpisodicFilter {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static EpisodicFilter none() {
        return EpisodicFilter.builder().build();
    }
}
