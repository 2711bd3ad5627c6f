package com.openforge.mnemo.memory.manage;

import com.openforge.mnemo.memory.model.EventType;
import lombok.Builder;

import java.util.List;

/**
 * Editable fields of an episodic memory. Null leaves the stored value alone.
 * The restatement, ids, counters and timestamps cannot be edited.
 */
@Builder
public record EpisodicUpdate(
        String       summary,
        List<String> keywords,
        Double       importance,
        EventType    eventType,
        List<String> participants,
        String       location,
        Boolean      archived
) {

    public boolean isEmpty() {
        return summary == null && keywords == null && importance == null && eventType == null
                && participants == null && location == null && archived == null;
    }
}
