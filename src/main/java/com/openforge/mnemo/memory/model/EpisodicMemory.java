package com.openforge.mnemo.memory.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * A record of a specific event or exchange.
 *
 * Created by the extractor; the retriever bumps {@code accessCount} and
 * {@code lastAccessedAt}; the forgetter flips {@code archived} / {@code compressed}
 * and grows {@code mergedFrom}. Archiving is a soft delete: the record stays
 * reachable by id for export and audit.
 *
 * @param losslessRestatement complete paraphrase of the event, never empty
 * @param importance          long-term value, clamped to [0, 1]
 * @param confidence          extraction confidence, clamped to [0, 1]
 * @param mergedFrom          ids of near-duplicates folded into this memory by compression
 */
@Builder(toBuilder = true)
public record EpisodicMemory(
        String       id,
        String       userId,
        String       agentId,
        String       sourceSessionId,
        String       losslessRestatement,
        String       summary,
        List<String> keywords,
        EventType    eventType,
        List<String> participants,
        String       location,
        double       importance,
        double       confidence,
        int          accessCount,
        Instant      lastAccessedAt,
        boolean      archived,
        boolean      compressed,
        List<String> mergedFrom,
        Instant      createdAt
) {

    public EpisodicMemory {
        if (losslessRestatement == null || losslessRestatement.isBlank()) {
            throw new IllegalArgumentException("Episodic memory requires a lossless restatement");
        }
        keywords     = keywords == null ? List.of() : List.copyOf(keywords);
        participants = participants == null ? List.of() : List.copyOf(participants);
        mergedFrom   = mergedFrom == null ? List.of() : List.copyOf(mergedFrom);
        eventType    = eventType == null ? EventType.GENERAL_CONVERSATION : eventType;
        importance   = Scores.clamp(importance);
        confidence   = Scores.clamp(confidence);
        accessCount  = Math.max(0, accessCount);
    }

    /** Text shown to the model when this memory is recalled. */
    public String displayText() {
        return summary != null && !summary.isBlank() ? summary : losslessRestatement;
    }
}
