package com.openforge.mnemo.memory.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.mnemo.memory.model.EpisodicMemory;
import com.openforge.mnemo.memory.model.EventType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * An episodic memory as proposed by the model, before ids and ownership are attached.
 */
record EpisodicCandidate(
        String       losslessRestatement,
        String       summary,
        List<String> keywords,
        EventType    eventType,
        List<String> participants,
        String       location,
        double       importance,
        double       confidence
) {

    static final double DEFAULT_IMPORTANCE = 0.5;
    static final double DEFAULT_CONFIDENCE = 0.8;
    private static final int SUMMARY_FALLBACK_CHARS = 50;

    /** Empty when the element is not an object or has no restatement. */
    static Optional<EpisodicCandidate> parse(JsonNode node) {
        if (node == null || !node.isObject()) return Optional.empty();
        String restatement = CandidateFields.text(node, "lossless_restatement");
        if (restatement == null) return Optional.empty();

        String summary = CandidateFields.text(node, "summary");
        if (summary == null) {
            summary = restatement.length() > SUMMARY_FALLBACK_CHARS
                    ? restatement.substring(0, SUMMARY_FALLBACK_CHARS)
                    : restatement;
        }
        return Optional.of(new EpisodicCandidate(
                restatement,
                summary,
                CandidateFields.texts(node, "keywords"),
                EventType.fromValue(CandidateFields.text(node, "event_type")),
                CandidateFields.texts(node, "participants"),
                CandidateFields.text(node, "location"),
                CandidateFields.score(node, "importance", DEFAULT_IMPORTANCE),
                CandidateFields.score(node, "confidence", DEFAULT_CONFIDENCE)));
    }

    EpisodicMemory toMemory(String id, String userId, String agentId, String sessionId, Instant now) {
        return EpisodicMemory.builder()
                .id(id)
                .userId(userId)
                .agentId(agentId)
                .sourceSessionId(sessionId)
                .losslessRestatement(losslessRestatement)
                .summary(summary)
                .keywords(keywords)
                .eventType(eventType)
                .participants(participants)
                .location(location)
                .importance(importance)
                .confidence(confidence)
                .createdAt(now)
                .build();
    }
}
