package com.openforge.mnemo.memory.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.mnemo.memory.model.SemanticCategory;
import com.openforge.mnemo.memory.model.SemanticMemory;

import java.time.Instant;
import java.util.Optional;

/**
 * A knowledge triple as proposed by the model.
 */
record SemanticCandidate(
        String           subject,
        String           predicate,
        String           object,
        SemanticCategory category,
        double           confidence
) {

    /** Empty unless subject, predicate and object are all present. */
    static Optional<SemanticCandidate> parse(JsonNode node) {
        if (node == null || !node.isObject()) return Optional.empty();
        String subject   = CandidateFields.text(node, "subject");
        String predicate = CandidateFields.text(node, "predicate");
        String object    = CandidateFields.text(node, "object");
        if (subject == null || predicate == null || object == null) return Optional.empty();

        return Optional.of(new SemanticCandidate(
                subject, predicate, object,
                SemanticCategory.fromValue(CandidateFields.text(node, "category")),
                CandidateFields.score(node, "confidence", EpisodicCandidate.DEFAULT_CONFIDENCE)));
    }

    SemanticMemory toMemory(String id, String userId, String agentId, Instant now) {
        return SemanticMemory.builder()
                .id(id)
                .userId(userId)
                .agentId(agentId)
                .subject(subject)
                .predicate(predicate)
                .object(object)
                .category(category)
                .confidence(confidence)
                .createdAt(now)
                .build();
    }
}
