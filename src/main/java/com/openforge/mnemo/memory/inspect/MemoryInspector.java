package com.openforge.mnemo.memory.inspect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.openforge.mnemo.memory.MemoryDocuments;
import com.openforge.mnemo.storage.DocumentRepository;
import com.openforge.mnemo.storage.MemoryCollections;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views over a user's stored memories, archived ones included.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryInspector {

    static final int TOP_KEYWORDS = 20;

    private final DocumentRepository documentRepository;
    private final ObjectMapper       objectMapper;
    private final Clock              clock;

    public MemoryStats stats(String userId) {
        List<Map<String, Object>> episodic = allOf(MemoryCollections.EPISODIC_DOCUMENTS, userId);

        long archived = 0;
        long compressed = 0;
        Instant oldest = null;
        Instant newest = null;
        Map<String, Integer> eventTypes = new HashMap<>();
        Map<String, Integer> keywords   = new LinkedHashMap<>();

        for (Map<String, Object> doc : episodic) {
            if (MemoryDocuments.bool(doc, MemoryDocuments.IS_ARCHIVED))   archived++;
            if (MemoryDocuments.bool(doc, MemoryDocuments.IS_COMPRESSED)) compressed++;

            String eventType = MemoryDocuments.str(doc, MemoryDocuments.EVENT_TYPE);
            eventTypes.merge(eventType == null ? "unknown" : eventType, 1, Integer::sum);
            for (String keyword : MemoryDocuments.strings(doc, MemoryDocuments.KEYWORDS)) {
                keywords.merge(keyword, 1, Integer::sum);
            }

            Instant created = MemoryDocuments.instant(doc, MemoryDocuments.CREATED_AT);
            if (created != null) {
                if (oldest == null || created.isBefore(oldest)) oldest = created;
                if (newest == null || created.isAfter(newest))  newest = created;
            }
        }

        List<MemoryStats.KeywordCount> top = keywords.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(TOP_KEYWORDS)
                .map(e -> new MemoryStats.KeywordCount(e.getKey(), e.getValue()))
                .toList();

        long semantic = documentRepository.count(MemoryCollections.SEMANTIC_DOCUMENTS,
                Map.of(MemoryDocuments.USER_ID, userId));

        return new MemoryStats(userId, episodic.size(), episodic.size() - archived, archived, compressed,
                semantic, oldest, newest, eventTypes, top);
    }

    /** Every memory of the user as pretty-printed JSON, newest first. */
    public String exportJson(String userId) {
        Map<String, Object> export = new LinkedHashMap<>();
        export.put("user_id", userId);
        export.put("exported_at", clock.instant().toString());
        export.put("episodic_memories", allOf(MemoryCollections.EPISODIC_DOCUMENTS, userId));
        export.put("semantic_memories", allOf(MemoryCollections.SEMANTIC_DOCUMENTS, userId));
        try {
            return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(export);
        } catch (JsonProcessingException e) {
            log.error("[Inspector] Export failed for user {}: {}", userId, e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    private List<Map<String, Object>> allOf(String collection, String userId) {
        return documentRepository.find(collection, Map.of(MemoryDocuments.USER_ID, userId),
                MemoryDocuments.CREATED_AT, DocumentRepository.SortOrder.DESC, 0, 0);
    }
}
