package com.openforge.mnemo.memory;

import com.openforge.mnemo.memory.model.EpisodicMemory;
import com.openforge.mnemo.memory.model.EventType;
import com.openforge.mnemo.memory.model.SemanticCategory;
import com.openforge.mnemo.memory.model.SemanticMemory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Document layout of stored memories and the conversions in both directions.
 *
 * Field names are snake_case. Timestamps are epoch milliseconds so the document
 * store can sort on them; enums are stored by their wire value.
 */
public final class MemoryDocuments {

    public static final String ID                   = "id";
    public static final String USER_ID              = "user_id";
    public static final String AGENT_ID             = "agent_id";
    public static final String SOURCE_SESSION_ID    = "source_session_id";
    public static final String LOSSLESS_RESTATEMENT = "lossless_restatement";
    public static final String SUMMARY              = "summary";
    public static final String KEYWORDS             = "keywords";
    public static final String EVENT_TYPE           = "event_type";
    public static final String PARTICIPANTS         = "participants";
    public static final String LOCATION             = "location";
    public static final String IMPORTANCE           = "importance";
    public static final String CONFIDENCE           = "confidence";
    public static final String ACCESS_COUNT         = "access_count";
    public static final String LAST_ACCESSED_AT     = "last_accessed_at";
    public static final String IS_ARCHIVED          = "is_archived";
    public static final String IS_COMPRESSED        = "is_compressed";
    public static final String MERGED_FROM          = "merged_from";
    public static final String CREATED_AT           = "created_at";

    public static final String SUBJECT   = "subject";
    public static final String PREDICATE = "predicate";
    public static final String OBJECT    = "object";
    public static final String CATEGORY  = "category";

    /** Fields searched by the lexical retrieval strategy. */
    public static final List<String> EPISODIC_TEXT_FIELDS = List.of(LOSSLESS_RESTATEMENT, SUMMARY, KEYWORDS);

    private MemoryDocuments() {
    }

    // ── Episodic ─────────────────────────────────────────────────────────────

    public static Map<String, Object> toDocument(EpisodicMemory m) {
        Map<String, Object> doc = new HashMap<>();
        doc.put(ID,                   m.id());
        doc.put(USER_ID,              m.userId());
        doc.put(AGENT_ID,             m.agentId());
        doc.put(SOURCE_SESSION_ID,    m.sourceSessionId());
        doc.put(LOSSLESS_RESTATEMENT, m.losslessRestatement());
        doc.put(SUMMARY,              m.summary());
        doc.put(KEYWORDS,             new ArrayList<>(m.keywords()));
        doc.put(EVENT_TYPE,           m.eventType().value());
        doc.put(PARTICIPANTS,         new ArrayList<>(m.participants()));
        doc.put(LOCATION,             m.location());
        doc.put(IMPORTANCE,           m.importance());
        doc.put(CONFIDENCE,           m.confidence());
        doc.put(ACCESS_COUNT,         m.accessCount());
        doc.put(LAST_ACCESSED_AT,     millis(m.lastAccessedAt()));
        doc.put(IS_ARCHIVED,          m.archived());
        doc.put(IS_COMPRESSED,        m.compressed());
        doc.put(MERGED_FROM,          new ArrayList<>(m.mergedFrom()));
        doc.put(CREATED_AT,           millis(m.createdAt()));
        return doc;
    }

    public static EpisodicMemory episodicFrom(Map<String, Object> doc) {
        return EpisodicMemory.builder()
                .id(str(doc, ID))
                .userId(str(doc, USER_ID))
                .agentId(str(doc, AGENT_ID))
                .sourceSessionId(str(doc, SOURCE_SESSION_ID))
                .losslessRestatement(str(doc, LOSSLESS_RESTATEMENT))
                .summary(str(doc, SUMMARY))
                .keywords(strings(doc, KEYWORDS))
                .eventType(EventType.fromValue(str(doc, EVENT_TYPE)))
                .participants(strings(doc, PARTICIPANTS))
                .location(str(doc, LOCATION))
                .importance(num(doc, IMPORTANCE, 0.5))
                .confidence(num(doc, CONFIDENCE, 0.8))
                .accessCount((int) num(doc, ACCESS_COUNT, 0))
                .lastAccessedAt(instant(doc, LAST_ACCESSED_AT))
                .archived(bool(doc, IS_ARCHIVED))
                .compressed(bool(doc, IS_COMPRESSED))
                .mergedFrom(strings(doc, MERGED_FROM))
                .createdAt(instant(doc, CREATED_AT))
                .build();
    }

    /** Text shown for a stored episodic document: summary, else the restatement. */
    public static String displayText(Map<String, Object> doc) {
        String summary = str(doc, SUMMARY);
        return summary != null && !summary.isBlank() ? summary : nonNull(str(doc, LOSSLESS_RESTATEMENT));
    }

    // ── Semantic ─────────────────────────────────────────────────────────────

    public static Map<String, Object> toDocument(SemanticMemory m) {
        Map<String, Object> doc = new HashMap<>();
        doc.put(ID,         m.id());
        doc.put(USER_ID,    m.userId());
        doc.put(AGENT_ID,   m.agentId());
        doc.put(SUBJECT,    m.subject());
        doc.put(PREDICATE,  m.predicate());
        doc.put(OBJECT,     m.object());
        doc.put(CATEGORY,   m.category().value());
        doc.put(CONFIDENCE, m.confidence());
        doc.put(CREATED_AT, millis(m.createdAt()));
        return doc;
    }

    public static SemanticMemory semanticFrom(Map<String, Object> doc) {
        return SemanticMemory.builder()
                .id(str(doc, ID))
                .userId(str(doc, USER_ID))
                .agentId(str(doc, AGENT_ID))
                .subject(str(doc, SUBJECT))
                .predicate(str(doc, PREDICATE))
                .object(str(doc, OBJECT))
                .category(SemanticCategory.fromValue(str(doc, CATEGORY)))
                .confidence(num(doc, CONFIDENCE, 0.8))
                .createdAt(instant(doc, CREATED_AT))
                .build();
    }

    // ── Vector metadata ──────────────────────────────────────────────────────

    /** Filterable fields stored next to an episodic embedding. */
    public static Map<String, Object> vectorMetadata(EpisodicMemory m) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(USER_ID,    m.userId());
        metadata.put(AGENT_ID,   m.agentId());
        metadata.put(EVENT_TYPE, m.eventType().value());
        metadata.put(IMPORTANCE, m.importance());
        metadata.put(CREATED_AT, millis(m.createdAt()));
        return metadata;
    }

    public static Map<String, Object> vectorMetadata(SemanticMemory m) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(USER_ID,   m.userId());
        metadata.put(CATEGORY,  m.category().value());
        metadata.put(SUBJECT,   m.subject());
        metadata.put(PREDICATE, m.predicate());
        metadata.put(OBJECT,    m.object());
        return metadata;
    }

    // ── Field extractors ─────────────────────────────────────────────────────

    public static String str(Map<String, Object> doc, String key) {
        Object value = doc.get(key);
        return value == null ? null : value.toString();
    }

    public static double num(Map<String, Object> doc, String key, double fallback) {
        return doc.get(key) instanceof Number n ? n.doubleValue() : fallback;
    }

    public static boolean bool(Map<String, Object> doc, String key) {
        Object value = doc.get(key);
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.intValue() != 0;
        return false;
    }

    public static List<String> strings(Map<String, Object> doc, String key) {
        if (!(doc.get(key) instanceof Collection<?> values)) return List.of();
        List<String> out = new ArrayList<>(values.size());
        for (Object v : values) {
            if (v != null) out.add(v.toString());
        }
        return out;
    }

    public static Instant instant(Map<String, Object> doc, String key) {
        return doc.get(key) instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : null;
    }

    public static Long millis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static String nonNull(String s) {
        return s == null ? "" : s;
    }
}
