package com.openforge.mnemo.storage.local;

import com.openforge.mnemo.storage.DocumentRepository;
import com.openforge.mnemo.storage.MemoryCollections;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Document store backed by one concurrent map and one {@link LuceneFullTextIndex} per collection.
 *
 * Returned documents are copies; callers change stored state only through {@link #update}.
 */
@Slf4j
public class InMemoryDocumentRepository implements DocumentRepository, AutoCloseable {

    private final Map<String, Collection> collections = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String insert(String collection, Map<String, Object> document) {
        Object rawId = document.get("id");
        String id = rawId == null || rawId.toString().isBlank() ? UUID.randomUUID().toString() : rawId.toString();
        Map<String, Object> stored = new HashMap<>(document);
        stored.put("id", id);

        Collection c = collection(collection);
        c.documents().compute(id, (key, previous) -> {
            c.index().index(id, stored);
            return new Stored(sequence.incrementAndGet(), stored);
        });
        return id;
    }

    @Override
    public Optional<Map<String, Object>> findById(String collection, String id) {
        Stored stored = collection(collection).documents().get(id);
        return Optional.ofNullable(stored).map(s -> new HashMap<>(s.document()));
    }

    @Override
    public List<Map<String, Object>> find(String collection,
                                          Map<String, Object> query,
                                          String sortBy,
                                          SortOrder sortOrder,
                                          int skip,
                                          int limit) {
        Comparator<Stored> order = Comparator.comparingLong(Stored::seq);
        if (sortBy != null) {
            Comparator<Stored> byField = (a, b) -> compareValues(a.document().get(sortBy), b.document().get(sortBy));
            if (sortOrder == SortOrder.DESC) byField = byField.reversed();
            order = byField.thenComparing(order);
        }
        var stream = collection(collection).documents().values().stream()
                .filter(s -> matches(s.document(), query))
                .sorted(order)
                .skip(Math.max(0, skip));
        if (limit > 0) stream = stream.limit(limit);
        return stream.map(s -> (Map<String, Object>) new HashMap<>(s.document())).toList();
    }

    @Override
    public boolean update(String collection, String id, Map<String, Object> partial) {
        Collection c = collection(collection);
        // index write happens inside the compute: one writer per id at a time
        Stored updated = c.documents().computeIfPresent(id, (key, current) -> {
            Map<String, Object> merged = new HashMap<>(current.document());
            merged.putAll(partial);
            merged.put("id", id);
            c.index().index(id, merged);
            return new Stored(current.seq(), merged);
        });
        return updated != null;
    }

    @Override
    public boolean delete(String collection, String id) {
        Collection c = collection(collection);
        AtomicBoolean removed = new AtomicBoolean();
        c.documents().computeIfPresent(id, (key, current) -> {
            c.index().remove(id);
            removed.set(true);
            return null;
        });
        return removed.get();
    }

    @Override
    public long count(String collection, Map<String, Object> query) {
        return collection(collection).documents().values().stream()
                .filter(s -> matches(s.document(), query))
                .count();
    }

    @Override
    public List<Map<String, Object>> fullTextSearch(String collection, String text, List<String> fields, int limit) {
        Collection c = collection(collection);
        List<Map<String, Object>> results = new ArrayList<>();
        for (String id : c.index().search(text, fields, limit)) {
            Stored stored = c.documents().get(id);
            if (stored != null) results.add(new HashMap<>(stored.document()));
        }
        log.debug("[FTS] {} '{}' → {} hits", collection, text, results.size());
        return results;
    }

    @Override
    public void close() {
        for (Collection c : collections.values()) {
            try {
                c.index().close();
            } catch (IOException e) {
                log.warn("[FTS] Failed to close index: {}", e.getMessage());
            }
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Collection collection(String name) {
        MemoryCollections.requireDocumentCollection(name);
        return collections.computeIfAbsent(name, n -> new Collection(new ConcurrentHashMap<>(), new LuceneFullTextIndex()));
    }

    private static boolean matches(Map<String, Object> document, Map<String, Object> query) {
        if (query == null || query.isEmpty()) return true;
        for (Map.Entry<String, Object> q : query.entrySet()) {
            if (!valueEquals(document.get(q.getKey()), q.getValue())) return false;
        }
        return true;
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }

    /** Nulls sort last; mixed types fall back to their string form. */
    private static int compareValues(Object a, Object b) {
        if (a == null && b == null) return 0;
        if (a == null) return 1;
        if (b == null) return -1;
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return Boolean.compare(x, y);
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        return a.toString().compareTo(b.toString());
    }

    private record Stored(long seq, Map<String, Object> document) {}

    private record Collection(Map<String, Stored> documents, LuceneFullTextIndex index) {}
}
