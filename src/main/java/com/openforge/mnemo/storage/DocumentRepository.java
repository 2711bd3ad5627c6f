package com.openforge.mnemo.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schemaless document store. Documents are flat maps keyed by field name and
 * carry their id under {@code "id"}.
 */
public interface DocumentRepository {

    enum SortOrder { ASC, DESC }

    /** @return the id of the stored document */
    String insert(String collection, Map<String, Object> document);

    Optional<Map<String, Object>> findById(String collection, String id);

    /**
     * Equality query.
     *
     * @param sortBy field to sort on, or null for insertion order
     * @param limit  maximum documents returned; non-positive means unbounded
     */
    List<Map<String, Object>> find(String collection,
                                   Map<String, Object> query,
                                   String sortBy,
                                   SortOrder sortOrder,
                                   int skip,
                                   int limit);

    /** Merges {@code partial} into the stored document. */
    boolean update(String collection, String id, Map<String, Object> partial);

    boolean delete(String collection, String id);

    long count(String collection, Map<String, Object> query);

    /** Relevance-ordered full-text search over the given fields. */
    List<Map<String, Object>> fullTextSearch(String collection, String text, List<String> fields, int limit);
}
