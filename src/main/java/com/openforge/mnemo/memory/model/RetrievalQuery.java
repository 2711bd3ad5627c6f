package com.openforge.mnemo.memory.model;

import lombok.Builder;

/**
 * Parameters of one retrieval call.
 *
 * @param eventType optional filter on the episodic vector search; null means any type
 * @param topK      result size, bounded to [1, 50]
 */
@Builder(toBuilder = true)
public record RetrievalQuery(
        String    userId,
        String    query,
        int       topK,
        boolean   includeEpisodic,
        boolean   includeSemantic,
        EventType eventType
) {

    public static final int DEFAULT_TOP_K = 5;
    public static final int MAX_TOP_K     = 50;

    public RetrievalQuery {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        query = query == null ? "" : query;
        topK  = Math.max(1, Math.min(MAX_TOP_K, topK));
    }

    /** Both memory kinds, default breadth. */
    public static RetrievalQuery forUser(String userId, String query, int topK) {
        return new RetrievalQuery(userId, query, topK, true, true, null);
    }
}
