package com.openforge.mnemo.memory.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Directed, typed edge. At most one edge exists per (source, target, relation, memory id);
 * adding it again replaces weight and properties. Edges tagged with different memory ids
 * between the same entities coexist, one per memory.
 */
public record GraphEdge(
        String              sourceId,
        String              targetId,
        String              relationType,
        double              weight,
        Map<String, Object> properties
) {

    public static final String EXPERIENCED = "EXPERIENCED";
    public static final String AT_LOCATION = "AT_LOCATION";
    public static final String INVOLVES    = "INVOLVES";

    public static final String MEMORY_ID = "memory_id";
    public static final String USER_ID   = "user_id";

    public GraphEdge {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        if (weight < 0) weight = 0;
    }

    /** The memory this edge was derived from, or null for structural edges. */
    public String memoryId() {
        Object id = properties.get(MEMORY_ID);
        return id == null ? null : id.toString();
    }

    public static GraphEdge of(String sourceId, String targetId, String relationType) {
        return new GraphEdge(sourceId, targetId, relationType, 1.0, Map.of());
    }
}
