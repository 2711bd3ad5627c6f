package com.openforge.mnemo.memory.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node of the derived knowledge graph. Ids are namespaced:
 * {@code user_<id>}, the memory id, {@code loc_<name>}, {@code person_<name>}, {@code entity_<name>}.
 */
public record GraphNode(
        String              id,
        String              label,
        Map<String, Object> properties
) {

    public static final String USER_PREFIX     = "user_";
    public static final String LOCATION_PREFIX = "loc_";
    public static final String PERSON_PREFIX   = "person_";
    public static final String ENTITY_PREFIX   = "entity_";

    public GraphNode {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public String textProperty(String key) {
        Object value = properties.get(key);
        return value == null ? "" : value.toString();
    }

    public static String userNodeId(String userId)       { return USER_PREFIX + userId; }
    public static String locationNodeId(String location) { return LOCATION_PREFIX + location; }
    public static String personNodeId(String person)     { return PERSON_PREFIX + person; }
    public static String entityNodeId(String entity)     { return ENTITY_PREFIX + entity; }
}
