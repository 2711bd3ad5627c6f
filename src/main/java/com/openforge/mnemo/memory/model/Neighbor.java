package com.openforge.mnemo.memory.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node reached from a starting node, with the edge that led to it.
 *
 * @param direction      OUTGOING when the edge points away from the previous node
 * @param depth          hops from the starting node (1 = direct neighbour)
 * @param edgeProperties properties of the traversed edge
 */
public record Neighbor(
        GraphNode           node,
        String              relation,
        Direction           direction,
        double              weight,
        int                 depth,
        Map<String, Object> edgeProperties
) {

    public Neighbor {
        edgeProperties = edgeProperties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(edgeProperties));
    }
}
