package com.openforge.mnemo.storage;

import com.openforge.mnemo.memory.model.Direction;
import com.openforge.mnemo.memory.model.GraphEdge;
import com.openforge.mnemo.memory.model.GraphNode;
import com.openforge.mnemo.memory.model.Neighbor;
import com.openforge.mnemo.memory.model.Subgraph;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Derived knowledge graph over episodic and semantic memories.
 */
public interface GraphRepository {

    /** Inserts or replaces the node with the same id. */
    void addNode(GraphNode node);

    /** Inserts or replaces the edge with the same (source, target, relation, memory id). */
    void addEdge(GraphEdge edge);

    Optional<GraphNode> getNode(String id);

    /**
     * With {@code maxDepth == 1} every matching edge yields one neighbour; deeper
     * walks are breadth-first and report each node once, at its shallowest depth.
     *
     * @param relation only follow edges of this type; null follows all
     */
    List<Neighbor> getNeighbors(String id, String relation, Direction direction, int maxDepth);

    /** Shortest path along outgoing edges, start and end inclusive. */
    Optional<List<String>> findPath(String startId, String endId, int maxDepth);

    /** @param cascade also remove every edge touching the node */
    boolean deleteNode(String id, boolean cascade);

    /** @param relation null removes every edge between the pair */
    boolean deleteEdge(String sourceId, String targetId, String relation);

    /**
     * Removes every edge tagged with the memory id, whatever its endpoints.
     *
     * @return number of edges removed
     */
    int deleteEdgesOfMemory(String memoryId);

    /** @param relationFilter null or empty keeps every relation */
    Subgraph querySubgraph(String centerId, int maxDepth, Set<String> relationFilter);
}
