package com.openforge.mnemo.storage.local;

import com.openforge.mnemo.memory.model.Direction;
import com.openforge.mnemo.memory.model.GraphEdge;
import com.openforge.mnemo.memory.model.GraphNode;
import com.openforge.mnemo.memory.model.Neighbor;
import com.openforge.mnemo.memory.model.Subgraph;
import com.openforge.mnemo.storage.GraphRepository;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Adjacency-list graph guarded by a read/write lock.
 *
 * Edges whose endpoint node does not exist (yet, or any more) are kept but
 * never reported as neighbours.
 */
public class InMemoryGraphRepository implements GraphRepository {

    private final Map<String, GraphNode>     nodes    = new HashMap<>();
    private final Map<EdgeKey, GraphEdge>    edges    = new LinkedHashMap<>();
    private final Map<String, Set<EdgeKey>>  outgoing = new HashMap<>();
    private final Map<String, Set<EdgeKey>>  incoming = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void addNode(GraphNode node) {
        lock.writeLock().lock();
        try {
            nodes.put(node.id(), node);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void addEdge(GraphEdge edge) {
        EdgeKey key = new EdgeKey(edge.sourceId(), edge.targetId(), edge.relationType(), edge.memoryId());
        lock.writeLock().lock();
        try {
            edges.put(key, edge);
            outgoing.computeIfAbsent(key.source(), k -> new LinkedHashSet<>()).add(key);
            incoming.computeIfAbsent(key.target(), k -> new LinkedHashSet<>()).add(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<GraphNode> getNode(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodes.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Neighbor> getNeighbors(String id, String relation, Direction direction, int maxDepth) {
        lock.readLock().lock();
        try {
            if (maxDepth <= 1) return directNeighbors(id, relation, direction);
            return breadthFirst(id, relation, direction, maxDepth);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<List<String>> findPath(String startId, String endId, int maxDepth) {
        lock.readLock().lock();
        try {
            Set<String> visited = new HashSet<>(Set.of(startId));
            Deque<List<String>> queue = new ArrayDeque<>();
            queue.add(List.of(startId));
            while (!queue.isEmpty()) {
                List<String> path = queue.poll();
                if (path.size() > maxDepth + 1) continue;
                String current = path.get(path.size() - 1);
                if (current.equals(endId)) return Optional.of(path);
                for (EdgeKey key : outgoing.getOrDefault(current, Set.of())) {
                    if (visited.add(key.target())) {
                        List<String> next = new ArrayList<>(path);
                        next.add(key.target());
                        queue.add(next);
                    }
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean deleteNode(String id, boolean cascade) {
        lock.writeLock().lock();
        try {
            boolean changed = false;
            if (cascade) {
                for (EdgeKey key : List.copyOf(outgoing.getOrDefault(id, Set.of()))) changed |= removeEdge(key);
                for (EdgeKey key : List.copyOf(incoming.getOrDefault(id, Set.of()))) changed |= removeEdge(key);
            }
            return nodes.remove(id) != null || changed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean deleteEdge(String sourceId, String targetId, String relation) {
        lock.writeLock().lock();
        try {
            boolean changed = false;
            for (EdgeKey key : List.copyOf(outgoing.getOrDefault(sourceId, Set.of()))) {
                if (key.target().equals(targetId) && (relation == null || key.relation().equals(relation))) {
                    changed |= removeEdge(key);
                }
            }
            return changed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int deleteEdgesOfMemory(String memoryId) {
        if (memoryId == null) return 0;
        lock.writeLock().lock();
        try {
            int removed = 0;
            for (EdgeKey key : List.copyOf(edges.keySet())) {
                if (memoryId.equals(key.memoryId()) && removeEdge(key)) removed++;
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Subgraph querySubgraph(String centerId, int maxDepth, Set<String> relationFilter) {
        lock.readLock().lock();
        try {
            Set<String> visited = new HashSet<>(Set.of(centerId));
            List<GraphNode> foundNodes = new ArrayList<>();
            Set<GraphEdge> foundEdges = new LinkedHashSet<>();
            GraphNode center = nodes.get(centerId);
            if (center != null) foundNodes.add(center);

            Deque<Hop> queue = new ArrayDeque<>();
            queue.add(new Hop(centerId, 0));
            while (!queue.isEmpty()) {
                Hop hop = queue.poll();
                if (hop.depth() >= maxDepth) continue;
                for (EdgeKey key : touching(hop.nodeId())) {
                    if (relationFilter != null && !relationFilter.isEmpty() && !relationFilter.contains(key.relation())) {
                        continue;
                    }
                    foundEdges.add(edges.get(key));
                    String other = key.source().equals(hop.nodeId()) ? key.target() : key.source();
                    if (visited.add(other)) {
                        GraphNode node = nodes.get(other);
                        if (node != null) foundNodes.add(node);
                        queue.add(new Hop(other, hop.depth() + 1));
                    }
                }
            }
            return new Subgraph(foundNodes, List.copyOf(foundEdges));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Private helpers (caller holds the lock) ──────────────────────────────

    private List<Neighbor> directNeighbors(String id, String relation, Direction direction) {
        List<Neighbor> result = new ArrayList<>();
        for (Step step : steps(id, relation, direction)) {
            GraphNode node = nodes.get(step.otherId());
            if (node != null) result.add(step.toNeighbor(node, 1));
        }
        return result;
    }

    private List<Neighbor> breadthFirst(String id, String relation, Direction direction, int maxDepth) {
        Set<String> visited = new HashSet<>(Set.of(id));
        Deque<Hop> queue = new ArrayDeque<>();
        queue.add(new Hop(id, 0));
        List<Neighbor> result = new ArrayList<>();
        while (!queue.isEmpty()) {
            Hop hop = queue.poll();
            if (hop.depth() >= maxDepth) continue;
            for (Step step : steps(hop.nodeId(), relation, direction)) {
                if (!visited.add(step.otherId())) continue;
                GraphNode node = nodes.get(step.otherId());
                if (node != null) result.add(step.toNeighbor(node, hop.depth() + 1));
                queue.add(new Hop(step.otherId(), hop.depth() + 1));
            }
        }
        return result;
    }

    private List<Step> steps(String id, String relation, Direction direction) {
        List<Step> steps = new ArrayList<>();
        if (direction.followsOutgoing()) {
            for (EdgeKey key : outgoing.getOrDefault(id, Set.of())) {
                if (relation == null || key.relation().equals(relation)) {
                    steps.add(new Step(key.target(), edges.get(key), Direction.OUTGOING));
                }
            }
        }
        if (direction.followsIncoming()) {
            for (EdgeKey key : incoming.getOrDefault(id, Set.of())) {
                if (relation == null || key.relation().equals(relation)) {
                    steps.add(new Step(key.source(), edges.get(key), Direction.INCOMING));
                }
            }
        }
        return steps;
    }

    private Set<EdgeKey> touching(String id) {
        Set<EdgeKey> keys = new LinkedHashSet<>(outgoing.getOrDefault(id, Set.of()));
        keys.addAll(incoming.getOrDefault(id, Set.of()));
        return keys;
    }

    private boolean removeEdge(EdgeKey key) {
        if (edges.remove(key) == null) return false;
        outgoing.getOrDefault(key.source(), new HashSet<>()).remove(key);
        incoming.getOrDefault(key.target(), new HashSet<>()).remove(key);
        return true;
    }

    private record EdgeKey(String source, String target, String relation, String memoryId) {}

    private record Hop(String nodeId, int depth) {}

    private record Step(String otherId, GraphEdge edge, Direction direction) {
        Neighbor toNeighbor(GraphNode node, int depth) {
            return new Neighbor(node, edge.relationType(), direction, edge.weight(), depth, edge.properties());
        }
    }
}
