package com.openforge.mnemo.memory;

import com.openforge.mnemo.memory.model.EpisodicMemory;
import com.openforge.mnemo.memory.model.GraphEdge;
import com.openforge.mnemo.memory.model.GraphNode;
import com.openforge.mnemo.memory.model.SemanticMemory;
import com.openforge.mnemo.storage.GraphRepository;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Derives graph nodes and edges from stored memories, and removes them again.
 *
 * <pre>
 * user ──EXPERIENCED(importance)──▶ event ──AT_LOCATION──▶ loc_*
 *                                         └─INVOLVES────▶ person_*
 *
 * entity_subject ──PREDICATE(confidence)──▶ entity_object   (one edge per semantic memory)
 * </pre>
 */
public class MemoryGraphLinker {

    private final GraphRepository graphRepository;

    public MemoryGraphLinker(GraphRepository graphRepository) {
        this.graphRepository = graphRepository;
    }

    public void linkEpisodic(EpisodicMemory memory) {
        String userNode = GraphNode.userNodeId(memory.userId());
        graphRepository.addNode(new GraphNode(userNode, "User", Map.of("user_id", memory.userId())));

        Map<String, Object> eventProps = new HashMap<>();
        eventProps.put("summary",    memory.displayText());
        eventProps.put("event_type", memory.eventType().value());
        eventProps.put("importance", memory.importance());
        eventProps.put("user_id",    memory.userId());
        graphRepository.addNode(new GraphNode(memory.id(), "Event", eventProps));
        graphRepository.addEdge(new GraphEdge(userNode, memory.id(), GraphEdge.EXPERIENCED, memory.importance(), Map.of()));

        if (memory.location() != null && !memory.location().isBlank()) {
            String locationNode = GraphNode.locationNodeId(memory.location());
            graphRepository.addNode(new GraphNode(locationNode, "Location", Map.of("name", memory.location())));
            graphRepository.addEdge(GraphEdge.of(memory.id(), locationNode, GraphEdge.AT_LOCATION));
        }
        for (String person : memory.participants()) {
            String personNode = GraphNode.personNodeId(person);
            graphRepository.addNode(new GraphNode(personNode, "Person", Map.of("name", person)));
            graphRepository.addEdge(GraphEdge.of(memory.id(), personNode, GraphEdge.INVOLVES));
        }
    }

    /** Rebuilds the event node and its edges after the memory changed. */
    public void relinkEpisodic(EpisodicMemory memory) {
        graphRepository.deleteNode(memory.id(), true);
        linkEpisodic(memory);
    }

    /** Drops the event node with every edge touching it. Shared user, place and person nodes stay. */
    public boolean unlinkEpisodic(String memoryId) {
        return graphRepository.deleteNode(memoryId, true);
    }

    public void linkSemantic(SemanticMemory memory) {
        String subjectNode = GraphNode.entityNodeId(memory.subject());
        String objectNode  = GraphNode.entityNodeId(memory.object());
        graphRepository.addNode(new GraphNode(subjectNode, "Entity", Map.of("name", memory.subject())));
        graphRepository.addNode(new GraphNode(objectNode,  "Entity", Map.of("name", memory.object())));
        graphRepository.addEdge(new GraphEdge(subjectNode, objectNode,
                relationName(memory.predicate()),
                memory.confidence(),
                Map.of("category", memory.category().value(),
                       GraphEdge.MEMORY_ID, memory.id(),
                       GraphEdge.USER_ID, memory.userId())));
    }

    /** Entity nodes are shared between memories and users, so only the memory's edge goes. */
    public int unlinkSemantic(String memoryId) {
        return graphRepository.deleteEdgesOfMemory(memoryId);
    }

    public static String relationName(String predicate) {
        return predicate.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
    }
}
