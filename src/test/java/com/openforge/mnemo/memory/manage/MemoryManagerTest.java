package com.openforge.mnemo.memory.manage;

import com.openforge.mnemo.memory.MemoryDocuments;
import com.openforge.mnemo.memory.MemoryGraphLinker;
import com.openforge.mnemo.memory.MemoryIds;
import com.openforge.mnemo.memory.UserLockRegistry;
import com.openforge.mnemo.memory.model.Direction;
import com.openforge.mnemo.memory.model.EpisodicMemory;
import com.openforge.mnemo.memory.model.EventType;
import com.openforge.mnemo.memory.model.GraphEdge;
import com.openforge.mnemo.memory.model.GraphNode;
import com.openforge.mnemo.memory.model.SemanticCategory;
import com.openforge.mnemo.memory.model.SemanticMemory;
import com.openforge.mnemo.storage.MemoryCollections;
import com.openforge.mnemo.storage.local.InMemoryDocumentRepository;
import com.openforge.mnemo.storage.local.InMemoryGraphRepository;
import com.openforge.mnemo.storage.local.InMemoryVectorRepository;
import com.openforge.mnemo.support.TokenEmbeddingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.openforge.mnemo.support.EpisodicFixtures.episodic;
import static org.assertj.core.api.Assertions.assertThat;

class MemoryManagerTest {

    private static final Instant NOW  = Instant.parse("2026-09-01T10:00:00Z");
    private static final String  USER = "u-1";

    private InMemoryDocumentRepository documents;
    private InMemoryVectorRepository   vectors;
    private InMemoryGraphRepository    graph;
    private TokenEmbeddingService      embedding;
    private MemoryGraphLinker          linker;
    private MemoryManager              manager;

    @BeforeEach
    void setUp() {
        documents = new InMemoryDocumentRepository();
        vectors   = new InMemoryVectorRepository();
        graph     = new InMemoryGraphRepository();
        embedding = new TokenEmbeddingService();
        linker    = new MemoryGraphLinker(graph);
        manager   = new MemoryManager(embedding, vectors, documents, graph, new UserLockRegistry());
    }

    @AfterEach
    void tearDown() {
        documents.close();
    }

    @Test
    void listingIsNewestFirstPagedAndHidesArchived() {
        EpisodicMemory oldest = persist(episodic(USER, "first trip", 0.5, NOW.minus(Duration.ofDays(4))));
        persist(episodic(USER, "second trip", 0.5, NOW.minus(Duration.ofDays(3))));
        EpisodicMemory third  = persist(episodic(USER, "third trip", 0.5, NOW.minus(Duration.ofDays(2))));
        EpisodicMemory newest = persist(episodic(USER, "fourth trip", 0.5, NOW.minus(Duration.ofDays(1))));
        persist(episodic("u-2", "someone else's trip", 0.5, NOW));
        manager.updateEpisodic(oldest.id(), EpisodicUpdate.builder().archived(true).build());

        MemoryPage<EpisodicMemory> first = manager.listEpisodic(USER, 1, 2, null);

        assertThat(first.items()).extracting(EpisodicMemory::id).containsExactly(newest.id(), third.id());
        assertThat(first.total()).isEqualTo(3);
        assertThat(first.totalPages()).isEqualTo(2);
        assertThat(manager.listEpisodic(USER, 2, 2, null).items()).hasSize(1);
        assertThat(manager.listEpisodic(USER, 1, 10, EpisodicFilter.builder().includeArchived(true).build()).total())
                .isEqualTo(4);
    }

    @Test
    void listingFiltersByEventTypeImportanceAndKeywords() {
        EpisodicMemory drive = persist(episodic(USER, "Drove to the airport", 0.8, NOW).toBuilder()
                .eventType(EventType.NAVIGATION).keywords(List.of("Airport", "car")).build());
        persist(episodic(USER, "Drove home", 0.2, NOW).toBuilder()
                .eventType(EventType.NAVIGATION).keywords(List.of("home")).build());
        persist(episodic(USER, "Played jazz", 0.9, NOW).toBuilder()
                .eventType(EventType.MUSIC_PLAYBACK).keywords(List.of("jazz")).build());

        EpisodicFilter important = EpisodicFilter.builder().eventType(EventType.NAVIGATION).minImportance(0.5).build();
        assertThat(manager.listEpisodic(USER, 1, 20, important).items())
                .extracting(EpisodicMemory::id).containsExactly(drive.id());

        EpisodicFilter byKeyword = EpisodicFilter.builder().keywords(List.of("airp")).build();
        assertThat(manager.listEpisodic(USER, 1, 20, byKeyword).items())
                .extracting(EpisodicMemory::id).containsExactly(drive.id());
    }

    @Test
    void updateRewritesDocumentVectorMetadataAndGraphLinks() {
        EpisodicMemory memory = persist(episodic(USER, "Drove to the airport", 0.4, NOW));

        boolean changed = manager.updateEpisodic(memory.id(), EpisodicUpdate.builder()
                .summary("Airport run")
                .importance(1.7)
                .eventType(EventType.NAVIGATION)
                .location("airport")
                .build());

        assertThat(changed).isTrue();
        EpisodicMemory stored = manager.getEpisodic(memory.id()).orElseThrow();
        assertThat(stored.summary()).isEqualTo("Airport run");
        assertThat(stored.importance()).isEqualTo(1.0);
        assertThat(stored.eventType()).isEqualTo(EventType.NAVIGATION);
        assertThat(stored.losslessRestatement()).isEqualTo("Drove to the airport");

        assertThat(vectors.search(embedding.embed("Drove to the airport"), 5, MemoryCollections.EPISODIC_VECTORS,
                Map.of(MemoryDocuments.EVENT_TYPE, "navigation"), 0.0))
                .extracting(hit -> hit.memoryId()).containsExactly(memory.id());
        assertThat(graph.getNeighbors(GraphNode.userNodeId(USER), GraphEdge.EXPERIENCED, Direction.OUTGOING, 1))
                .singleElement().satisfies(n -> assertThat(n.weight()).isEqualTo(1.0));
        assertThat(graph.getNeighbors(memory.id(), GraphEdge.AT_LOCATION, Direction.OUTGOING, 1))
                .extracting(n -> n.node().id()).containsExactly("loc_airport");
    }

    @Test
    void emptyUpdateAndUnknownMemoryChangeNothing() {
        EpisodicMemory memory = persist(episodic(USER, "Drove to the airport", 0.4, NOW));

        assertThat(manager.updateEpisodic(memory.id(), EpisodicUpdate.builder().build())).isFalse();
        assertThat(manager.updateEpisodic("mem_ep_missing", EpisodicUpdate.builder().summary("x").build())).isFalse();
        assertThat(manager.getEpisodic(memory.id()).orElseThrow().importance()).isEqualTo(0.4);
    }

    @Test
    void deletingAnEpisodeClearsAllThreeStores() {
        EpisodicMemory memory = persist(episodic(USER, "Drove to the airport", 0.4, NOW));

        assertThat(manager.deleteEpisodic(memory.id())).isTrue();

        assertThat(manager.getEpisodic(memory.id())).isEmpty();
        assertThat(vectors.search(embedding.embed("Drove to the airport"), 5,
                MemoryCollections.EPISODIC_VECTORS, Map.of(), 0.0)).isEmpty();
        assertThat(graph.getNode(memory.id())).isEmpty();
        assertThat(manager.deleteEpisodic(memory.id())).isFalse();
    }

    @Test
    void deletingASharedTripleLeavesTheOtherUsersEdge() {
        SemanticMemory mine   = persist(fact(USER, SemanticCategory.PREFERENCE));
        SemanticMemory theirs = persist(fact("u-2", SemanticCategory.PREFERENCE));

        assertThat(manager.deleteSemantic(mine.id())).isTrue();

        assertThat(manager.getSemantic(mine.id())).isEmpty();
        assertThat(graph.getNeighbors("entity_user", "LIKES", Direction.OUTGOING, 1))
                .extracting(n -> n.edgeProperties().get(GraphEdge.MEMORY_ID))
                .containsExactly(theirs.id());
        assertThat(vectors.search(embedding.embed("user likes jazz"), 5, MemoryCollections.SEMANTIC_VECTORS,
                Map.of(), 0.0)).extracting(hit -> hit.memoryId()).containsExactly(theirs.id());
    }

    @Test
    void semanticListingFiltersByCategory() {
        SemanticMemory preference = persist(fact(USER, SemanticCategory.PREFERENCE));
        persist(fact(USER, SemanticCategory.FACT));

        MemoryPage<SemanticMemory> page = manager.listSemantic(USER, 1, 20, SemanticCategory.PREFERENCE);

        assertThat(page.items()).extracting(SemanticMemory::id).containsExactly(preference.id());
        assertThat(page.total()).isEqualTo(1);
        assertThat(manager.listSemantic(USER, 1, 0, null).pageSize()).isEqualTo(MemoryManager.DEFAULT_PAGE_SIZE);
    }

    @Test
    void clearAllRemovesOnlyThatUsersMemories() {
        persist(episodic(USER, "Drove to the airport", 0.4, NOW));
        EpisodicMemory archived = persist(episodic(USER, "Drove home", 0.1, NOW));
        manager.updateEpisodic(archived.id(), EpisodicUpdate.builder().archived(true).build());
        persist(fact(USER, SemanticCategory.PREFERENCE));
        EpisodicMemory foreign = persist(episodic("u-2", "Drove to work", 0.4, NOW));
        SemanticMemory foreignFact = persist(fact("u-2", SemanticCategory.PREFERENCE));

        ClearResult result = manager.clearAll(USER);

        assertThat(result.episodicDeleted()).isEqualTo(2);
        assertThat(result.semanticDeleted()).isEqualTo(1);
        assertThat(graph.getNode(GraphNode.userNodeId(USER))).isEmpty();
        assertThat(manager.getEpisodic(foreign.id())).isPresent();
        assertThat(graph.getNeighbors("entity_user", "LIKES", Direction.OUTGOING, 1))
                .extracting(n -> n.edgeProperties().get(GraphEdge.MEMORY_ID))
                .containsExactly(foreignFact.id());
    }

    private EpisodicMemory persist(EpisodicMemory memory) {
        documents.insert(MemoryCollections.EPISODIC_DOCUMENTS, MemoryDocuments.toDocument(memory));
        vectors.upsert(memory.id(), embedding.embed(memory.losslessRestatement()),
                MemoryDocuments.vectorMetadata(memory), MemoryCollections.EPISODIC_VECTORS);
        linker.linkEpisodic(memory);
        return memory;
    }

    private SemanticMemory persist(SemanticMemory memory) {
        documents.insert(MemoryCollections.SEMANTIC_DOCUMENTS, MemoryDocuments.toDocument(memory));
        vectors.upsert(memory.id(), embedding.embed(memory.tripleText()),
                MemoryDocuments.vectorMetadata(memory), MemoryCollections.SEMANTIC_VECTORS);
        linker.linkSemantic(memory);
        return memory;
    }

    private static SemanticMemory fact(String userId, SemanticCategory category) {
        return SemanticMemory.builder()
                .id(MemoryIds.newSemanticId())
                .userId(userId)
                .agentId("default")
                .subject("user").predicate("likes").object("jazz")
                .category(category)
                .confidence(0.9)
                .createdAt(NOW)
                .build();
    }
}
