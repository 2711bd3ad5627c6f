package com.openforge.mnemo.memory.retrieve;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.mnemo.config.MemoryProperties;
import com.openforge.mnemo.llm.GenerationService;
import com.openforge.mnemo.memory.MemoryDocuments;
import com.openforge.mnemo.memory.MemoryIds;
import com.openforge.mnemo.memory.UserLockRegistry;
import com.openforge.mnemo.memory.model.EpisodicMemory;
import com.openforge.mnemo.memory.model.GraphEdge;
import com.openforge.mnemo.memory.model.GraphNode;
import com.openforge.mnemo.memory.model.RetrievalQuery;
import com.openforge.mnemo.memory.model.RetrievalResult;
import com.openforge.mnemo.memory.model.RetrievalSource;
import com.openforge.mnemo.memory.model.ScoredMemory;
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

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static com.openforge.mnemo.support.EpisodicFixtures.episodic;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MemoryRetrieverTest {

    private static final Instant NOW  = Instant.parse("2026-05-10T08:00:00Z");
    private static final String  USER = "u-1";

    private final ObjectMapper mapper = new ObjectMapper();

    private GenerationService          generation;
    private TokenEmbeddingService      embedding;
    private InMemoryDocumentRepository documents;
    private InMemoryVectorRepository   vectors;
    private InMemoryGraphRepository    graph;
    private MemoryRetriever            retriever;

    @BeforeEach
    void setUp() {
        generation = mock(GenerationService.class);
        embedding  = new TokenEmbeddingService();
        documents  = new InMemoryDocumentRepository();
        vectors    = new InMemoryVectorRepository();
        graph      = new InMemoryGraphRepository();
        retriever  = new MemoryRetriever(generation, embedding, vectors, documents, graph,
                new UserLockRegistry(), MemoryProperties.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        documents.close();
    }

    @Test
    void archivedMemoriesAreNeverReturned() throws Exception {
        intent("navigation", "airport");
        EpisodicMemory active   = remember(episodic(USER, "The user drove to the airport", 0.6, NOW));
        EpisodicMemory archived = remember(episodic(USER, "The user flew from the airport", 0.9, NOW));
        documents.update(MemoryCollections.EPISODIC_DOCUMENTS, archived.id(), Map.of(MemoryDocuments.IS_ARCHIVED, true));

        RetrievalResult result = retriever.retrieve(RetrievalQuery.forUser(USER, "take me to the airport", 5));

        assertThat(result.episodicMemories()).extracting(ScoredMemory::memoryId).containsExactly(active.id());
        assertThat(documents.findById(MemoryCollections.EPISODIC_DOCUMENTS, archived.id())).isPresent();
        assertThat(result.intent()).isEqualTo("navigation");
    }

    @Test
    void memoryFoundByVectorAndTextIsLabelledWithBothSources() throws Exception {
        intent("navigation", "airport");
        EpisodicMemory memory = remember(episodic(USER, "The user drove to the airport", 0.6, NOW));

        RetrievalResult result = retriever.retrieve(RetrievalQuery.forUser(USER, "drove to the airport", 5));

        ScoredMemory hit = result.episodicMemories().get(0);
        assertThat(hit.memoryId()).isEqualTo(memory.id());
        assertThat(hit.sources()).contains(RetrievalSource.SEMANTIC, RetrievalSource.LEXICAL);
        assertThat(hit.sourceLabel()).startsWith("semantic+lexical");
        assertThat(hit.score()).isBetween(0.0, 1.0);
        assertThat(hit.content()).isEqualTo("The user drove to the airport");
    }

    @Test
    void returnedMemoriesHaveTheirAccessRecorded() throws Exception {
        intent("navigation", "airport");
        EpisodicMemory memory = remember(episodic(USER, "The user drove to the airport", 0.6, NOW));

        retriever.retrieve(RetrievalQuery.forUser(USER, "airport", 5));
        retriever.retrieve(RetrievalQuery.forUser(USER, "airport", 5));

        Map<String, Object> doc = documents.findById(MemoryCollections.EPISODIC_DOCUMENTS, memory.id()).orElseThrow();
        assertThat(MemoryDocuments.num(doc, MemoryDocuments.ACCESS_COUNT, -1)).isEqualTo(2.0);
        assertThat(MemoryDocuments.instant(doc, MemoryDocuments.LAST_ACCESSED_AT)).isEqualTo(NOW);
    }

    @Test
    void failedIntentAnalysisFallsBackToTheRawQuery() {
        when(generation.generateJson(anyString(), anyString(), any())).thenThrow(new RuntimeException("timeout"));
        EpisodicMemory memory = remember(episodic(USER, "Dinner reservation at Luigi", 0.6, NOW));

        RetrievalResult result = retriever.retrieve(RetrievalQuery.forUser(USER, "Luigi", 5));

        assertThat(result.intent()).isEqualTo("unknown");
        assertThat(result.retrievalPlan()).startsWith("intent: unknown | episodic: 1 | semantic: 0");
        assertThat(result.episodicMemories()).extracting(ScoredMemory::memoryId).containsExactly(memory.id());
    }

    @Test
    void graphStrategyMatchesKeywordsOnEventNodes() throws Exception {
        intent("social", "lisa");
        EpisodicMemory memory = remember(episodic(USER, "Dinner with Lisa at the harbour", 0.8, NOW));
        graph.addNode(new GraphNode(GraphNode.userNodeId(USER), "User", Map.of()));
        graph.addNode(new GraphNode(memory.id(), "Event", Map.of("summary", "Dinner with Lisa at the harbour")));
        graph.addEdge(new GraphEdge(GraphNode.userNodeId(USER), memory.id(), GraphEdge.EXPERIENCED, 0.8, Map.of()));

        RetrievalResult result = retriever.retrieve(RetrievalQuery.forUser(USER, "what did I do with Lisa", 5));

        assertThat(result.episodicMemories()).singleElement()
                .satisfies(hit -> assertThat(hit.sources()).contains(RetrievalSource.GRAPH));
    }

    @Test
    void otherUsersMemoriesStayInvisible() throws Exception {
        intent("navigation", "airport");
        remember(episodic("u-2", "The user drove to the airport", 0.6, NOW));

        RetrievalResult result = retriever.retrieve(RetrievalQuery.forUser(USER, "airport", 5));

        assertThat(result.episodicMemories()).isEmpty();
    }

    @Test
    void semanticTriplesComeFromVectorsAndKeywordEntities() throws Exception {
        intent("preference", "jazz");
        SemanticMemory likes = rememberFact("user", "likes", "jazz");
        SemanticMemory plays = SemanticMemory.builder()
                .id(MemoryIds.newSemanticId()).userId(USER).agentId("default")
                .subject("Miles").predicate("plays").object("jazz")
                .category(SemanticCategory.FACT).confidence(0.8).createdAt(NOW)
                .build();
        documents.insert(MemoryCollections.SEMANTIC_DOCUMENTS, MemoryDocuments.toDocument(plays));
        graph.addNode(new GraphNode("entity_Miles", "Entity", Map.of("name", "Miles")));
        graph.addNode(new GraphNode("entity_jazz", "Entity", Map.of("name", "jazz")));
        graph.addEdge(new GraphEdge("entity_Miles", "entity_jazz", "PLAYS", 0.8,
                Map.of("memory_id", plays.id(), "user_id", USER)));

        RetrievalResult result = retriever.retrieve(RetrievalQuery.forUser(USER, "user likes jazz", 5));

        assertThat(result.semanticMemories()).extracting(SemanticMemory::id).containsExactly(likes.id(), plays.id());
    }

    @Test
    void episodicSwitchOffSkipsEpisodesAndAccessUpdates() throws Exception {
        intent("navigation", "airport");
        EpisodicMemory memory = remember(episodic(USER, "The user drove to the airport", 0.6, NOW));

        RetrievalResult result = retriever.retrieve(RetrievalQuery.forUser(USER, "airport", 5).toBuilder()
                .includeEpisodic(false)
                .build());

        assertThat(result.episodicMemories()).isEmpty();
        assertThat(result.retrievalPlan()).doesNotContain("episodic");
        Map<String, Object> doc = documents.findById(MemoryCollections.EPISODIC_DOCUMENTS, memory.id()).orElseThrow();
        assertThat(MemoryDocuments.num(doc, MemoryDocuments.ACCESS_COUNT, -1)).isZero();
    }

    private void intent(String label, String... keywords) throws Exception {
        ObjectNode node = mapper.createObjectNode().put("intent", label);
        var array = node.putArray("search_keywords");
        for (String k : keywords) array.add(k);
        when(generation.generateJson(anyString(), anyString(), any())).thenReturn(node);
    }

    private EpisodicMemory remember(EpisodicMemory memory) {
        documents.insert(MemoryCollections.EPISODIC_DOCUMENTS, MemoryDocuments.toDocument(memory));
        vectors.upsert(memory.id(), embedding.embed(memory.losslessRestatement()),
                Map.of(MemoryDocuments.USER_ID, memory.userId(),
                       MemoryDocuments.EVENT_TYPE, memory.eventType().value()),
                MemoryCollections.EPISODIC_VECTORS);
        return memory;
    }

    private SemanticMemory rememberFact(String subject, String predicate, String object) {
        SemanticMemory fact = SemanticMemory.builder()
                .id(MemoryIds.newSemanticId()).userId(USER).agentId("default")
                .subject(subject).predicate(predicate).object(object)
                .category(SemanticCategory.PREFERENCE).confidence(0.9).createdAt(NOW)
                .build();
        documents.insert(MemoryCollections.SEMANTIC_DOCUMENTS, MemoryDocuments.toDocument(fact));
        vectors.upsert(fact.id(), embedding.embed(fact.tripleText()),
                Map.of(MemoryDocuments.USER_ID, USER), MemoryCollections.SEMANTIC_VECTORS);
        return fact;
    }
}
