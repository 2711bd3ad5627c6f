package com.openforge.mnemo.memory.retrieve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.mnemo.config.MemoryProperties;
import com.openforge.mnemo.embedding.EmbeddingService;
import com.openforge.mnemo.llm.GenerationService;
import com.openforge.mnemo.memory.MemoryDocuments;
import com.openforge.mnemo.memory.MemoryIds;
import com.openforge.mnemo.memory.UserLockRegistry;
import com.openforge.mnemo.memory.model.Direction;
import com.openforge.mnemo.memory.model.GraphEdge;
import com.openforge.mnemo.memory.model.GraphNode;
import com.openforge.mnemo.memory.model.IntentAnalysis;
import com.openforge.mnemo.memory.model.MemoryType;
import com.openforge.mnemo.memory.model.Neighbor;
import com.openforge.mnemo.memory.model.RetrievalQuery;
import com.openforge.mnemo.memory.model.RetrievalResult;
import com.openforge.mnemo.memory.model.RetrievalSource;
import com.openforge.mnemo.memory.model.ScoredMemory;
import com.openforge.mnemo.memory.model.SemanticMemory;
import com.openforge.mnemo.memory.model.VectorHit;
import com.openforge.mnemo.storage.DocumentRepository;
import com.openforge.mnemo.storage.GraphRepository;
import com.openforge.mnemo.storage.MemoryCollections;
import com.openforge.mnemo.storage.VectorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Hybrid episodic retrieval plus semantic triple lookup.
 *
 *   query ─▶ intent + keywords (fallback: "unknown", [])
 *     ├─ vector   : episodic index, topK × 3, floor threshold / 2
 *     ├─ lexical  : full-text over restatement / summary / keywords
 *     └─ graph    : user node, outgoing, depth 2, keyword match on node text
 *           └─▶ RRF ─▶ top-k ─▶ re-hydrate ─▶ drop archived
 *
 * Every strategy fails on its own: a broken index shrinks the candidate set, it
 * never fails the call. Returned episodic memories get their access counter bumped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryRetriever {

    private static final double INTENT_TEMPERATURE     = 0.2;
    private static final double GRAPH_SCORE_FACTOR     = 0.6;
    private static final int    GRAPH_WALK_DEPTH       = 2;
    private static final int    SEMANTIC_GRAPH_KEYWORDS = 3;

    private final GenerationService  generation;
    private final EmbeddingService   embedding;
    private final VectorRepository   vectorRepository;
    private final DocumentRepository documentRepository;
    private final GraphRepository    graphRepository;
    private final UserLockRegistry   userLocks;
    private final MemoryProperties   properties;
    private final Clock              clock;

    public RetrievalResult retrieve(RetrievalQuery query) {
        long start = System.nanoTime();

        IntentAnalysis intent = analyzeIntent(query.query());
        List<Float> queryVector = embedQuery(query.query());

        List<ScoredMemory>   episodic = query.includeEpisodic()
                ? retrieveEpisodic(query, intent, queryVector) : List.of();
        List<SemanticMemory> semantic = query.includeSemantic()
                ? retrieveSemantic(query, intent, queryVector) : List.of();

        for (ScoredMemory memory : episodic) {
            recordAccess(query.userId(), memory.memoryId());
        }

        double elapsed = (System.nanoTime() - start) / 1_000_000.0;
        StringBuilder plan = new StringBuilder("intent: ").append(intent.intent());
        if (query.includeEpisodic()) plan.append(" | episodic: ").append(episodic.size());
        if (query.includeSemantic()) plan.append(" | semantic: ").append(semantic.size());
        plan.append(String.format(Locale.ROOT, " | elapsed: %.1fms", elapsed));

        log.info("[Retriever] user={} {}", query.userId(), plan);
        return new RetrievalResult(episodic, semantic, intent.intent(), plan.toString(), elapsed);
    }

    // ── Intent ───────────────────────────────────────────────────────────────

    IntentAnalysis analyzeIntent(String query) {
        if (query == null || query.isBlank()) return IntentAnalysis.unknown();
        try {
            ObjectNode json = generation.generateJson(IntentPrompts.userPrompt(query), IntentPrompts.SYSTEM,
                    INTENT_TEMPERATURE);
            List<String> keywords = new ArrayList<>();
            JsonNode raw = json.get("search_keywords");
            if (raw != null && raw.isArray()) {
                raw.forEach(k -> {
                    if (k.isValueNode()) keywords.add(k.asText().trim());
                });
            }
            return new IntentAnalysis(json.path("intent").asText(null), keywords);
        } catch (RuntimeException e) {
            log.warn("[Retriever] Intent analysis failed, falling back to the raw query: {}", e.getMessage());
            return IntentAnalysis.unknown();
        }
    }

    private List<Float> embedQuery(String query) {
        if (query == null || query.isBlank()) return null;
        try {
            return embedding.embed(query);
        } catch (RuntimeException e) {
            log.warn("[Retriever] Query embedding failed, vector search skipped: {}", e.getMessage());
            return null;
        }
    }

    // ── Episodic ─────────────────────────────────────────────────────────────

    private List<ScoredMemory> retrieveEpisodic(RetrievalQuery query, IntentAnalysis intent, List<Float> queryVector) {
        MemoryProperties.Retrieval cfg = properties.retrieval();
        RrfFusion fusion = new RrfFusion(cfg.rrfK());
        List<String> keywords = intent.effectiveKeywords(query.query());

        vectorCandidates(query, queryVector, cfg.scoreThreshold() * 0.5, fusion);
        lexicalCandidates(query, keywords, fusion);
        graphCandidates(query.userId(), keywords, fusion);

        log.debug("[Retriever] candidates semantic={} lexical={} graph={}",
                fusion.candidateCount(RetrievalSource.SEMANTIC),
                fusion.candidateCount(RetrievalSource.LEXICAL),
                fusion.candidateCount(RetrievalSource.GRAPH));

        List<ScoredMemory> results = new ArrayList<>();
        for (RrfFusion.Fused fused : fusion.fuse().stream().limit(query.topK()).toList()) {
            Optional<Map<String, Object>> doc;
            try {
                doc = documentRepository.findById(MemoryCollections.EPISODIC_DOCUMENTS, fused.memoryId());
            } catch (RuntimeException e) {
                log.warn("[Retriever] Could not load {}: {}", fused.memoryId(), e.getMessage());
                continue;
            }
            if (doc.isEmpty() || MemoryDocuments.bool(doc.get(), MemoryDocuments.IS_ARCHIVED)) continue;
            results.add(new ScoredMemory(
                    fused.memoryId(),
                    MemoryType.EPISODIC,
                    MemoryDocuments.displayText(doc.get()),
                    Math.min(fused.score(), 1.0),
                    fused.sources(),
                    doc.get()));
        }
        results.forEach(m -> log.debug("[Retriever]   {} score={} via {}",
                m.memoryId(), String.format(Locale.ROOT, "%.3f", m.score()), m.sourceLabel()));
        return results;
    }

    private void vectorCandidates(RetrievalQuery query, List<Float> queryVector, double floor, RrfFusion fusion) {
        if (queryVector == null) return;
        try {
            Map<String, Object> filters = new HashMap<>();
            filters.put(MemoryDocuments.USER_ID, query.userId());
            if (query.eventType() != null) filters.put(MemoryDocuments.EVENT_TYPE, query.eventType().value());

            for (VectorHit hit : vectorRepository.search(queryVector, query.topK() * 3,
                    MemoryCollections.EPISODIC_VECTORS, filters, floor)) {
                fusion.add(RetrievalSource.SEMANTIC, hit.memoryId(), hit.score());
            }
        } catch (RuntimeException e) {
            log.warn("[Retriever] Vector strategy failed: {}", e.getMessage());
        }
    }

    private void lexicalCandidates(RetrievalQuery query, List<String> keywords, RrfFusion fusion) {
        if (keywords.isEmpty()) return;
        try {
            List<Map<String, Object>> hits = documentRepository.fullTextSearch(
                    MemoryCollections.EPISODIC_DOCUMENTS,
                    String.join(" ", keywords),
                    MemoryDocuments.EPISODIC_TEXT_FIELDS,
                    query.topK() * 2);

            int rank = 0;
            for (Map<String, Object> doc : hits) {
                if (!query.userId().equals(MemoryDocuments.str(doc, MemoryDocuments.USER_ID))) continue;
                fusion.add(RetrievalSource.LEXICAL, MemoryDocuments.str(doc, MemoryDocuments.ID),
                        Math.max(0.3, 1.0 - rank * 0.1));
                rank++;
            }
        } catch (RuntimeException e) {
            log.warn("[Retriever] Lexical strategy failed: {}", e.getMessage());
        }
    }

    private void graphCandidates(String userId, List<String> keywords, RrfFusion fusion) {
        if (keywords.isEmpty()) return;
        List<String> needles = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        try {
            for (Neighbor neighbor : graphRepository.getNeighbors(
                    GraphNode.userNodeId(userId), null, Direction.OUTGOING, GRAPH_WALK_DEPTH)) {
                String nodeId = neighbor.node().id();
                if (!MemoryIds.isEpisodic(nodeId)) continue;

                String summary = neighbor.node().textProperty("summary").toLowerCase(Locale.ROOT);
                String name    = neighbor.node().textProperty("name").toLowerCase(Locale.ROOT);
                if (needles.stream().anyMatch(kw -> summary.contains(kw) || name.contains(kw))) {
                    fusion.add(RetrievalSource.GRAPH, nodeId, GRAPH_SCORE_FACTOR * neighbor.weight());
                }
            }
        } catch (RuntimeException e) {
            log.warn("[Retriever] Graph strategy failed: {}", e.getMessage());
        }
    }

    // ── Semantic ─────────────────────────────────────────────────────────────

    /** Vector hits first, then triples reachable from keyword entities; no fusion. */
    private List<SemanticMemory> retrieveSemantic(RetrievalQuery query, IntentAnalysis intent, List<Float> queryVector) {
        Set<String> seen = new LinkedHashSet<>();
        List<SemanticMemory> results = new ArrayList<>();

        if (queryVector != null) {
            try {
                List<VectorHit> hits = vectorRepository.search(queryVector, query.topK() * 2,
                        MemoryCollections.SEMANTIC_VECTORS,
                        Map.of(MemoryDocuments.USER_ID, query.userId()), 0.0);
                for (VectorHit hit : hits) {
                    if (seen.add(hit.memoryId())) loadSemantic(hit.memoryId()).ifPresent(results::add);
                }
            } catch (RuntimeException e) {
                log.warn("[Retriever] Semantic vector search failed: {}", e.getMessage());
            }
        }

        try {
            for (String keyword : intent.searchKeywords().stream().limit(SEMANTIC_GRAPH_KEYWORDS).toList()) {
                for (Neighbor neighbor : graphRepository.getNeighbors(
                        GraphNode.entityNodeId(keyword), null, Direction.BOTH, 1)) {
                    Object memoryId = neighbor.edgeProperties().get(GraphEdge.MEMORY_ID);
                    Object owner    = neighbor.edgeProperties().get(GraphEdge.USER_ID);
                    if (memoryId == null || (owner != null && !query.userId().equals(owner.toString()))) continue;
                    if (seen.add(memoryId.toString())) loadSemantic(memoryId.toString()).ifPresent(results::add);
                }
            }
        } catch (RuntimeException e) {
            log.warn("[Retriever] Semantic graph lookup failed: {}", e.getMessage());
        }

        return results.size() > query.topK() ? List.copyOf(results.subList(0, query.topK())) : results;
    }

    private Optional<SemanticMemory> loadSemantic(String memoryId) {
        return documentRepository.findById(MemoryCollections.SEMANTIC_DOCUMENTS, memoryId)
                .map(MemoryDocuments::semanticFrom);
    }

    // ── Access feedback ──────────────────────────────────────────────────────

    private void recordAccess(String userId, String memoryId) {
        try {
            userLocks.withLock(userId, () -> {
                documentRepository.findById(MemoryCollections.EPISODIC_DOCUMENTS, memoryId).ifPresent(doc -> {
                    int count = (int) MemoryDocuments.num(doc, MemoryDocuments.ACCESS_COUNT, 0);
                    documentRepository.update(MemoryCollections.EPISODIC_DOCUMENTS, memoryId, Map.of(
                            MemoryDocuments.ACCESS_COUNT,     count + 1,
                            MemoryDocuments.LAST_ACCESSED_AT, clock.millis()));
                });
            });
        } catch (RuntimeException e) {
            log.warn("[Retriever] Access count update failed for {}: {}", memoryId, e.getMessage());
        }
    }
}
