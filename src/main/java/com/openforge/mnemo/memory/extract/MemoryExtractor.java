package com.openforge.mnemo.memory.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.mnemo.config.MemoryProperties;
import com.openforge.mnemo.embedding.EmbeddingService;
import com.openforge.mnemo.llm.GenerationService;
import com.openforge.mnemo.memory.MemoryDocuments;
import com.openforge.mnemo.memory.MemoryGraphLinker;
import com.openforge.mnemo.memory.MemoryIds;
import com.openforge.mnemo.memory.model.ConversationMessage;
import com.openforge.mnemo.memory.model.EpisodicMemory;
import com.openforge.mnemo.memory.model.ExtractionResult;
import com.openforge.mnemo.memory.model.MemoryType;
import com.openforge.mnemo.memory.model.PersistenceOutcome;
import com.openforge.mnemo.memory.model.SemanticMemory;
import com.openforge.mnemo.storage.DocumentRepository;
import com.openforge.mnemo.storage.GraphRepository;
import com.openforge.mnemo.storage.MemoryCollections;
import com.openforge.mnemo.storage.VectorRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns conversation turns into stored episodic and semantic memories.
 *
 * Pipeline per call:
 *
 *   messages
 *     └─ sliding windows (size W, overlap O)
 *           └─ generateJson per window → typed candidates (parse-or-discard)
 *     └─ batch-local dedup (episodic by similarity, semantic by triple)
 *     └─ fan-out per memory: document store, vector index, graph
 *
 * Nothing escapes: a failed window is skipped, a failed write is recorded in the
 * memory's {@link PersistenceOutcome} and the other writes still run.
 */
@Slf4j
@Service
public class MemoryExtractor {

    private static final double EXTRACTION_TEMPERATURE = 0.3;

    private final GenerationService  generation;
    private final EmbeddingService   embedding;
    private final VectorRepository   vectorRepository;
    private final DocumentRepository documentRepository;
    private final MemoryGraphLinker  graphLinker;
    private final MemoryProperties   properties;
    private final Clock              clock;

    public MemoryExtractor(GenerationService generation,
                           EmbeddingService embedding,
                           VectorRepository vectorRepository,
                           DocumentRepository documentRepository,
                           GraphRepository graphRepository,
                           MemoryProperties properties,
                           Clock clock) {
        this.generation         = generation;
        this.embedding          = embedding;
        this.vectorRepository   = vectorRepository;
        this.documentRepository = documentRepository;
        this.graphLinker        = new MemoryGraphLinker(graphRepository);
        this.properties         = properties;
        this.clock              = clock;
    }

    public ExtractionResult extract(List<ConversationMessage> messages,
                                    String userId,
                                    String agentId,
                                    String sessionId) {
        if (messages == null || messages.isEmpty()) return ExtractionResult.empty();

        MemoryProperties.Extraction cfg = properties.extraction();
        List<ConversationWindows.Window> windows =
                ConversationWindows.slice(messages, cfg.windowSize(), cfg.overlap());

        List<EpisodicMemory> episodic = new ArrayList<>();
        List<SemanticMemory> semantic = new ArrayList<>();
        for (ConversationWindows.Window window : windows) {
            try {
                extractWindow(window, userId, agentId, sessionId, episodic, semantic);
            } catch (RuntimeException e) {
                log.error("[Extractor] Window at {} failed for user {}: {}", window.start(), userId, e.getMessage());
            }
        }

        episodic = deduplicateEpisodic(episodic);
        semantic = deduplicateSemantic(semantic);

        List<PersistenceOutcome> outcomes = new ArrayList<>(episodic.size() + semantic.size());
        for (EpisodicMemory memory : episodic) outcomes.add(persistEpisodic(memory));
        for (SemanticMemory memory : semantic) outcomes.add(persistSemantic(memory));

        long partial = outcomes.stream().filter(o -> !o.complete()).count();
        log.info("[Extractor] user={} session={} windows={} → {} episodic, {} semantic ({} partially persisted)",
                userId, sessionId, windows.size(), episodic.size(), semantic.size(), partial);
        return new ExtractionResult(episodic, semantic, outcomes);
    }

    // ── Per-window extraction ────────────────────────────────────────────────

    private void extractWindow(ConversationWindows.Window window,
                               String userId, String agentId, String sessionId,
                               List<EpisodicMemory> episodicOut,
                               List<SemanticMemory> semanticOut) {
        ObjectNode raw = generation.generateJson(
                ExtractionPrompts.userPrompt(window.transcript()),
                ExtractionPrompts.SYSTEM,
                EXTRACTION_TEMPERATURE);

        double minConfidence = properties.extraction().minConfidence();
        Instant now = clock.instant();
        int accepted = 0;

        for (JsonNode item : arrayOf(raw, "episodic_memories")) {
            var candidate = EpisodicCandidate.parse(item);
            if (candidate.isEmpty() || candidate.get().confidence() < minConfidence) continue;
            episodicOut.add(candidate.get().toMemory(MemoryIds.newEpisodicId(), userId, agentId, sessionId, now));
            accepted++;
        }
        for (JsonNode item : arrayOf(raw, "semantic_memories")) {
            var candidate = SemanticCandidate.parse(item);
            if (candidate.isEmpty() || candidate.get().confidence() < minConfidence) continue;
            semanticOut.add(candidate.get().toMemory(MemoryIds.newSemanticId(), userId, agentId, now));
            accepted++;
        }
        log.debug("[Extractor] Window at {} ({} messages) → {} candidates", window.start(),
                window.messages().size(), accepted);
    }

    private static Iterable<JsonNode> arrayOf(ObjectNode raw, String field) {
        JsonNode node = raw.get(field);
        return node != null && node.isArray() ? node : List.of();
    }

    // ── Deduplication ────────────────────────────────────────────────────────

    /**
     * Greedy, batch-local: each memory is compared with every memory kept so far;
     * the first one above the similarity threshold is a duplicate and the pair
     * keeps whichever has the higher importance. A failed comparison counts as
     * "not a duplicate".
     */
    List<EpisodicMemory> deduplicateEpisodic(List<EpisodicMemory> memories) {
        if (memories.size() <= 1) return memories;
        double threshold = properties.forgetting().similarityThreshold();

        List<EpisodicMemory> unique = new ArrayList<>();
        for (EpisodicMemory memory : memories) {
            boolean duplicate = false;
            for (int i = 0; i < unique.size(); i++) {
                EpisodicMemory existing = unique.get(i);
                double similarity;
                try {
                    similarity = embedding.similarity(memory.losslessRestatement(), existing.losslessRestatement());
                } catch (RuntimeException e) {
                    log.debug("[Extractor] Similarity check failed, keeping both: {}", e.getMessage());
                    continue;
                }
                if (similarity > threshold) {
                    if (memory.importance() > existing.importance()) unique.set(i, memory);
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) unique.add(memory);
        }
        return unique;
    }

    /** Exact match on the lower-cased triple; the first occurrence wins. */
    List<SemanticMemory> deduplicateSemantic(List<SemanticMemory> memories) {
        Set<String> seen = new HashSet<>();
        List<SemanticMemory> unique = new ArrayList<>();
        for (SemanticMemory memory : memories) {
            if (seen.add(memory.tripleKey())) unique.add(memory);
        }
        return unique;
    }

    // ── Persistence fan-out ──────────────────────────────────────────────────

    private PersistenceOutcome persistEpisodic(EpisodicMemory memory) {
        PersistenceOutcome.Tracker tracker = new PersistenceOutcome.Tracker(memory.id(), MemoryType.EPISODIC);

        try {
            documentRepository.insert(MemoryCollections.EPISODIC_DOCUMENTS, MemoryDocuments.toDocument(memory));
            tracker.documentStored();
        } catch (RuntimeException e) {
            tracker.failed("document", e);
        }

        try {
            vectorRepository.upsert(memory.id(), embedding.embed(memory.losslessRestatement()),
                    MemoryDocuments.vectorMetadata(memory), MemoryCollections.EPISODIC_VECTORS);
            tracker.vectorStored();
        } catch (RuntimeException e) {
            tracker.failed("vector", e);
        }

        try {
            graphLinker.linkEpisodic(memory);
            tracker.graphUpdated();
        } catch (RuntimeException e) {
            tracker.failed("graph", e);
        }

        return report(tracker.finish());
    }

    private PersistenceOutcome persistSemantic(SemanticMemory memory) {
        PersistenceOutcome.Tracker tracker = new PersistenceOutcome.Tracker(memory.id(), MemoryType.SEMANTIC);

        try {
            documentRepository.insert(MemoryCollections.SEMANTIC_DOCUMENTS, MemoryDocuments.toDocument(memory));
            tracker.documentStored();
        } catch (RuntimeException e) {
            tracker.failed("document", e);
        }

        try {
            vectorRepository.upsert(memory.id(), embedding.embed(memory.tripleText()),
                    MemoryDocuments.vectorMetadata(memory), MemoryCollections.SEMANTIC_VECTORS);
            tracker.vectorStored();
        } catch (RuntimeException e) {
            tracker.failed("vector", e);
        }

        try {
            graphLinker.linkSemantic(memory);
            tracker.graphUpdated();
        } catch (RuntimeException e) {
            tracker.failed("graph", e);
        }

        return report(tracker.finish());
    }

    private static PersistenceOutcome report(PersistenceOutcome outcome) {
        if (outcome.lost()) {
            log.error("[Extractor] Memory {} was not persisted anywhere: {}", outcome.memoryId(), outcome.errors());
        } else if (!outcome.complete()) {
            log.warn("[Extractor] Memory {} partially persisted: {}", outcome.memoryId(), outcome.errors());
        }
        return outcome;
    }
}
