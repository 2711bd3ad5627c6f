package com.openforge.mnemo.memory.manage;

import com.openforge.mnemo.embedding.EmbeddingService;
import com.openforge.mnemo.memory.MemoryDocuments;
import com.openforge.mnemo.memory.MemoryGraphLinker;
import com.openforge.mnemo.memory.UserLockRegistry;
import com.openforge.mnemo.memory.model.EpisodicMemory;
import com.openforge.mnemo.memory.model.GraphNode;
import com.openforge.mnemo.memory.model.Scores;
import com.openforge.mnemo.memory.model.SemanticCategory;
import com.openforge.mnemo.memory.model.SemanticMemory;
import com.openforge.mnemo.storage.DocumentRepository;
import com.openforge.mnemo.storage.GraphRepository;
import com.openforge.mnemo.storage.MemoryCollections;
import com.openforge.mnemo.storage.VectorRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Direct management of stored memories: lookup, paged listings, edits and removal.
 *
 * Removal always covers all three stores (document, vector, graph), and runs under
 * the owner's lock so it cannot interleave with a forgetting cycle or an access update.
 */
@Slf4j
@Service
public class MemoryManager {

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE     = 100;

    private final EmbeddingService   embedding;
    private final VectorRepository   vectorRepository;
    private final DocumentRepository documentRepository;
    private final GraphRepository    graphRepository;
    private final MemoryGraphLinker  graphLinker;
    private final UserLockRegistry   userLocks;

    public MemoryManager(EmbeddingService embedding,
                         VectorRepository vectorRepository,
                         DocumentRepository documentRepository,
                         GraphRepository graphRepository,
                         UserLockRegistry userLocks) {
        this.embedding          = embedding;
        this.vectorRepository   = vectorRepository;
        this.documentRepository = documentRepository;
        this.graphRepository    = graphRepository;
        this.graphLinker        = new MemoryGraphLinker(graphRepository);
        this.userLocks          = userLocks;
    }

    // ── Episodic ─────────────────────────────────────────────────────────────

    public Optional<EpisodicMemory> getEpisodic(String memoryId) {
        return documentRepository.findById(MemoryCollections.EPISODIC_DOCUMENTS, memoryId)
                .map(MemoryDocuments::episodicFrom);
    }

    /**
     * Newest first. Archived memories are left out unless the filter asks for them.
     *
     * @param page     1-based; smaller values mean the first page
     * @param pageSize bounded to [1, {@value #MAX_PAGE_SIZE}]
     */
    public MemoryPage<EpisodicMemory> listEpisodic(String userId, int page, int pageSize, EpisodicFilter filter) {
        EpisodicFilter f = filter != null ? filter : EpisodicFilter.none();
        int p    = Math.max(1, page);
        int size = boundedPageSize(pageSize);

        Map<String, Object> query = new HashMap<>();
        query.put(MemoryDocuments.USER_ID, userId);
        if (!f.includeArchived()) query.put(MemoryDocuments.IS_ARCHIVED, false);
        if (f.eventType() != null) query.put(MemoryDocuments.EVENT_TYPE, f.eventType().value());

        // importance and keyword filters are not equality queries, so they run here
        List<Map<String, Object>> matching = documentRepository.find(MemoryCollections.EPISODIC_DOCUMENTS, query,
                        MemoryDocuments.CREATED_AT, DocumentRepository.SortOrder.DESC, 0, 0)
                .stream()
                .filter(doc -> f.minImportance() == null
                        || MemoryDocuments.num(doc, MemoryDocuments.IMPORTANCE, 0.0) >= f.minImportance())
                .filter(doc -> hasAnyKeyword(doc, f.keywords()))
                .toList();

        List<EpisodicMemory> items = matching.stream()
                .skip((long) (p - 1) * size)
                .limit(size)
                .map(MemoryDocuments::episodicFrom)
                .toList();
        return new MemoryPage<>(items, matching.size(), p, size);
    }

    /**
     * Applies the non-null fields, then refreshes the vector metadata (when importance or
     * event type changed) and rebuilds the memory's graph links.
     *
     * @return false when nothing was given to change or the memory does not exist
     */
    public boolean updateEpisodic(String memoryId, EpisodicUpdate update) {
        if (update == null || update.isEmpty()) return false;
        String owner = ownerOf(MemoryCollections.EPISODIC_DOCUMENTS, memoryId);
        if (owner == null) return false;
        return userLocks.withLock(owner, () -> applyUpdate(memoryId, update));
    }

    public boolean deleteEpisodic(String memoryId) {
        String owner = ownerOf(MemoryCollections.EPISODIC_DOCUMENTS, memoryId);
        if (owner == null) return removeEpisodic(memoryId);
        return userLocks.withLock(owner, () -> removeEpisodic(memoryId));
    }

    // ── Semantic ─────────────────────────────────────────────────────────────

    public Optional<SemanticMemory> getSemantic(String memoryId) {
        return documentRepository.findById(MemoryCollections.SEMANTIC_DOCUMENTS, memoryId)
                .map(MemoryDocuments::semanticFrom);
    }

    /** @param category null lists every category */
    public MemoryPage<SemanticMemory> listSemantic(String userId, int page, int pageSize, SemanticCategory category) {
        int p    = Math.max(1, page);
        int size = boundedPageSize(pageSize);

        Map<String, Object> query = new HashMap<>();
        query.put(MemoryDocuments.USER_ID, userId);
        if (category != null) query.put(MemoryDocuments.CATEGORY, category.value());

        List<SemanticMemory> items = documentRepository.find(MemoryCollections.SEMANTIC_DOCUMENTS, query,
                        MemoryDocuments.CREATED_AT, DocumentRepository.SortOrder.DESC, offset(p, size), size)
                .stream()
                .map(MemoryDocuments::semanticFrom)
                .toList();
        long total = documentRepository.count(MemoryCollections.SEMANTIC_DOCUMENTS, query);
        return new MemoryPage<>(items, total, p, size);
    }

    public boolean deleteSemantic(String memoryId) {
        String owner = ownerOf(MemoryCollections.SEMANTIC_DOCUMENTS, memoryId);
        if (owner == null) return removeSemantic(memoryId);
        return userLocks.withLock(owner, () -> removeSemantic(memoryId));
    }

    // ── Whole user ───────────────────────────────────────────────────────────

    /**
     * Removes every episodic and semantic memory of the user, archived ones included,
     * together with the user's graph node. A memory that fails to delete is logged and
     * left out of the counts.
     */
    public ClearResult clearAll(String userId) {
        return userLocks.withLock(userId, () -> {
            int episodic = 0;
            for (String id : idsOf(MemoryCollections.EPISODIC_DOCUMENTS, userId)) {
                try {
                    if (removeEpisodic(id)) episodic++;
                } catch (RuntimeException e) {
                    log.warn("[Manager] Could not delete episodic memory {}: {}", id, e.getMessage());
                }
            }
            int semantic = 0;
            for (String id : idsOf(MemoryCollections.SEMANTIC_DOCUMENTS, userId)) {
                try {
                    if (removeSemantic(id)) semantic++;
                } catch (RuntimeException e) {
                    log.warn("[Manager] Could not delete semantic memory {}: {}", id, e.getMessage());
                }
            }
            graphRepository.deleteNode(GraphNode.userNodeId(userId), true);

            log.info("[Manager] Cleared user {}: episodic={} semantic={}", userId, episodic, semantic);
            return new ClearResult(userId, episodic, semantic);
        });
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private boolean applyUpdate(String memoryId, EpisodicUpdate update) {
        Map<String, Object> partial = new HashMap<>();
        if (update.summary() != null)      partial.put(MemoryDocuments.SUMMARY,      update.summary());
        if (update.keywords() != null)     partial.put(MemoryDocuments.KEYWORDS,     new ArrayList<>(update.keywords()));
        if (update.importance() != null)   partial.put(MemoryDocuments.IMPORTANCE,   Scores.clamp(update.importance()));
        if (update.eventType() != null)    partial.put(MemoryDocuments.EVENT_TYPE,   update.eventType().value());
        if (update.participants() != null) partial.put(MemoryDocuments.PARTICIPANTS, new ArrayList<>(update.participants()));
        if (update.location() != null)     partial.put(MemoryDocuments.LOCATION,     update.location());
        if (update.archived() != null)     partial.put(MemoryDocuments.IS_ARCHIVED,  update.archived());

        if (!documentRepository.update(MemoryCollections.EPISODIC_DOCUMENTS, memoryId, partial)) return false;
        Optional<EpisodicMemory> updated = getEpisodic(memoryId);
        if (updated.isEmpty()) return false;
        EpisodicMemory memory = updated.get();

        if (update.importance() != null || update.eventType() != null) {
            try {
                vectorRepository.upsert(memory.id(), embedding.embed(memory.losslessRestatement()),
                        MemoryDocuments.vectorMetadata(memory), MemoryCollections.EPISODIC_VECTORS);
            } catch (RuntimeException e) {
                log.warn("[Manager] Vector metadata of {} is stale: {}", memoryId, e.getMessage());
            }
        }
        try {
            graphLinker.relinkEpisodic(memory);
        } catch (RuntimeException e) {
            log.warn("[Manager] Graph links of {} are stale: {}", memoryId, e.getMessage());
        }
        log.debug("[Manager] Updated {} fields {}", memoryId, partial.keySet());
        return true;
    }

    /** @return whether the document existed; vector and graph entries are removed either way */
    private boolean removeEpisodic(String memoryId) {
        boolean removed = documentRepository.delete(MemoryCollections.EPISODIC_DOCUMENTS, memoryId);
        vectorRepository.delete(memoryId, MemoryCollections.EPISODIC_VECTORS);
        graphLinker.unlinkEpisodic(memoryId);
        return removed;
    }

    private boolean removeSemantic(String memoryId) {
        boolean removed = documentRepository.delete(MemoryCollections.SEMANTIC_DOCUMENTS, memoryId);
        vectorRepository.delete(memoryId, MemoryCollections.SEMANTIC_VECTORS);
        graphLinker.unlinkSemantic(memoryId);
        return removed;
    }

    private String ownerOf(String collection, String memoryId) {
        return documentRepository.findById(collection, memoryId)
                .map(doc -> MemoryDocuments.str(doc, MemoryDocuments.USER_ID))
                .orElse(null);
    }

    private List<String> idsOf(String collection, String userId) {
        return documentRepository.find(collection, Map.of(MemoryDocuments.USER_ID, userId), null, null, 0, 0)
                .stream()
                .map(doc -> MemoryDocuments.str(doc, MemoryDocuments.ID))
                .toList();
    }

    private static boolean hasAnyKeyword(Map<String, Object> doc, List<String> wanted) {
        if (wanted.isEmpty()) return true;
        List<String> keywords = MemoryDocuments.strings(doc, MemoryDocuments.KEYWORDS).stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
        for (String w : wanted) {
            String needle = w.toLowerCase(Locale.ROOT);
            if (keywords.stream().anyMatch(k -> k.contains(needle))) return true;
        }
        return false;
    }

    private static int offset(int page, int pageSize) {
        return (int) Math.min(Integer.MAX_VALUE, (long) (page - 1) * pageSize);
    }

    private static int boundedPageSize(int pageSize) {
        if (pageSize <= 0) return DEFAULT_PAGE_SIZE;
        return Math.min(pageSize, MAX_PAGE_SIZE);
    }
}
