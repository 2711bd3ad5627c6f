package com.openforge.mnemo.memory.forget;

import com.openforge.mnemo.config.MemoryProperties;
import com.openforge.mnemo.embedding.EmbeddingService;
import com.openforge.mnemo.memory.MemoryDocuments;
import com.openforge.mnemo.memory.UserLockRegistry;
import com.openforge.mnemo.memory.model.ForgettingConfig;
import com.openforge.mnemo.memory.model.ForgettingResult;
import com.openforge.mnemo.storage.DocumentRepository;
import com.openforge.mnemo.storage.GraphRepository;
import com.openforge.mnemo.storage.MemoryCollections;
import com.openforge.mnemo.storage.VectorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-user maintenance pass over active episodic memories.
 *
 *   1. score      effective importance (decay by age, boost by access)
 *   2. compress   near-duplicates below 2 × threshold merge into the stronger one
 *   3. threshold  below threshold → archive (or hard delete)
 *   4. capacity   over the cap → archive lowest stored importance
 *
 * Archived memories are never loaded, so a second run without new memories
 * changes nothing. Cycles for the same user are serialized.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryForgetter {

    private final EmbeddingService   embedding;
    private final VectorRepository   vectorRepository;
    private final DocumentRepository documentRepository;
    private final GraphRepository    graphRepository;
    private final UserLockRegistry   userLocks;
    private final MemoryProperties   properties;
    private final Clock              clock;

    /** The configured tuning, archiving rather than deleting. */
    public ForgettingConfig defaultConfig() {
        MemoryProperties.Forgetting f = properties.forgetting();
        return ForgettingConfig.builder()
                .importanceThreshold(f.importanceThreshold())
                .timeDecayFactor(f.timeDecayFactor())
                .accessBoostFactor(f.accessBoostFactor())
                .similarityThreshold(f.similarityThreshold())
                .maxMemoriesPerUser(f.maxMemoriesPerUser())
                .archiveInsteadOfDelete(true)
                .build();
    }

    public ForgettingResult runForgettingCycle(String userId) {
        return runForgettingCycle(userId, null);
    }

    /** @param config null uses {@link #defaultConfig()} */
    public ForgettingResult runForgettingCycle(String userId, ForgettingConfig config) {
        ForgettingConfig cfg = config != null ? config : defaultConfig();
        return userLocks.withLock(userId, () -> runLocked(userId, cfg));
    }

    private ForgettingResult runLocked(String userId, ForgettingConfig cfg) {
        long start = System.nanoTime();
        List<Map<String, Object>> memories;
        try {
            memories = documentRepository.find(MemoryCollections.EPISODIC_DOCUMENTS, activeFor(userId),
                    MemoryDocuments.CREATED_AT, DocumentRepository.SortOrder.ASC,
                    0, scanLimit(cfg.maxMemoriesPerUser()));
        } catch (RuntimeException e) {
            log.error("[Forgetter] Could not load memories of user {}: {}", userId, e.getMessage());
            return ForgettingResult.nothingScanned(userId, elapsedSince(start));
        }
        if (memories.isEmpty()) {
            log.debug("[Forgetter] Nothing to scan for user {}", userId);
            return ForgettingResult.nothingScanned(userId, elapsedSince(start));
        }

        Instant now = clock.instant();
        List<Scored> scored = new ArrayList<>(memories.size());
        for (Map<String, Object> doc : memories) {
            scored.add(new Scored(doc, EffectiveImportance.of(
                    MemoryDocuments.num(doc, MemoryDocuments.IMPORTANCE, 0.5),
                    (int) MemoryDocuments.num(doc, MemoryDocuments.ACCESS_COUNT, 0),
                    MemoryDocuments.instant(doc, MemoryDocuments.CREATED_AT),
                    now, cfg)));
        }

        List<String> details = new ArrayList<>();
        Set<String> discarded = new HashSet<>();
        int compressed = compress(scored, cfg, discarded);
        details.add("compressed " + compressed + " near-duplicate pair(s)");

        int archived = 0;
        int deleted  = 0;
        for (Scored memory : scored) {
            if (discarded.contains(memory.id()) || memory.effective() >= cfg.importanceThreshold()) continue;
            try {
                if (cfg.archiveInsteadOfDelete()) {
                    if (archive(memory.id())) archived++;
                } else {
                    if (hardDelete(memory.id())) deleted++;
                }
            } catch (RuntimeException e) {
                log.warn("[Forgetter] Skipping {}: {}", memory.id(), e.getMessage());
            }
        }
        if (archived > 0) details.add("archived " + archived + " below importance " + cfg.importanceThreshold());
        if (deleted > 0)  details.add("deleted " + deleted + " below importance " + cfg.importanceThreshold());

        int overflowArchived = enforceCapacity(userId, cfg.maxMemoriesPerUser());
        if (overflowArchived > 0) details.add("archived " + overflowArchived + " over capacity " + cfg.maxMemoriesPerUser());
        archived += overflowArchived;

        double elapsed = elapsedSince(start);
        details.add(String.format(Locale.ROOT, "elapsed %.1fms", elapsed));

        log.info("[Forgetter] user={} scanned={} compressed={} archived={} deleted={}",
                userId, scored.size(), compressed, archived, deleted);
        return new ForgettingResult(userId, scored.size(), compressed, archived, deleted, elapsed, details);
    }

    // ── Compression ──────────────────────────────────────────────────────────

    /**
     * Pairwise over the low band. The keeper gains the other's id in merged_from and
     * is flagged compressed; the other is archived. A memory merged away takes no
     * further part.
     */
    private int compress(List<Scored> scored, ForgettingConfig cfg, Set<String> discarded) {
        double band = cfg.importanceThreshold() * 2;
        List<Scored> low = scored.stream().filter(s -> s.effective() < band).toList();
        if (low.size() < 2) return 0;

        Map<String, List<String>> mergedFrom = new LinkedHashMap<>();
        int count = 0;
        for (int i = 0; i < low.size(); i++) {
            Scored a = low.get(i);
            for (int j = i + 1; j < low.size() && !discarded.contains(a.id()); j++) {
                Scored b = low.get(j);
                if (discarded.contains(b.id())) continue;
                try {
                    double similarity = embedding.similarity(a.restatement(), b.restatement());
                    if (similarity <= cfg.similarityThreshold()) continue;

                    Scored keep = a.effective() >= b.effective() ? a : b;
                    Scored drop = keep == a ? b : a;
                    List<String> merged = mergedFrom.computeIfAbsent(keep.id(),
                            id -> new ArrayList<>(MemoryDocuments.strings(keep.doc(), MemoryDocuments.MERGED_FROM)));
                    merged.add(drop.id());

                    documentRepository.update(MemoryCollections.EPISODIC_DOCUMENTS, keep.id(), Map.of(
                            MemoryDocuments.MERGED_FROM,   new ArrayList<>(merged),
                            MemoryDocuments.IS_COMPRESSED, true));
                    archive(drop.id());
                    discarded.add(drop.id());
                    count++;
                    log.debug("[Forgetter] Merged {} into {} (similarity {})", drop.id(), keep.id(), similarity);
                } catch (RuntimeException e) {
                    log.warn("[Forgetter] Compression of {} / {} failed: {}", a.id(), b.id(), e.getMessage());
                }
            }
        }
        return count;
    }

    // ── Capacity ─────────────────────────────────────────────────────────────

    private int enforceCapacity(String userId, int max) {
        try {
            long active = documentRepository.count(MemoryCollections.EPISODIC_DOCUMENTS, activeFor(userId));
            if (active <= max) return 0;

            List<Map<String, Object>> weakest = documentRepository.find(MemoryCollections.EPISODIC_DOCUMENTS,
                    activeFor(userId), MemoryDocuments.IMPORTANCE, DocumentRepository.SortOrder.ASC,
                    0, (int) (active - max));
            int archived = 0;
            for (Map<String, Object> doc : weakest) {
                String id = MemoryDocuments.str(doc, MemoryDocuments.ID);
                try {
                    if (archive(id)) archived++;
                } catch (RuntimeException e) {
                    log.warn("[Forgetter] Skipping {} in capacity pass: {}", id, e.getMessage());
                }
            }
            return archived;
        } catch (RuntimeException e) {
            log.warn("[Forgetter] Capacity pass failed for user {}: {}", userId, e.getMessage());
            return 0;
        }
    }

    // ── Actions ──────────────────────────────────────────────────────────────

    private boolean archive(String memoryId) {
        return documentRepository.update(MemoryCollections.EPISODIC_DOCUMENTS, memoryId,
                Map.of(MemoryDocuments.IS_ARCHIVED, true));
    }

    /** @return whether the document existed; vector and graph entries are removed either way */
    private boolean hardDelete(String memoryId) {
        boolean removed = documentRepository.delete(MemoryCollections.EPISODIC_DOCUMENTS, memoryId);
        vectorRepository.delete(memoryId, MemoryCollections.EPISODIC_VECTORS);
        graphRepository.deleteNode(memoryId, true);
        return removed;
    }

    /** Twice the cap, saturating instead of overflowing into the unbounded range. */
    static int scanLimit(int maxMemoriesPerUser) {
        return (int) Math.min(Integer.MAX_VALUE, 2L * maxMemoriesPerUser);
    }

    private static Map<String, Object> activeFor(String userId) {
        return Map.of(MemoryDocuments.USER_ID, userId, MemoryDocuments.IS_ARCHIVED, false);
    }

    private static double elapsedSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private record Scored(Map<String, Object> doc, double effective) {
        String id() {
            return MemoryDocuments.str(doc, MemoryDocuments.ID);
        }

        String restatement() {
            String text = MemoryDocuments.str(doc, MemoryDocuments.LOSSLESS_RESTATEMENT);
            return text == null ? "" : text;
        }
    }
}
