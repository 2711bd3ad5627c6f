package com.openforge.mnemo.chat;

import com.openforge.mnemo.config.MemoryProperties;
import com.openforge.mnemo.llm.GenerationService;
import com.openforge.mnemo.memory.extract.MemoryExtractor;
import com.openforge.mnemo.memory.model.ConversationMessage;
import com.openforge.mnemo.memory.model.ExtractionResult;
import com.openforge.mnemo.memory.model.RetrievalQuery;
import com.openforge.mnemo.memory.model.RetrievalResult;
import com.openforge.mnemo.memory.model.WorkingMemory;
import com.openforge.mnemo.memory.retrieve.MemoryRetriever;
import com.openforge.mnemo.storage.WorkingMemoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * One conversation turn, end to end.
 *
 *   session lookup / create
 *     → append user message
 *     → retrieve memories        (optional, failure = no memory context)
 *     → profile snapshot         (optional, failure = no profile)
 *     → build prompt
 *     → generate reply           (failure = fixed apology)
 *     → append reply
 *     → extraction on memoryTaskExecutor once the session holds a full window
 *
 * A turn always returns a reply. Extraction runs after the reply is decided and
 * its outcome never reaches the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatOrchestrator {

    static final String APOLOGY = "Sorry, I can't reply right now. Please try again in a moment.";

    private final WorkingMemoryRepository workingMemory;
    private final MemoryRetriever         retriever;
    private final MemoryExtractor         extractor;
    private final GenerationService       generation;
    private final ProfileSnapshotProvider profiles;
    private final MemoryProperties        properties;
    private final ExecutorService         memoryTaskExecutor;
    private final Clock                   clock;

    public TurnResponse chat(TurnRequest request) {
        TurnOptions options = request.options();

        WorkingMemory session = openSession(request);
        session = workingMemory
                .appendMessage(session.sessionId(), ConversationMessage.user(request.message(), clock.instant()))
                .orElse(session);

        RetrievalResult memories = options.includeMemory() ? retrieve(request, options) : null;
        ProfileSnapshot profile  = options.includeProfile() ? profile(request.userId()) : null;

        String systemPrompt = PromptBuilder.systemPrompt(profile, memories);
        List<ConversationMessage> history =
                PromptBuilder.history(session.messages(), request.message(), clock.instant());

        String reply;
        try {
            reply = generation.generateWithHistory(history, systemPrompt);
        } catch (RuntimeException e) {
            log.error("[Chat] Generation failed for session {}: {}", request.sessionId(), e.getMessage());
            reply = APOLOGY;
        }

        WorkingMemory updated = workingMemory
                .appendMessage(session.sessionId(), ConversationMessage.assistant(reply, clock.instant()))
                .orElse(null);

        boolean extractionTriggered = updated != null && maybeExtract(updated, request);

        int used = memories == null ? 0 : memories.size();
        log.info("[Chat] session={} user={} memories={} extraction={}",
                request.sessionId(), request.userId(), used, extractionTriggered);
        return new TurnResponse(reply, request.sessionId(), used, memories, extractionTriggered);
    }

    private WorkingMemory openSession(TurnRequest request) {
        return workingMemory.get(request.sessionId()).orElseGet(() -> {
            Duration ttl = Duration.ofSeconds(properties.working().ttlSeconds());
            Instant now = clock.instant();
            WorkingMemory created = WorkingMemory.open(request.sessionId(), request.userId(), request.agentId(),
                    now, now.plus(ttl));
            workingMemory.save(created, ttl);
            log.debug("[Chat] Opened session {} for user {}", request.sessionId(), request.userId());
            return created;
        });
    }

    private RetrievalResult retrieve(TurnRequest request, TurnOptions options) {
        try {
            return retriever.retrieve(RetrievalQuery.forUser(request.userId(), request.message(),
                    options.maxMemoryItems()));
        } catch (RuntimeException e) {
            log.error("[Chat] Retrieval failed for user {}: {}", request.userId(), e.getMessage());
            return null;
        }
    }

    private ProfileSnapshot profile(String userId) {
        try {
            return profiles.snapshotFor(userId).orElse(null);
        } catch (RuntimeException e) {
            log.error("[Chat] Profile lookup failed for user {}: {}", userId, e.getMessage());
            return null;
        }
    }

    private boolean maybeExtract(WorkingMemory session, TurnRequest request) {
        if (session.messages().size() < properties.extraction().windowSize()) return false;

        List<ConversationMessage> snapshot = session.messages();
        try {
            memoryTaskExecutor.execute(() -> {
                try {
                    ExtractionResult result = extractor.extract(snapshot, request.userId(),
                            request.agentId(), request.sessionId());
                    log.debug("[Chat] Extraction for session {} stored {} memories",
                            request.sessionId(), result.total());
                } catch (Exception e) {
                    log.error("[Chat] Extraction failed for session {}: {}", request.sessionId(), e.getMessage(), e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("[Chat] Extraction not scheduled for session {}: {}", request.sessionId(), e.getMessage());
            return false;
        }
    }
}
