package com.openforge.mnemo.storage.local;

import com.openforge.mnemo.memory.model.ConversationMessage;
import com.openforge.mnemo.memory.model.WorkingMemory;
import com.openforge.mnemo.storage.WorkingMemoryRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session store held in a {@link ConcurrentHashMap}.
 *
 * Appends go through {@code computeIfPresent}, so two appends to the same session
 * never interleave. Expired sessions are dropped lazily on read and eagerly when
 * the store is full; if it is still full the session closest to expiry is evicted.
 */
@Slf4j
public class InMemoryWorkingMemoryRepository implements WorkingMemoryRepository {

    private final Map<String, Slot> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int   maxSessions;
    private final int   maxMessages;

    public InMemoryWorkingMemoryRepository(Clock clock, int maxSessions, int maxMessages) {
        this.clock       = clock;
        this.maxSessions = maxSessions;
        this.maxMessages = maxMessages;
    }

    @Override
    public Optional<WorkingMemory> get(String sessionId) {
        Slot slot = sessions.get(sessionId);
        if (slot == null) return Optional.empty();
        if (slot.session().isExpired(clock.instant())) {
            sessions.remove(sessionId, slot);
            log.debug("[Session] {} expired", sessionId);
            return Optional.empty();
        }
        return Optional.of(slot.session());
    }

    @Override
    public void save(WorkingMemory session, Duration ttl) {
        if (!sessions.containsKey(session.sessionId()) && sessions.size() >= maxSessions) {
            makeRoom();
        }
        Instant expiresAt = clock.instant().plus(ttl);
        WorkingMemory trimmed = trim(session).withExpiry(expiresAt);
        sessions.put(session.sessionId(), new Slot(trimmed, ttl));
    }

    @Override
    public Optional<WorkingMemory> appendMessage(String sessionId, ConversationMessage message) {
        Instant now = clock.instant();
        Slot updated = sessions.computeIfPresent(sessionId, (id, slot) -> {
            if (slot.session().isExpired(now)) return null;
            WorkingMemory next = slot.session().withAppended(message, maxMessages, now.plus(slot.ttl()));
            return new Slot(next, slot.ttl());
        });
        return Optional.ofNullable(updated).map(Slot::session);
    }

    @Override
    public boolean delete(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    @Override
    public List<String> listActive(String userId) {
        Instant now = clock.instant();
        return sessions.values().stream()
                .map(Slot::session)
                .filter(s -> userId.equals(s.userId()) && !s.isExpired(now))
                .sorted(Comparator.comparing(WorkingMemory::createdAt))
                .map(WorkingMemory::sessionId)
                .toList();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void makeRoom() {
        Instant now = clock.instant();
        sessions.entrySet().removeIf(e -> e.getValue().session().isExpired(now));
        while (sessions.size() >= maxSessions) {
            sessions.values().stream()
                    .map(Slot::session)
                    .min(Comparator.comparing(WorkingMemory::expiresAt))
                    .ifPresent(oldest -> {
                        sessions.remove(oldest.sessionId());
                        log.info("[Session] Store full ({}), evicted session {}", maxSessions, oldest.sessionId());
                    });
        }
    }

    private WorkingMemory trim(WorkingMemory session) {
        List<ConversationMessage> messages = session.messages();
        if (messages.size() <= maxMessages) return session;
        return new WorkingMemory(session.sessionId(), session.userId(), session.agentId(),
                messages.subList(messages.size() - maxMessages, messages.size()),
                session.turnCount(), session.createdAt(), session.expiresAt());
    }

    private record Slot(WorkingMemory session, Duration ttl) {}
}
