package com.openforge.mnemo.storage;

import com.openforge.mnemo.memory.model.ConversationMessage;
import com.openforge.mnemo.memory.model.WorkingMemory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Ephemeral session store.
 *
 * Implementations honour TTL expiry, cap the stored message count per session
 * (oldest dropped first) and serialize appends per session id.
 */
public interface WorkingMemoryRepository {

    /** Empty when the session is unknown or has expired. */
    Optional<WorkingMemory> get(String sessionId);

    void save(WorkingMemory session, Duration ttl);

    /**
     * Appends a message and refreshes the TTL.
     *
     * @return the session after the append, or empty when the session does not exist (no-op)
     */
    Optional<WorkingMemory> appendMessage(String sessionId, ConversationMessage message);

    boolean delete(String sessionId);

    /** Ids of the user's non-expired sessions. */
    List<String> listActive(String userId);
}
