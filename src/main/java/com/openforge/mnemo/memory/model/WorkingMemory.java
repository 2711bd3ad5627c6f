package com.openforge.mnemo.memory.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The rolling buffer of one conversation session.
 *
 * Owned by the session store: the only way to change it is through
 * {@link #withAppended}, which returns a new value with the message added,
 * the oldest messages dropped beyond {@code maxMessages}, and the expiry moved.
 *
 * @param sessionId  unique session key
 * @param userId     owner of the session
 * @param agentId    agent the user is talking to
 * @param messages   ordered oldest → newest, bounded
 * @param turnCount  number of messages ever appended (not reduced by trimming)
 * @param createdAt  when the session was opened
 * @param expiresAt  TTL deadline; refreshed on every append
 */
public record WorkingMemory(
        String                    sessionId,
        String                    userId,
        String                    agentId,
        List<ConversationMessage> messages,
        int                       turnCount,
        Instant                   createdAt,
        Instant                   expiresAt
) {

    public WorkingMemory {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static WorkingMemory open(String sessionId, String userId, String agentId,
                                     Instant now, Instant expiresAt) {
        return new WorkingMemory(sessionId, userId, agentId, List.of(), 0, now, expiresAt);
    }

    public WorkingMemory withAppended(ConversationMessage message, int maxMessages, Instant newExpiresAt) {
        List<ConversationMessage> next = new ArrayList<>(messages);
        next.add(message);
        if (maxMessages > 0 && next.size() > maxMessages) {
            next = next.subList(next.size() - maxMessages, next.size());
        }
        return new WorkingMemory(sessionId, userId, agentId, next, turnCount + 1, createdAt, newExpiresAt);
    }

    public WorkingMemory withExpiry(Instant newExpiresAt) {
        return new WorkingMemory(sessionId, userId, agentId, messages, turnCount, createdAt, newExpiresAt);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
