package com.openforge.mnemo.memory.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One turn of a conversation. Immutable once appended to a session.
 */
public record ConversationMessage(
        MessageRole role,
        String      content,
        Instant     timestamp
) {

    public ConversationMessage {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ConversationMessage user(String content, Instant at) {
        return new ConversationMessage(MessageRole.USER, content, at);
    }

    public static ConversationMessage assistant(String content, Instant at) {
        return new ConversationMessage(MessageRole.ASSISTANT, content, at);
    }

    /** Role-tagged single line, e.g. {@code [user] turn on the heating}. */
    public String transcriptLine() {
        return "[" + role.value() + "] " + content;
    }
}
