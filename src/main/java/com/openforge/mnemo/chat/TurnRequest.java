package com.openforge.mnemo.chat;

/**
 * One user message addressed to an agent within a session.
 *
 * @param agentId defaults to {@code "default"}
 * @param options null means {@link TurnOptions#defaults()}
 */
public record TurnRequest(
        String      userId,
        String      sessionId,
        String      agentId,
        String      message,
        TurnOptions options
) {

    public static final String DEFAULT_AGENT = "default";

    public TurnRequest {
        requireText(userId, "userId");
        requireText(sessionId, "sessionId");
        requireText(message, "message");
        agentId = agentId == null || agentId.isBlank() ? DEFAULT_AGENT : agentId;
        options = options == null ? TurnOptions.defaults() : options;
    }

    public static TurnRequest of(String userId, String sessionId, String message) {
        return new TurnRequest(userId, sessionId, null, message, null);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
