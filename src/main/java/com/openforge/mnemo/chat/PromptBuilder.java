package com.openforge.mnemo.chat;

import com.openforge.mnemo.memory.model.ConversationMessage;
import com.openforge.mnemo.memory.model.MessageRole;
import com.openforge.mnemo.memory.model.RetrievalResult;
import com.openforge.mnemo.memory.model.ScoredMemory;
import com.openforge.mnemo.memory.model.SemanticMemory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the system prompt and the message history for one chat turn.
 *
 * System prompt layout:
 *   persona
 *   ## User profile        (only with a non-empty snapshot)
 *   ## Relevant memories   (only with retrieved memories)
 *     ### Events           1. text (relevance 0.87)
 *     ### Knowledge        - subject predicate object
 */
final class PromptBuilder {

    static final String PERSONA = """
            You are a friendly, attentive assistant with a long-term memory of past conversations.
            Use what you remember about the user when it helps, and never invent memories you do not have.
            Reply in the language the user writes in.""";

    /** Messages of history handed to the model per turn. */
    static final int HISTORY_LIMIT = 10;

    private PromptBuilder() {
    }

    static String systemPrompt(ProfileSnapshot profile, RetrievalResult memories) {
        StringBuilder sb = new StringBuilder(PERSONA);

        if (profile != null && !profile.isEmpty()) {
            sb.append("\n\n## User profile\n");
            profile.attributes().forEach((key, value) ->
                    sb.append("- ").append(key).append(": ").append(value).append('\n'));
        }

        String memoryBlock = memoryContext(memories);
        if (!memoryBlock.isEmpty()) {
            sb.append("\n\n## Relevant memories\n").append(memoryBlock);
        }
        return sb.toString().stripTrailing();
    }

    static String memoryContext(RetrievalResult memories) {
        if (memories == null || memories.isEmpty()) return "";

        List<String> lines = new ArrayList<>();
        if (!memories.episodicMemories().isEmpty()) {
            lines.add("### Events");
            int n = 1;
            for (ScoredMemory memory : memories.episodicMemories()) {
                lines.add(String.format(Locale.ROOT, "%d. %s (relevance %.2f)", n++, memory.content(), memory.score()));
            }
        }
        if (!memories.semanticMemories().isEmpty()) {
            lines.add("### Knowledge");
            for (SemanticMemory fact : memories.semanticMemories()) {
                lines.add("- " + fact.tripleText());
            }
        }
        return String.join("\n", lines);
    }

    /**
     * The last {@value #HISTORY_LIMIT} session messages, ending with the user's
     * message. The current message is appended when the session does not already end with it.
     */
    static List<ConversationMessage> history(List<ConversationMessage> sessionMessages,
                                             String userMessage, Instant now) {
        int from = Math.max(0, sessionMessages.size() - HISTORY_LIMIT);
        List<ConversationMessage> recent = new ArrayList<>(sessionMessages.subList(from, sessionMessages.size()));
        if (recent.isEmpty() || recent.get(recent.size() - 1).role() != MessageRole.USER) {
            recent.add(ConversationMessage.user(userMessage, now));
        }
        return recent;
    }
}
