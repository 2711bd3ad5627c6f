package com.openforge.mnemo.llm;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.mnemo.memory.model.ConversationMessage;

import java.util.List;

/**
 * Text generation capability used by the memory engines.
 *
 * Provider failures surface as {@link LlmClient.LlmException}. Malformed model output
 * never does: {@link #generateJson} recovers what it can and otherwise returns an
 * empty object.
 */
public interface GenerationService {

    /**
     * @param temperature null uses the configured default
     * @param maxTokens   null uses the configured default
     */
    String generate(String prompt, String systemPrompt, Double temperature, Integer maxTokens);

    default String generate(String prompt, String systemPrompt) {
        return generate(prompt, systemPrompt, null, null);
    }

    ObjectNode generateJson(String prompt, String systemPrompt, Double temperature);

    /** Reply to a conversation; the last message is normally the user's. */
    String generateWithHistory(List<ConversationMessage> messages, String systemPrompt);
}
