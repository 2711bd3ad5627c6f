package com.openforge.mnemo.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.mnemo.llm.model.ChatRequest;
import com.openforge.mnemo.llm.model.Message;
import com.openforge.mnemo.memory.model.ConversationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link GenerationService} on top of the primary/fallback {@link LlmRouter}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmGenerationService implements GenerationService {

    private final LlmRouter     router;
    private final ObjectMapper  objectMapper;
    private final LlmProperties properties;

    @Override
    public String generate(String prompt, String systemPrompt, Double temperature, Integer maxTokens) {
        List<Message> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) messages.add(Message.system(systemPrompt));
        messages.add(Message.user(prompt));

        return router.chat(ChatRequest.builder()
                .messages(messages)
                .temperature(temperature != null ? temperature : properties.temperature())
                .maxTokens(maxTokens != null ? maxTokens : properties.maxTokens())
                .build()).text();
    }

    @Override
    public ObjectNode generateJson(String prompt, String systemPrompt, Double temperature) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(systemPrompt == null || systemPrompt.isBlank()
                ? "You output only valid JSON objects. No markdown, no code fence."
                : systemPrompt));
        messages.add(Message.user(prompt));

        String raw = router.chat(ChatRequest.builder()
                .messages(messages)
                .temperature(temperature != null ? temperature : properties.temperature())
                .maxTokens(properties.maxTokens())
                .responseFormat(ChatRequest.JSON_OBJECT)
                .build()).text();
        log.debug("[LLM] generateJson ← {} chars", raw.length());
        return JsonResponses.parseObject(objectMapper, raw);
    }

    @Override
    public String generateWithHistory(List<ConversationMessage> history, String systemPrompt) {
        List<Message> messages = new ArrayList<>(history.size() + 1);
        if (systemPrompt != null && !systemPrompt.isBlank()) messages.add(Message.system(systemPrompt));
        for (ConversationMessage m : history) {
            messages.add(Message.builder().role(m.role().value()).content(m.content()).build());
        }
        return router.chat(ChatRequest.builder()
                .messages(messages)
                .temperature(properties.temperature())
                .maxTokens(properties.maxTokens())
                .build()).text();
    }
}
