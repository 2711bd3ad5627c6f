package com.openforge.mnemo.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recovers a JSON object from model output that may be wrapped in Markdown
 * fences or surrounded by prose.
 *
 * Order: fenced block → whole text → outermost {@code {...}} span → empty object.
 */
@Slf4j
public final class JsonResponses {

    private static final Pattern JSON_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

    private JsonResponses() {
    }

    public static ObjectNode parseObject(ObjectMapper objectMapper, String raw) {
        if (raw == null || raw.isBlank()) return objectMapper.createObjectNode();

        String text = stripMarkdownJson(raw);
        Optional<ObjectNode> direct = readObject(objectMapper, text);
        if (direct.isPresent()) return direct.get();

        int start = text.indexOf('{');
        int end   = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            Optional<ObjectNode> span = readObject(objectMapper, text.substring(start, end + 1));
            if (span.isPresent()) return span.get();
        }

        log.warn("[LLM] Could not recover a JSON object from model output ({} chars)", raw.length());
        return objectMapper.createObjectNode();
    }

    static String stripMarkdownJson(String raw) {
        var m = JSON_BLOCK.matcher(raw);
        if (m.find()) return m.group(1).trim();
        return raw.trim();
    }

    private static Optional<ObjectNode> readObject(ObjectMapper objectMapper, String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node instanceof ObjectNode object ? Optional.of(object) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
