package com.openforge.mnemo.memory.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.mnemo.memory.model.Scores;

import java.util.ArrayList;
import java.util.List;

/**
 * Lenient readers for model-produced JSON: wrong types read as absent.
 */
final class CandidateFields {

    private CandidateFields() {
    }

    /** Trimmed text, or null when missing, blank or not a scalar. */
    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) return null;
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    /** Non-blank strings from an array; a bare string counts as a one-element list. */
    static List<String> texts(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return List.of();
        if (value.isTextual()) {
            String text = value.asText().trim();
            return text.isEmpty() ? List.of() : List.of(text);
        }
        if (!value.isArray()) return List.of();
        List<String> out = new ArrayList<>();
        for (JsonNode element : value) {
            if (element.isValueNode() && !element.isNull()) {
                String text = element.asText().trim();
                if (!text.isEmpty()) out.add(text);
            }
        }
        return out;
    }

    /** Numeric field clamped to [0, 1]; numeric strings are accepted. */
    static double score(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        if (value.isNumber()) return Scores.clamp(value.asDouble());
        if (value.isTextual()) {
            try {
                return Scores.clamp(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
