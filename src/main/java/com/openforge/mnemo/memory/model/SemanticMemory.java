package com.openforge.mnemo.memory.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Locale;

/**
 * A subject-predicate-object knowledge triple. Never mutated after creation.
 *
 * Two triples are the same knowledge when they match case-insensitively on all
 * three parts; see {@link #tripleKey()}.
 */
@Builder(toBuilder = true)
public record SemanticMemory(
        String           id,
        String           userId,
        String           agentId,
        String           subject,
        String           predicate,
        String           object,
        SemanticCategory category,
        double           confidence,
        Instant          createdAt
) {

    public SemanticMemory {
        if (isBlank(subject) || isBlank(predicate) || isBlank(object)) {
            throw new IllegalArgumentException("Semantic memory requires subject, predicate and object");
        }
        category   = category == null ? SemanticCategory.FACT : category;
        confidence = Scores.clamp(confidence);
    }

    public String tripleKey() {
        return subject.toLowerCase(Locale.ROOT) + "\u0000"
                + predicate.toLowerCase(Locale.ROOT) + "\u0000"
                + object.toLowerCase(Locale.ROOT);
    }

    /** The text that gets embedded: {@code "subject predicate object"}. */
    public String tripleText() {
        return subject + " " + predicate + " " + object;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
