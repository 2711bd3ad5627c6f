package com.openforge.mnemo.memory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SemanticCategory {
    PREFERENCE("preference"),
    FACT("fact"),
    RELATIONSHIP("relationship"),
    HABIT("habit"),
    KNOWLEDGE("knowledge");

    private final String value;

    SemanticCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Unknown or missing categories default to FACT. */
    public static SemanticCategory fromValue(String raw) {
        if (raw == null || raw.isBlank()) return FACT;
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SemanticCategory category : values()) {
            if (category.value.equals(normalized)) return category;
        }
        return FACT;
    }
}
