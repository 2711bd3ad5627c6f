package com.openforge.mnemo.memory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of an episodic memory, as assigned by the extraction model.
 */
public enum EventType {
    NAVIGATION("navigation"),
    MUSIC_PLAYBACK("music_playback"),
    CLIMATE_CONTROL("climate_control"),
    PHONE_CALL("phone_call"),
    SCHEDULE_MANAGEMENT("schedule_management"),
    VEHICLE_CONTROL("vehicle_control"),
    GENERAL_CONVERSATION("general_conversation"),
    DINING("dining"),
    SHOPPING("shopping"),
    CUSTOM("custom");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Missing → GENERAL_CONVERSATION; present but unknown → CUSTOM.
     */
    public static EventType fromValue(String raw) {
        if (raw == null || raw.isBlank()) return GENERAL_CONVERSATION;
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (EventType type : values()) {
            if (type.value.equals(normalized)) return type;
        }
        return CUSTOM;
    }
}
