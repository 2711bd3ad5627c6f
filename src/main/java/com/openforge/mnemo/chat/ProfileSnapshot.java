package com.openforge.mnemo.chat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat view of what is known about a user, rendered into the system prompt.
 * Keys are shown as given, in insertion order.
 */
public record ProfileSnapshot(Map<String, String> attributes) {

    public ProfileSnapshot {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }
}
