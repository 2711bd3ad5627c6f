package com.openforge.mnemo.memory.model;

import java.util.List;

/**
 * Intent label and search keywords derived from a query.
 */
public record IntentAnalysis(String intent, List<String> searchKeywords) {

    public static final String UNKNOWN_INTENT = "unknown";

    public IntentAnalysis {
        intent         = intent == null || intent.isBlank() ? UNKNOWN_INTENT : intent;
        searchKeywords = searchKeywords == null
                ? List.of()
                : searchKeywords.stream().filter(k -> k != null && !k.isBlank()).toList();
    }

    public static IntentAnalysis unknown() {
        return new IntentAnalysis(UNKNOWN_INTENT, List.of());
    }

    /** The keywords to match with, or the raw query when the analysis produced none. */
    public List<String> effectiveKeywords(String query) {
        if (!searchKeywords.isEmpty()) return searchKeywords;
        return query == null || query.isBlank() ? List.of() : List.of(query);
    }
}
