package com.openforge.mnemo.memory.model;

import java.util.List;

/**
 * Outcome of a retrieval call. Always present; possibly empty.
 *
 * @param retrievalPlan human-readable trace, e.g. {@code "intent: navigation | episodic: 2 | semantic: 1 | elapsed: 12.3ms"}
 */
public record RetrievalResult(
        List<ScoredMemory>   episodicMemories,
        List<SemanticMemory> semanticMemories,
        String               intent,
        String               retrievalPlan,
        double               elapsedMillis
) {

    public RetrievalResult {
        episodicMemories = List.copyOf(episodicMemories);
        semanticMemories = List.copyOf(semanticMemories);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), List.of(), IntentAnalysis.UNKNOWN_INTENT, "", 0);
    }

    public int size() {
        return episodicMemories.size() + semanticMemories.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
