package com.openforge.mnemo.memory.model;

import java.util.List;

/**
 * Memories accepted by one extraction call, with the per-memory persistence outcome.
 */
public record ExtractionResult(
        List<EpisodicMemory>     episodic,
        List<SemanticMemory>     semantic,
        List<PersistenceOutcome> outcomes
) {

    public ExtractionResult {
        episodic = List.copyOf(episodic);
        semantic = List.copyOf(semantic);
        outcomes = List.copyOf(outcomes);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of(), List.of());
    }

    public int total() {
        return episodic.size() + semantic.size();
    }
}
