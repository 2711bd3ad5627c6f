package com.openforge.mnemo.chat;

import com.openforge.mnemo.memory.model.RetrievalQuery;

/**
 * Per-turn switches.
 *
 * @param maxMemoryItems retrieval breadth, bounded like {@link RetrievalQuery#topK()}
 */
public record TurnOptions(boolean includeMemory, boolean includeProfile, int maxMemoryItems) {

    public TurnOptions {
        maxMemoryItems = Math.max(1, Math.min(RetrievalQuery.MAX_TOP_K, maxMemoryItems));
    }

    public static TurnOptions defaults() {
        return new TurnOptions(true, true, RetrievalQuery.DEFAULT_TOP_K);
    }

    public static TurnOptions withoutMemory() {
        return new TurnOptions(false, false, RetrievalQuery.DEFAULT_TOP_K);
    }
}
