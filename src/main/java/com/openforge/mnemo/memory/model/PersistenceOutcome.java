package com.openforge.mnemo.memory.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Which of the three index writes for one memory succeeded.
 * A memory is kept even if only some writes landed.
 */
public record PersistenceOutcome(
        String       memoryId,
        MemoryType   memoryType,
        boolean      documentStored,
        boolean      vectorStored,
        boolean      graphUpdated,
        List<String> errors
) {

    public PersistenceOutcome {
        errors = List.copyOf(errors);
    }

    public boolean complete() {
        return documentStored && vectorStored && graphUpdated;
    }

    public boolean lost() {
        return !documentStored && !vectorStored && !graphUpdated;
    }

    /** Mutable accumulator used while the three writes run. */
    public static final class Tracker {
        private final String     memoryId;
        private final MemoryType memoryType;
        private boolean document;
        private boolean vector;
        private boolean graph;
        private final List<String> errors = new ArrayList<>();

        public Tracker(String memoryId, MemoryType memoryType) {
            this.memoryId   = memoryId;
            this.memoryType = memoryType;
        }

        public void documentStored() { this.document = true; }
        public void vectorStored()   { this.vector = true; }
        public void graphUpdated()   { this.graph = true; }

        public void failed(String step, Exception e) {
            errors.add(step + ": " + e.getMessage());
        }

        public PersistenceOutcome finish() {
            return new PersistenceOutcome(memoryId, memoryType, document, vector, graph, errors);
        }
    }
}
