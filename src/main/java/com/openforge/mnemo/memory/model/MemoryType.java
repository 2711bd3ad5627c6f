package com.openforge.mnemo.memory.model;

/**
 * Classifies a long-term memory entry.
 *
 * EPISODIC  "What happened": a specific event or exchange, kept as a lossless restatement.
 *           Example: "On Monday the user asked to navigate to the airport with Lisa."
 *
 * SEMANTIC  "What I know": a subject-predicate-object knowledge triple.
 *           Example: (user, prefers, jazz)
 */
public enum MemoryType {
    EPISODIC,
    SEMANTIC
}
