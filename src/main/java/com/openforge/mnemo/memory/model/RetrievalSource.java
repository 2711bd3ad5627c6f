package com.openforge.mnemo.memory.model;

/**
 * Candidate-generation strategy that contributed a hit.
 */
public enum RetrievalSource {
    SEMANTIC("semantic"),
    LEXICAL("lexical"),
    GRAPH("graph");

    private final String tag;

    RetrievalSource(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
