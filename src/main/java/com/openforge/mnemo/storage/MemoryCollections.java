package com.openforge.mnemo.storage;

import java.util.Set;

/**
 * The only collection names the engines read and write.
 */
public final class MemoryCollections {

    public static final String EPISODIC_DOCUMENTS = "episodic_memories";
    public static final String SEMANTIC_DOCUMENTS = "semantic_memories";

    public static final String EPISODIC_VECTORS = "episodic";
    public static final String SEMANTIC_VECTORS = "semantic";

    private static final Set<String> DOCUMENT_COLLECTIONS = Set.of(EPISODIC_DOCUMENTS, SEMANTIC_DOCUMENTS);
    private static final Set<String> VECTOR_COLLECTIONS   = Set.of(EPISODIC_VECTORS, SEMANTIC_VECTORS);

    private MemoryCollections() {
    }

    public static String requireDocumentCollection(String name) {
        if (!DOCUMENT_COLLECTIONS.contains(name)) {
            throw new UnsupportedCollectionException("document", name);
        }
        return name;
    }

    public static String requireVectorCollection(String name) {
        if (!VECTOR_COLLECTIONS.contains(name)) {
            throw new UnsupportedCollectionException("vector", name);
        }
        return name;
    }
}
