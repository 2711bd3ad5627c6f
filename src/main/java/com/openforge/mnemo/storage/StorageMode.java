package com.openforge.mnemo.storage;

import java.util.Locale;

/**
 * LOCAL   every repository in process memory.
 * MILVUS  vectors in Milvus, everything else in process memory.
 */
public enum StorageMode {
    LOCAL,
    MILVUS;

    public static StorageMode parse(String raw) {
        if (raw == null || raw.isBlank()) return LOCAL;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "local"  -> LOCAL;
            case "milvus" -> MILVUS;
            default       -> throw new UnknownStorageModeException(raw);
        };
    }
}
