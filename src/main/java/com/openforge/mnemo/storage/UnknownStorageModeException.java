package com.openforge.mnemo.storage;

/**
 * {@code mnemo.storage.mode} holds a value no adapter set answers to. Aborts startup.
 */
public class UnknownStorageModeException extends IllegalStateException {

    public UnknownStorageModeException(String mode) {
        super("Unknown storage mode '%s' (expected one of: local, milvus)".formatted(mode));
    }
}
