package com.openforge.mnemo.storage;

/**
 * A repository was asked for a collection it does not serve. Deployment error, never retried.
 */
public class UnsupportedCollectionException extends IllegalArgumentException {

    public UnsupportedCollectionException(String kind, String name) {
        super("Unsupported %s collection: '%s'".formatted(kind, name));
    }
}
