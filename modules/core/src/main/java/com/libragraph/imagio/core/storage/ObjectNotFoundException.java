package com.libragraph.imagio.core.storage;

/**
 * Thrown when a read or delete targets a key that does not exist.
 */
public class ObjectNotFoundException extends RuntimeException {

    private final String namespace;
    private final String key;

    public ObjectNotFoundException(String namespace, String key) {
        super("Object not found: namespace=" + namespace + " key=" + key);
        this.namespace = namespace;
        this.key = key;
    }

    public String namespace() {
        return namespace;
    }

    public String key() {
        return key;
    }
}
