package com.libragraph.imagio.core.storage;

/**
 * Invalid storage backend configuration. Raised during startup and fatal.
 */
public class StorageConfigException extends RuntimeException {

    public StorageConfigException(String message) {
        super(message);
    }
}
