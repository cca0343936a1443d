package com.libragraph.imagio.core.catalog;

/**
 * Thrown when no metadata record exists for a uuid.
 */
public class ImageNotFoundException extends RuntimeException {

    private final String uuid;

    public ImageNotFoundException(String uuid) {
        super("Image not found: " + uuid);
        this.uuid = uuid;
    }

    public String uuid() {
        return uuid;
    }
}
