package com.libragraph.imagio.core.storage;

import java.util.Locale;

public enum StorageBackend {
    FILESYSTEM("filesystem"),
    S3("s3");

    private final String label;

    StorageBackend(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static StorageBackend fromLabel(String label) {
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (StorageBackend b : values()) {
            if (b.label.equals(normalized)) return b;
        }
        throw new StorageConfigException("Unknown storage type: " + label
                + " (expected filesystem or s3)");
    }
}
