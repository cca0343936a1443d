package com.libragraph.imagio.core.variant;

import java.util.Locale;

/**
 * What to do when a freshly rendered variant cannot be written to the cache.
 */
public enum WriteThroughFailurePolicy {
    /** The resolve call fails with the storage error. */
    FAIL,
    /** The rendered bytes are returned anyway and the failure is logged. */
    SERVE;

    /**
     * @throws IllegalArgumentException for anything but {@code fail} or {@code serve}
     */
    public static WriteThroughFailurePolicy fromLabel(String label) {
        for (WriteThroughFailurePolicy policy : values()) {
            if (policy.name().equals(label.trim().toUpperCase(Locale.ROOT))) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown write-through failure policy: " + label);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
