package com.libragraph.imagio.core.storage;

import io.smallrye.mutiny.Uni;

/**
 * Key/value byte store backing one storage namespace (originals or derivatives).
 *
 * <p>Keys are opaque relative strings produced by
 * {@link com.libragraph.imagio.core.variant.StorageKeys}; backends map them to
 * paths or object names internally. Implementations must be safe for
 * concurrent use on independent keys.
 *
 * <p>Every returned {@link Uni} is lazy and performs blocking I/O on the
 * subscribing thread.
 */
public interface ObjectStorage {

    /**
     * Reads the bytes stored under {@code key}.
     *
     * @throws ObjectNotFoundException if the key does not exist
     * @throws StorageException on I/O or network errors
     */
    Uni<byte[]> read(String key);

    /**
     * Creates or overwrites {@code key}. A single write is atomic: readers see
     * either the previous content or the new content, never a mix.
     *
     * @param mimeType optional content type hint (may be null)
     * @throws StorageException on I/O or network errors
     */
    Uni<Void> write(String key, byte[] data, String mimeType);

    /**
     * Checks whether a key exists. Absence is {@code false}, not an error.
     *
     * @throws StorageException if the backend cannot be reached
     */
    Uni<Boolean> exists(String key);

    /**
     * Deletes a key.
     *
     * @throws ObjectNotFoundException if the key does not exist
     * @throws StorageException on I/O or network errors
     */
    Uni<Void> delete(String key);
}
