package com.libragraph.imagio.core.variant;

import com.libragraph.imagio.core.dao.ImageRecord;
import com.libragraph.imagio.types.Variant;
import io.smallrye.mutiny.Uni;

/**
 * Entry point into the derivative cache: serves originals verbatim and
 * renders other variants on demand, memoizing them in the derivatives namespace.
 */
public interface VariantOrchestrator {

    /**
     * Returns the bytes of {@code variant} for {@code record}.
     *
     * @throws com.libragraph.imagio.core.storage.ObjectNotFoundException if the original is missing
     * @throws com.libragraph.imagio.core.image.ImageDecodeException if the original cannot be decoded
     * @throws com.libragraph.imagio.core.storage.StorageException on backend failures
     */
    Uni<byte[]> resolve(ImageRecord record, Variant variant);

    /** Writes the uploaded bytes under the record's original key. */
    Uni<Void> storeOriginal(ImageRecord record, byte[] data);

    /**
     * Deletes the record's original. Cached derivatives are left behind; their
     * keys are never reused, so they are unreachable rather than stale.
     *
     * @throws com.libragraph.imagio.core.storage.ObjectNotFoundException if the original is missing
     */
    Uni<Void> deleteOriginal(ImageRecord record);
}
