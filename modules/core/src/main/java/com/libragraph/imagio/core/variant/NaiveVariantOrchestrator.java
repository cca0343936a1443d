package com.libragraph.imagio.core.variant;

import com.libragraph.imagio.core.dao.ImageRecord;
import com.libragraph.imagio.core.image.ImageTransformer;
import com.libragraph.imagio.core.image.RenderedVariant;
import com.libragraph.imagio.core.storage.ObjectNotFoundException;
import com.libragraph.imagio.core.storage.ObjectStorage;
import com.libragraph.imagio.core.storage.StorageException;
import com.libragraph.imagio.types.Variant;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Check-cache, else transform and write through.
 *
 * <p>Concurrent misses on the same key each render and write independently;
 * the last write wins. Renders are a pure function of the immutable original,
 * so every caller still gets a correct result. Wrap in
 * {@link DeduplicatingVariantOrchestrator} to share one render per key.
 */
public class NaiveVariantOrchestrator implements VariantOrchestrator {

    private static final Logger log = Logger.getLogger(NaiveVariantOrchestrator.class);

    private final ObjectStorage originals;
    private final ObjectStorage derivatives;
    private final ImageTransformer transformer;
    private final WriteThroughFailurePolicy failurePolicy;

    public NaiveVariantOrchestrator(ObjectStorage originals, ObjectStorage derivatives,
                                    ImageTransformer transformer,
                                    WriteThroughFailurePolicy failurePolicy) {
        this.originals = originals;
        this.derivatives = derivatives;
        this.transformer = transformer;
        this.failurePolicy = failurePolicy;
    }

    @Override
    public Uni<byte[]> resolve(ImageRecord record, Variant variant) {
        if (variant.isOriginal()) {
            return originals.read(StorageKeys.original(record));
        }
        String key = StorageKeys.of(record, variant);
        return derivatives.exists(key).flatMap(hit -> {
            if (!hit) {
                log.debugf("Cache miss: %s", key);
                return render(record, variant, key);
            }
            log.debugf("Cache hit: %s", key);
            return derivatives.read(key)
                    .onFailure(ObjectNotFoundException.class).recoverWithUni(e -> {
                        log.debugf("Cached variant vanished before read, re-rendering: %s", key);
                        return render(record, variant, key);
                    });
        });
    }

    private Uni<byte[]> render(ImageRecord record, Variant variant, String key) {
        return originals.read(StorageKeys.original(record))
                .map(source -> transformer.transform(source, variant))
                .flatMap(rendered -> writeThrough(key, rendered)
                        .replaceWith(rendered.data()));
    }

    private Uni<Void> writeThrough(String key, RenderedVariant rendered) {
        Uni<Void> write = derivatives.write(key, rendered.data(), rendered.format().mimeType());
        if (failurePolicy == WriteThroughFailurePolicy.SERVE) {
            return write.onFailure(StorageException.class).recoverWithUni(e -> {
                log.warnf("Serving uncached variant %s: %s", key, e.getMessage());
                return Uni.createFrom().voidItem();
            });
        }
        return write;
    }

    @Override
    public Uni<Void> storeOriginal(ImageRecord record, byte[] data) {
        return originals.write(StorageKeys.original(record), data, record.mime());
    }

    @Override
    public Uni<Void> deleteOriginal(ImageRecord record) {
        return originals.delete(StorageKeys.original(record));
    }
}
