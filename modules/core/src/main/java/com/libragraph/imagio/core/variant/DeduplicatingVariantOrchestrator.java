package com.libragraph.imagio.core.variant;

import com.libragraph.imagio.core.dao.ImageRecord;
import com.libragraph.imagio.types.Variant;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Shares one in-flight resolve per derivative key among concurrent callers.
 *
 * <p>The first caller for a key runs the delegate; later callers for the same
 * key attach to its result until it completes. Entries are dropped on
 * completion, success or failure, so nothing is memoized here beyond the
 * lifetime of a single render.
 *
 * <p>Each caller subscribes to its own dependent stage, never to the shared
 * future, so a caller that cancels leaves the render and the other waiters
 * untouched.
 */
public class DeduplicatingVariantOrchestrator implements VariantOrchestrator {

    private static final Logger log = Logger.getLogger(DeduplicatingVariantOrchestrator.class);

    private final VariantOrchestrator delegate;
    private final ConcurrentMap<String, CompletableFuture<byte[]>> inFlight = new ConcurrentHashMap<>();

    public DeduplicatingVariantOrchestrator(VariantOrchestrator delegate) {
        this.delegate = delegate;
    }

    @Override
    public Uni<byte[]> resolve(ImageRecord record, Variant variant) {
        if (variant.isOriginal()) {
            return delegate.resolve(record, variant);
        }
        String key = StorageKeys.of(record, variant);
        return Uni.createFrom().completionStage(() -> join(record, variant, key));
    }

    private CompletableFuture<byte[]> join(ImageRecord record, Variant variant, String key) {
        CompletableFuture<byte[]> mine = new CompletableFuture<>();
        CompletableFuture<byte[]> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debugf("Joining in-flight render: %s", key);
            return existing.thenApply(Function.identity());
        }
        delegate.resolve(record, variant).subscribe().with(
                bytes -> {
                    inFlight.remove(key, mine);
                    mine.complete(bytes);
                },
                failure -> {
                    inFlight.remove(key, mine);
                    mine.completeExceptionally(failure);
                });
        return mine.thenApply(Function.identity());
    }

    /** Number of keys currently being resolved. */
    public int inFlightCount() {
        return inFlight.size();
    }

    @Override
    public Uni<Void> storeOriginal(ImageRecord record, byte[] data) {
        return delegate.storeOriginal(record, data);
    }

    @Override
    public Uni<Void> deleteOriginal(ImageRecord record) {
        return delegate.deleteOriginal(record);
    }
}
