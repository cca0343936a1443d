package com.libragraph.imagio.core.variant;

import com.libragraph.imagio.core.dao.ImageRecord;
import com.libragraph.imagio.core.image.ImageDecodeException;
import com.libragraph.imagio.core.storage.ObjectNotFoundException;
import com.libragraph.imagio.core.storage.StorageException;
import com.libragraph.imagio.core.testutil.InMemoryObjectStorage;
import com.libragraph.imagio.core.testutil.TestImages;
import com.libragraph.imagio.types.Variant;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class NaiveVariantOrchestratorTest {

    private static final ImageRecord RECORD = new ImageRecord("abc", "public", "image/jpeg", Instant.EPOCH);

    private InMemoryObjectStorage originals;
    private InMemoryObjectStorage derivatives;
    private CountingTransformer transformer;
    private byte[] upload;

    @BeforeEach
    void setUp() {
        originals = new InMemoryObjectStorage("originals");
        derivatives = new InMemoryObjectStorage("derivatives");
        transformer = new CountingTransformer();
        upload = TestImages.rgbJpeg(2000, 1000);
        originals.put("public/abc.JPG", upload);
    }

    private NaiveVariantOrchestrator orchestrator(WriteThroughFailurePolicy policy) {
        return new NaiveVariantOrchestrator(originals, derivatives, transformer, policy);
    }

    private byte[] resolve(NaiveVariantOrchestrator o, Variant v) {
        return o.resolve(RECORD, v).await().indefinitely();
    }

    @Test
    void embedOnFirstCallRendersAndWritesThrough() {
        byte[] bytes = resolve(orchestrator(WriteThroughFailurePolicy.FAIL), Variant.EMBED);

        assertThat(TestImages.isJpeg(bytes)).isTrue();
        BufferedImage decoded = TestImages.decode(bytes);
        assertThat(decoded.getWidth()).isEqualTo(1024);
        assertThat(decoded.getHeight()).isEqualTo(512);
        assertThat(derivatives.get("public_abc_embed.JPG")).isEqualTo(bytes);
        assertThat(transformer.renders).hasValue(1);
    }

    @Test
    void concurrentMissesBothRenderAndLastWriteWins() throws Exception {
        transformer = new CountingTransformer(2);
        CountDownLatch gate = new CountDownLatch(1);
        transformer.holdRendersUntil(gate);
        NaiveVariantOrchestrator o = orchestrator(WriteThroughFailurePolicy.FAIL);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<byte[]> first = CompletableFuture.supplyAsync(() -> resolve(o, Variant.THUMB), pool);
            CompletableFuture<byte[]> second = CompletableFuture.supplyAsync(() -> resolve(o, Variant.THUMB), pool);
            // both callers missed the cache and are rendering
            assertThat(transformer.entered.await(10, TimeUnit.SECONDS)).isTrue();
            gate.countDown();

            byte[] a = first.get(10, TimeUnit.SECONDS);
            byte[] b = second.get(10, TimeUnit.SECONDS);

            for (byte[] bytes : new byte[][]{a, b}) {
                BufferedImage decoded = TestImages.decode(bytes);
                assertThat(decoded.getWidth()).isEqualTo(256);
                assertThat(decoded.getHeight()).isEqualTo(128);
            }
            assertThat(transformer.renders).hasValue(2);
            assertThat(derivatives.writes).hasValue(2);
            assertThat(derivatives.size()).isEqualTo(1);
            assertThat(derivatives.get("public_abc_thumb.JPG")).satisfiesAnyOf(
                    stored -> assertThat(stored).isEqualTo(a),
                    stored -> assertThat(stored).isEqualTo(b));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void secondCallIsAPureCacheHit() {
        NaiveVariantOrchestrator o = orchestrator(WriteThroughFailurePolicy.FAIL);
        byte[] first = resolve(o, Variant.EMBED);
        originals.resetCounters();
        derivatives.resetCounters();

        byte[] second = resolve(o, Variant.EMBED);

        assertThat(second).isEqualTo(first);
        assertThat(transformer.renders).hasValue(1);
        assertThat(originals.reads).hasValue(0);
        assertThat(derivatives.existsChecks).hasValue(1);
        assertThat(derivatives.reads).hasValue(1);
        assertThat(derivatives.writes).hasValue(0);
    }

    @Test
    void originalIsServedVerbatim() {
        byte[] bytes = resolve(orchestrator(WriteThroughFailurePolicy.FAIL), Variant.ORIGINAL);

        assertThat(bytes).isEqualTo(upload);
        assertThat(transformer.renders).hasValue(0);
        assertThat(derivatives.existsChecks).hasValue(0);
        assertThat(derivatives.size()).isZero();
    }

    @Test
    void missingOriginalIsNotFound() {
        originals.remove("public/abc.JPG");

        assertThatThrownBy(() -> resolve(orchestrator(WriteThroughFailurePolicy.FAIL), Variant.THUMB))
                .isInstanceOf(ObjectNotFoundException.class);
        assertThatThrownBy(() -> resolve(orchestrator(WriteThroughFailurePolicy.FAIL), Variant.ORIGINAL))
                .isInstanceOf(ObjectNotFoundException.class);
        assertThat(transformer.renders).hasValue(0);
    }

    @Test
    void corruptOriginalIsADecodeError() {
        originals.put("public/abc.JPG", "definitely not a jpeg".getBytes());

        assertThatThrownBy(() -> resolve(orchestrator(WriteThroughFailurePolicy.FAIL), Variant.BANNER))
                .isInstanceOf(ImageDecodeException.class);
        assertThat(derivatives.size()).isZero();
    }

    @Test
    void deletedDerivativeIsRegenerated() {
        NaiveVariantOrchestrator o = orchestrator(WriteThroughFailurePolicy.FAIL);
        byte[] first = resolve(o, Variant.SQUARE);
        derivatives.remove("public_abc_square.JPG");

        byte[] second = resolve(o, Variant.SQUARE);

        assertThat(second).isEqualTo(first);
        assertThat(derivatives.contains("public_abc_square.JPG")).isTrue();
        assertThat(transformer.renders).hasValue(2);
    }

    @Test
    void derivativeVanishingBetweenExistsAndReadIsRegenerated() {
        InMemoryObjectStorage racy = new InMemoryObjectStorage("derivatives") {
            @Override
            public Uni<Boolean> exists(String key) {
                return Uni.createFrom().item(true);
            }
        };
        NaiveVariantOrchestrator o = new NaiveVariantOrchestrator(originals, racy, transformer,
                WriteThroughFailurePolicy.FAIL);

        byte[] bytes = o.resolve(RECORD, Variant.THUMB).await().indefinitely();

        assertThat(TestImages.decode(bytes).getWidth()).isEqualTo(256);
        assertThat(racy.contains("public_abc_thumb.JPG")).isTrue();
    }

    @Test
    void failedWriteThroughFailsTheCallUnderFailPolicy() {
        derivatives.failWrites(true);

        assertThatThrownBy(() -> resolve(orchestrator(WriteThroughFailurePolicy.FAIL), Variant.PUBLIC))
                .isInstanceOf(StorageException.class);
        assertThat(transformer.renders).hasValue(1);
    }

    @Test
    void failedWriteThroughStillServesUnderServePolicy() {
        derivatives.failWrites(true);

        byte[] bytes = resolve(orchestrator(WriteThroughFailurePolicy.SERVE), Variant.PUBLIC);

        assertThat(TestImages.decode(bytes).getWidth()).isEqualTo(1024);
        assertThat(derivatives.contains("public_abc_public.JPG")).isFalse();
    }

    @Test
    void unreachableCacheIsABackendError() {
        derivatives.unreachable(true);

        assertThatThrownBy(() -> resolve(orchestrator(WriteThroughFailurePolicy.SERVE), Variant.THUMB))
                .isInstanceOf(StorageException.class);
    }

    @Test
    void storeAndDeleteOriginalUseTheOriginalKey() {
        ImageRecord png = new ImageRecord("xyz", "avatars", "image/png", Instant.EPOCH);
        NaiveVariantOrchestrator o = orchestrator(WriteThroughFailurePolicy.FAIL);
        byte[] data = TestImages.rgbaPng(32, 32);

        o.storeOriginal(png, data).await().indefinitely();
        assertThat(originals.get("avatars/xyz.PNG")).isEqualTo(data);

        o.deleteOriginal(png).await().indefinitely();
        assertThat(originals.contains("avatars/xyz.PNG")).isFalse();
    }

    @Test
    void deleteOriginalLeavesDerivativesAlone() {
        NaiveVariantOrchestrator o = orchestrator(WriteThroughFailurePolicy.FAIL);
        resolve(o, Variant.THUMB);

        o.deleteOriginal(RECORD).await().indefinitely();

        assertThat(derivatives.contains("public_abc_thumb.JPG")).isTrue();
        assertThatThrownBy(() -> o.deleteOriginal(RECORD).await().indefinitely())
                .isInstanceOf(ObjectNotFoundException.class);
    }
}
