package com.libragraph.imagio.test;

import com.libragraph.imagio.core.catalog.ImageCatalog;
import com.libragraph.imagio.core.catalog.ImageNotFoundException;
import com.libragraph.imagio.core.dao.ImageRecord;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class ImageCatalogTest {

    @Inject
    ImageCatalog catalog;

    private static ImageRecord record(String category, Instant createdAt) {
        return new ImageRecord(UUID.randomUUID().toString(), category, "image/png", createdAt);
    }

    @Test
    void putThenGetRoundTripsFields() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        ImageRecord stored = record("catalog-get", now);
        catalog.put(stored);

        ImageRecord loaded = catalog.get(stored.uuid());
        assertThat(loaded.uuid()).isEqualTo(stored.uuid());
        assertThat(loaded.category()).isEqualTo("catalog-get");
        assertThat(loaded.mime()).isEqualTo("image/png");
        assertThat(loaded.createdAt()).isEqualTo(now);
    }

    @Test
    void listIsNewestFirstAndPaged() {
        String category = "catalog-" + UUID.randomUUID().toString().substring(0, 8);
        Instant base = Instant.parse("2024-01-01T00:00:00Z");
        ImageRecord oldest = record(category, base);
        ImageRecord middle = record(category, base.plusSeconds(60));
        ImageRecord newest = record(category, base.plusSeconds(120));
        catalog.put(middle);
        catalog.put(oldest);
        catalog.put(newest);

        assertThat(catalog.list(category, 10, 0))
                .extracting(ImageRecord::uuid)
                .containsExactly(newest.uuid(), middle.uuid(), oldest.uuid());
        assertThat(catalog.list(category, 1, 1))
                .extracting(ImageRecord::uuid)
                .containsExactly(middle.uuid());
        assertThat(catalog.list(category, 10, 5)).isEmpty();
        assertThat(catalog.list(category, 0, 0)).isEmpty();
    }

    @Test
    void negativePagingIsRejected() {
        assertThatThrownBy(() -> catalog.list("any", -1, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> catalog.list("any", 1, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteReturnsRemovedRecord() {
        ImageRecord stored = record("catalog-delete", Instant.now());
        catalog.put(stored);

        ImageRecord removed = catalog.delete(stored.uuid());
        assertThat(removed.uuid()).isEqualTo(stored.uuid());

        assertThatThrownBy(() -> catalog.get(stored.uuid()))
                .isInstanceOf(ImageNotFoundException.class);
        assertThatThrownBy(() -> catalog.delete(stored.uuid()))
                .isInstanceOf(ImageNotFoundException.class);
    }

    @Test
    void unknownUuidIsNotFound() {
        List<ImageRecord> none = catalog.list("catalog-empty-" + UUID.randomUUID(), 5, 0);
        assertThat(none).isEmpty();
        assertThatThrownBy(() -> catalog.get(UUID.randomUUID().toString()))
                .isInstanceOf(ImageNotFoundException.class);
    }
}
