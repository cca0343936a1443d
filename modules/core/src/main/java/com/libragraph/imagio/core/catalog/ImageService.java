package com.libragraph.imagio.core.catalog;

import com.libragraph.imagio.core.dao.ImageRecord;
import com.libragraph.imagio.core.image.ImageTypes;
import com.libragraph.imagio.core.storage.ObjectNotFoundException;
import com.libragraph.imagio.core.variant.VariantOrchestrator;
import com.libragraph.imagio.types.Variant;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Upload, lookup, render and delete of images: ties the metadata catalog to
 * the variant orchestrator.
 */
@ApplicationScoped
public class ImageService {

    private static final Logger log = Logger.getLogger(ImageService.class);

    private static final Pattern CATEGORY = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    @Inject
    ImageCatalog catalog;

    @Inject
    VariantOrchestrator orchestrator;

    /**
     * Stores an uploaded original and registers its metadata, in that order.
     * A crash between the two leaves an orphaned original, never a record
     * without bytes.
     *
     * @throws IllegalArgumentException if the category is not a valid name
     * @throws com.libragraph.imagio.core.image.ImageDecodeException if the payload is not a supported image
     */
    public ImageRecord upload(String category, byte[] data) {
        validateCategory(category);
        String mime = ImageTypes.detectSupportedImage(data);
        ImageRecord record = new ImageRecord(UUID.randomUUID().toString(), category, mime,
                Instant.now().truncatedTo(ChronoUnit.MILLIS));

        orchestrator.storeOriginal(record, data).await().indefinitely();
        catalog.put(record);
        log.infof("New image uploaded: uuid=%s category=%s mime=%s size=%d",
                record.uuid(), category, mime, data.length);
        return record;
    }

    public ImageRecord get(String uuid) {
        return catalog.get(uuid);
    }

    public List<ImageRecord> list(String category, int limit, int skip) {
        return catalog.list(category, limit, skip);
    }

    /** Looks up the record and resolves the requested variant. */
    public byte[] render(String uuid, Variant variant) {
        ImageRecord record = catalog.get(uuid);
        return orchestrator.resolve(record, variant).await().indefinitely();
    }

    /** Renders every derived variant so later requests are cache hits. */
    public void warm(String uuid) {
        ImageRecord record = catalog.get(uuid);
        for (Variant variant : Variant.derived()) {
            orchestrator.resolve(record, variant).await().indefinitely();
        }
        log.debugf("Warmed %d variants for %s", Variant.derived().size(), uuid);
    }

    /**
     * Removes the record, then its original. A missing original is logged and
     * ignored; cached derivatives are left in place.
     *
     * @throws ImageNotFoundException if no record exists for the uuid
     */
    public ImageRecord delete(String uuid) {
        ImageRecord record = catalog.delete(uuid);
        try {
            orchestrator.deleteOriginal(record).await().indefinitely();
        } catch (ObjectNotFoundException e) {
            log.warnf("Original already missing for deleted image %s: %s", uuid, e.key());
        }
        log.infof("Image deleted: uuid=%s", uuid);
        return record;
    }

    static void validateCategory(String category) {
        if (category == null || !CATEGORY.matcher(category).matches()) {
            throw new IllegalArgumentException("Invalid category: " + category);
        }
    }
}
