package com.libragraph.imagio.core.variant;

import com.libragraph.imagio.core.dao.ImageRecord;
import com.libragraph.imagio.core.image.ImageTypes;
import com.libragraph.imagio.types.Variant;

import java.util.Objects;

/**
 * Derives the storage key of a (record, variant) pair. Pure: the same input
 * always yields the same key, in either namespace.
 *
 * <p>Format: {@code {category}/{uuid}.{EXT}} for the original,
 * {@code {category}_{uuid}_{variant}.{EXT}} for derivatives, where EXT comes
 * from the record's MIME type.
 */
public final class StorageKeys {

    private StorageKeys() {
    }

    public static String of(ImageRecord record, Variant variant) {
        Objects.requireNonNull(record, "record cannot be null");
        Objects.requireNonNull(variant, "variant cannot be null");
        String ext = ImageTypes.extensionFor(record.mime());
        return variant.isOriginal()
                ? record.category() + "/" + record.uuid() + "." + ext
                : record.category() + "_" + record.uuid() + "_" + variant.label() + "." + ext;
    }

    public static String original(ImageRecord record) {
        return of(record, Variant.ORIGINAL);
    }
}
