package com.libragraph.imagio.types;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Closed set of renditions a client may request for a stored image.
 *
 * <p>{@link #ORIGINAL} is the uploaded byte stream and is never transformed.
 * Every other variant resolves to a target bounding box via
 * {@link #targetBox(Dimensions)}; the rendered size is the source fitted into
 * that box ({@link #outputSize(Dimensions)}).
 */
public enum Variant {
    ORIGINAL("original"),
    PUBLIC("public"),
    EMBED("embed"),
    THUMB("thumb"),
    BANNER("banner"),
    SQUARE("square");

    public static final int EMBED_MAX_WIDTH = 1024;

    private final String label;

    Variant(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isOriginal() {
        return this == ORIGINAL;
    }

    /**
     * Bounding box for this variant given the source size.
     *
     * @throws IllegalStateException for {@link #ORIGINAL}, which has no geometry
     */
    public Dimensions targetBox(Dimensions source) {
        return switch (this) {
            case PUBLIC -> Dimensions.of(1024, 768);
            case THUMB -> Dimensions.of(256, 256);
            case BANNER -> Dimensions.of(800, 400);
            case SQUARE -> Dimensions.of(320, 320);
            case EMBED -> {
                int width = Math.min(source.width(), EMBED_MAX_WIDTH);
                long height = (long) source.height() * width / source.width();
                yield Dimensions.of(width, (int) Math.max(1, height));
            }
            case ORIGINAL -> throw new IllegalStateException("original variant is never transformed");
        };
    }

    /** Final pixel size of this variant rendered from a source of the given size. */
    public Dimensions outputSize(Dimensions source) {
        return source.fitInto(targetBox(source));
    }

    /** All variants that are produced by transformation. */
    public static List<Variant> derived() {
        return Arrays.stream(values()).filter(v -> !v.isOriginal()).toList();
    }

    /**
     * Parses a variant label, case-insensitively.
     *
     * @throws IllegalArgumentException if the label names no variant
     */
    public static Variant fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("variant label cannot be null");
        }
        String normalized = label.toLowerCase(Locale.ROOT);
        for (Variant v : values()) {
            if (v.label.equals(normalized)) return v;
        }
        throw new IllegalArgumentException("Unknown variant: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
