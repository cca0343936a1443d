package com.libragraph.imagio.types;

/**
 * Pixel width and height of an image or of a target bounding box.
 */
public record Dimensions(int width, int height) {

    public Dimensions {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "dimensions must be > 0, got: " + width + "x" + height);
        }
    }

    public static Dimensions of(int width, int height) {
        return new Dimensions(width, height);
    }

    /**
     * Fits these dimensions into {@code box}, preserving aspect ratio.
     * Never upscales and never crops; all divisions floor.
     */
    public Dimensions fitInto(Dimensions box) {
        if (width <= box.width && height <= box.height) {
            return this;
        }
        long scaledHeight = (long) height * box.width / width;
        if (scaledHeight <= box.height) {
            return new Dimensions(box.width, (int) Math.max(1, scaledHeight));
        }
        long scaledWidth = (long) width * box.height / height;
        return new Dimensions((int) Math.max(1, scaledWidth), box.height);
    }

    public boolean fitsWithin(Dimensions box) {
        return width <= box.width && height <= box.height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
