package com.libragraph.imagio.types;

/**
 * Output encodings a derivative can be written in.
 */
public enum EncodingFormat {
    PNG("png", "image/png"),
    JPEG("jpeg", "image/jpeg");

    private final String formatName;
    private final String mimeType;

    EncodingFormat(String formatName, String mimeType) {
        this.formatName = formatName;
        this.mimeType = mimeType;
    }

    /** ImageIO writer format name. */
    public String formatName() {
        return formatName;
    }

    public String mimeType() {
        return mimeType;
    }

    /**
     * Picks the encoding for every derivative of a source image.
     * Sources with alpha or more than 8 bits per channel stay lossless.
     *
     * @param hasAlpha         whether the source color model carries alpha
     * @param maxComponentBits widest color component of the source, in bits
     */
    public static EncodingFormat forSource(boolean hasAlpha, int maxComponentBits) {
        return hasAlpha || maxComponentBits > 8 ? PNG : JPEG;
    }
}
