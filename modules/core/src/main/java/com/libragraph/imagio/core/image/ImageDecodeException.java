package com.libragraph.imagio.core.image;

/**
 * Malformed, empty or unsupported image bytes.
 */
public class ImageDecodeException extends RuntimeException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
