package com.libragraph.imagio.core.image;

import com.libragraph.imagio.types.Dimensions;
import com.libragraph.imagio.types.EncodingFormat;

/**
 * Encoded output of one transform.
 */
public record RenderedVariant(byte[] data, EncodingFormat format, Dimensions size) {}
