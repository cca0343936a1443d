package com.libragraph.imagio.core.image;

import com.libragraph.imagio.types.Dimensions;
import com.libragraph.imagio.types.EncodingFormat;
import com.libragraph.imagio.types.Variant;
import org.jboss.logging.Logger;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.color.ColorSpace;
import java.awt.geom.AffineTransform;
import java.awt.image.AffineTransformOp;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ImagingOpException;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Decodes an original, resizes it per {@link Variant} geometry and encodes the
 * result. The output encoding is chosen from the source color model: alpha or
 * more than 8 bits per channel gives PNG, anything else JPEG.
 *
 * <p>Stateless and thread-safe; CPU-bound work only, no locks.
 */
public class ImageTransformer {

    private static final Logger log = Logger.getLogger(ImageTransformer.class);

    public static final float DEFAULT_JPEG_QUALITY = 0.9f;

    private final float jpegQuality;

    public ImageTransformer() {
        this(DEFAULT_JPEG_QUALITY);
    }

    public ImageTransformer(float jpegQuality) {
        if (jpegQuality <= 0f || jpegQuality > 1f) {
            throw new IllegalArgumentException("jpegQuality must be in (0, 1], got: " + jpegQuality);
        }
        this.jpegQuality = jpegQuality;
    }

    /**
     * Renders {@code variant} from the original bytes.
     *
     * @throws ImageDecodeException  if the source cannot be decoded or has no pixels
     * @throws IllegalStateException if asked to render {@link Variant#ORIGINAL}
     */
    public RenderedVariant transform(byte[] source, Variant variant) {
        if (variant.isOriginal()) {
            throw new IllegalStateException("original variant is served verbatim, not transformed");
        }
        BufferedImage image = decode(source);
        Dimensions sourceSize = Dimensions.of(image.getWidth(), image.getHeight());
        Dimensions target = variant.outputSize(sourceSize);
        EncodingFormat format = encodingFor(image.getColorModel());

        log.debugf("Rendering %s: %s -> %s as %s", variant, sourceSize, target, format);
        BufferedImage resized = resize(image, target, format);
        byte[] encoded = encode(resized, format);
        log.debugf("Rendered %s: %d bytes", variant, encoded.length);
        return new RenderedVariant(encoded, format, target);
    }

    BufferedImage decode(byte[] source) {
        if (source == null || source.length == 0) {
            throw new ImageDecodeException("Empty image data");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(source));
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException("Failed to decode image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageDecodeException("Unsupported or corrupt image format");
        }
        // checked before any geometry: Embed divides by the source width
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ImageDecodeException(
                    "Image has no pixels: " + image.getWidth() + "x" + image.getHeight());
        }
        return image;
    }

    static EncodingFormat encodingFor(ColorModel colorModel) {
        return EncodingFormat.forSource(colorModel.hasAlpha(), maxComponentBits(colorModel));
    }

    private static int maxComponentBits(ColorModel colorModel) {
        int maxBits = 0;
        for (int bits : colorModel.getComponentSize()) {
            maxBits = Math.max(maxBits, bits);
        }
        return maxBits;
    }

    private static BufferedImage resize(BufferedImage source, Dimensions target, EncodingFormat format) {
        if (maxComponentBits(source.getColorModel()) > 8) {
            return resizeDeep(source, target);
        }
        int type;
        if (format == EncodingFormat.PNG) {
            type = source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        } else if (isGray(source)) {
            type = BufferedImage.TYPE_BYTE_GRAY;
        } else {
            // JPEG has no alpha channel
            type = BufferedImage.TYPE_INT_RGB;
        }
        BufferedImage out = new BufferedImage(target.width(), target.height(), type);
        draw(source, out, target);
        return out;
    }

    /**
     * Resamples the raster directly so 16-bit samples keep their precision;
     * the output has the source's color model, band count and sample size.
     */
    private static BufferedImage resizeDeep(BufferedImage source, Dimensions target) {
        ColorModel cm = source.getColorModel();
        WritableRaster raster = cm.createCompatibleWritableRaster(target.width(), target.height());
        BufferedImage out = new BufferedImage(cm, raster, cm.isAlphaPremultiplied(), null);
        AffineTransform scale = AffineTransform.getScaleInstance(
                (double) target.width() / source.getWidth(),
                (double) target.height() / source.getHeight());
        try {
            new AffineTransformOp(scale, AffineTransformOp.TYPE_BILINEAR).filter(source.getRaster(), raster);
        } catch (ImagingOpException e) {
            log.debugf("Raster resample unsupported for %s, drawing instead: %s", cm, e.getMessage());
            draw(source, out, target);
        }
        return out;
    }

    private static void draw(BufferedImage source, BufferedImage out, Dimensions target) {
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.drawImage(source, 0, 0, target.width(), target.height(), null);
        } finally {
            g.dispose();
        }
    }

    private static boolean isGray(BufferedImage image) {
        return image.getColorModel().getColorSpace().getType() == ColorSpace.TYPE_GRAY;
    }

    private byte[] encode(BufferedImage image, EncodingFormat format) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (format == EncodingFormat.JPEG) {
                writeJpeg(image, baos);
            } else if (!ImageIO.write(image, format.formatName(), baos)) {
                throw new IllegalStateException("No ImageIO writer for " + format);
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode " + format + ": " + e.getMessage(), e);
        }
    }

    private void writeJpeg(BufferedImage image, ByteArrayOutputStream baos) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(EncodingFormat.JPEG.formatName());
        if (!writers.hasNext()) {
            throw new IllegalStateException("No JPEG ImageWriter available");
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            ImageWriteParam params = writer.getDefaultWriteParam();
            params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            params.setCompressionQuality(jpegQuality);
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), params);
        } finally {
            writer.dispose();
        }
    }
}
