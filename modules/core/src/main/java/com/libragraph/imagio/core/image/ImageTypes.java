package com.libragraph.imagio.core.image;

import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.detect.Detector;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.mime.MediaType;
import org.apache.tika.mime.MimeType;
import org.apache.tika.mime.MimeTypeException;
import org.apache.tika.mime.MimeTypes;

import javax.imageio.ImageIO;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Content sniffing and MIME-to-extension lookups backed by Tika's registry.
 */
public final class ImageTypes {

    static final String UNKNOWN_EXTENSION = "BIN";

    private static final Detector DETECTOR = new DefaultDetector();
    private static final MimeTypes REGISTRY = MimeTypes.getDefaultMimeTypes();

    private ImageTypes() {
    }

    /** Detects the media type of {@code data} from its magic bytes. */
    public static String detect(byte[] data) {
        try (InputStream stream = new ByteArrayInputStream(data)) {
            return DETECTOR.detect(stream, new Metadata()).getBaseType().toString();
        } catch (IOException e) {
            return MediaType.OCTET_STREAM.toString();
        }
    }

    /**
     * Detects the media type of an upload and checks that it is an image
     * ImageIO can decode.
     *
     * @throws ImageDecodeException if the payload is empty or not a supported image
     */
    public static String detectSupportedImage(byte[] data) {
        if (data == null || data.length == 0) {
            throw new ImageDecodeException("Empty image payload");
        }
        String mime = detect(data);
        if (!mime.startsWith("image/") || !ImageIO.getImageReadersByMIMEType(mime).hasNext()) {
            throw new ImageDecodeException("Unsupported image type: " + mime);
        }
        return mime;
    }

    /**
     * Primary extension registered for a MIME type, upper-cased and without the
     * dot: {@code image/jpeg -> JPG}. Unknown types map to {@code BIN}.
     */
    public static String extensionFor(String mime) {
        if (mime == null || mime.isBlank()) {
            return UNKNOWN_EXTENSION;
        }
        try {
            MimeType type = REGISTRY.forName(mime);
            String ext = type.getExtension();
            if (ext.isEmpty()) {
                return UNKNOWN_EXTENSION;
            }
            return ext.substring(1).toUpperCase(Locale.ROOT);
        } catch (MimeTypeException e) {
            return UNKNOWN_EXTENSION;
        }
    }
}
