package com.phillippitts.cipherseal.service.image;

import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import java.awt.image.RenderedImage;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * File-extension based format decisions for image input and output.
 */
public final class ImageFormats {

    /** Format used when the output path has no writable extension. */
    public static final String DEFAULT_FORMAT = "png";

    /** Formats whose compression discards low-order bits; LSB payloads do not survive them. */
    private static final Set<String> LOSSY_FORMATS = Set.of("jpg", "jpeg", "jfif", "jpe");

    /** Indexed or bilevel formats: writing 24-bit pixels to them re-quantizes every channel. */
    private static final Set<String> PALETTE_FORMATS = Set.of("gif", "wbmp");

    private ImageFormats() {}

    /** Lowercase extension of the file name without the dot, if any. */
    public static Optional<String> extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        return extensionOf(path.getFileName().toString());
    }

    /** Lowercase extension of a file name without the dot, if any. */
    public static Optional<String> extensionOf(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    public static boolean isLossy(String format) {
        return format != null && LOSSY_FORMATS.contains(format.toLowerCase(Locale.ROOT));
    }

    /** True when an installed ImageIO writer handles this format name. */
    public static boolean canWrite(String format) {
        return format != null && ImageIO.getImageWritersByFormatName(format).hasNext();
    }

    /** True when an installed ImageIO reader handles this format name. */
    public static boolean canRead(String format) {
        return format != null && ImageIO.getImageReadersByFormatName(format).hasNext();
    }

    /** True for formats that cannot store 24-bit RGB pixels unchanged. */
    public static boolean isPalette(String format) {
        return format != null && PALETTE_FORMATS.contains(format.toLowerCase(Locale.ROOT));
    }

    /** True when an installed ImageIO writer for this format name can encode {@code image} as it is. */
    public static boolean canWrite(String format, RenderedImage image) {
        return format != null
                && ImageIO.getImageWriters(ImageTypeSpecifier.createFromRenderedImage(image), format).hasNext();
    }

    /**
     * Output format for writing {@code image} to {@code output}: the path's extension when a writer
     * can encode the image without re-quantizing its channels, else {@link #DEFAULT_FORMAT}.
     */
    public static String outputFormatFor(Path output, RenderedImage image) {
        return extensionOf(output)
                .filter(ext -> !isPalette(ext))
                .filter(ext -> canWrite(ext, image))
                .orElse(DEFAULT_FORMAT);
    }
}
