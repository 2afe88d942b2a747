package com.phillippitts.cipherseal.service.image;

import com.phillippitts.cipherseal.domain.CapacityReport;
import com.phillippitts.cipherseal.domain.DetectionResult;
import com.phillippitts.cipherseal.domain.EmbedResult;
import com.phillippitts.cipherseal.domain.MediaType;
import com.phillippitts.cipherseal.domain.RgbImageBuffer;
import com.phillippitts.cipherseal.domain.WatermarkKey;
import com.phillippitts.cipherseal.exception.MissingDependencyException;
import com.phillippitts.cipherseal.exception.WatermarkProcessingExceptionBuilder;
import com.phillippitts.cipherseal.service.WatermarkIdGenerator;
import com.phillippitts.cipherseal.service.codec.EncodeResult;
import com.phillippitts.cipherseal.service.codec.LsbBitCodec;
import com.phillippitts.cipherseal.service.metrics.WatermarkMetrics;
import com.phillippitts.cipherseal.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * File-level image watermarking: decodes the carrier, runs the keyed LSB codec, re-encodes the result.
 *
 * <p>Expected outcomes (missing source, insufficient capacity, no watermark) come back as typed results.
 * Undecodable formats raise {@link MissingDependencyException}; I/O faults raise
 * {@link com.phillippitts.cipherseal.exception.WatermarkProcessingException}.
 */
@Service
public class ImageWatermarkService {

    private static final Logger LOG = LogManager.getLogger(ImageWatermarkService.class);

    static final String LOSSY_WARNING = "Saving watermarked image to lossy format '%s'. "
            + "LSB data is unlikely to be reliably retrieved.";

    static final String FALLBACK_WARNING = "Format '%s' cannot hold the watermark losslessly. "
            + "The image was written as '%s' instead.";

    private final LsbBitCodec codec;
    private final WatermarkMetrics metrics;

    public ImageWatermarkService(LsbBitCodec codec, WatermarkMetrics metrics) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Embeds a watermark into an image file and writes the result.
     *
     * @param input         source image
     * @param output        destination; its extension selects the format, PNG when that format
     *                      cannot hold the watermark or has no writer
     * @param watermarkText text to embed; a UUID is generated when null or blank
     * @param key           secret key
     * @return typed outcome; on anything but EMBEDDED no output file is written
     */
    public EmbedResult addWatermark(Path input, Path output, String watermarkText, WatermarkKey key) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(key, "key");
        String watermark = WatermarkIdGenerator.orGenerate(watermarkText);
        long start = System.nanoTime();

        try {
            if (!Files.isRegularFile(input)) {
                LOG.error("Input image file not found at {}", input);
                metrics.incrementOutcome(MediaType.IMAGE, "embed", "source_not_found");
                return EmbedResult.sourceNotFound(watermark);
            }

            RgbImageBuffer image = read(input, "add_image_watermark");
            LOG.debug("Embedding watermark '{}' into {}x{} image", LogSanitizer.preview(watermark),
                    image.width(), image.height());

            EncodeResult encoded = codec.encode(image, watermark, key);
            if (!encoded.isEmbedded()) {
                CapacityReport capacity = encoded.capacity();
                LOG.warn("Watermark too large for image: required={} bits, available={} bits",
                        capacity.requiredBits(), capacity.capacityBits());
                metrics.incrementOutcome(MediaType.IMAGE, "embed", "insufficient_capacity");
                return EmbedResult.insufficientCapacity(watermark, capacity);
            }

            List<String> warnings = new ArrayList<>();
            BufferedImage rendered = image.toBufferedImage();
            String format = ImageFormats.outputFormatFor(output, rendered);
            ImageFormats.extensionOf(output)
                    .filter(requested -> !requested.equals(format))
                    .ifPresent(requested -> {
                        String warning = String.format(FALLBACK_WARNING, requested, format);
                        LOG.warn(warning);
                        warnings.add(warning);
                    });
            if (ImageFormats.isLossy(format)) {
                String warning = String.format(LOSSY_WARNING, format);
                LOG.warn(warning);
                warnings.add(warning);
            }

            write(rendered, format, output);
            metrics.incrementOutcome(MediaType.IMAGE, "embed", "embedded");
            LOG.info("Watermark embedded: bits={}, capacity={}, format={}",
                    encoded.bitsWritten(), encoded.capacity().capacityBits(), format);
            return EmbedResult.embedded(watermark, output, format, encoded.capacity(), warnings);
        } catch (RuntimeException e) {
            metrics.incrementFailure(MediaType.IMAGE, "embed", e.getClass().getSimpleName());
            throw e;
        } finally {
            metrics.recordLatency(MediaType.IMAGE, "embed", System.nanoTime() - start);
        }
    }

    /**
     * Looks for a watermark in an image file.
     *
     * @param input               image to inspect
     * @param key                 secret key used at embed time
     * @param expectedMaxLenChars upper bound on the watermark length in characters
     * @return DETECTED with the payload (possibly empty), NOT_DETECTED or SOURCE_NOT_FOUND
     */
    public DetectionResult detectWatermark(Path input, WatermarkKey key, int expectedMaxLenChars) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(key, "key");
        if (expectedMaxLenChars <= 0) {
            throw new IllegalArgumentException("expectedMaxLenChars must be positive, got: " + expectedMaxLenChars);
        }
        long start = System.nanoTime();

        try {
            if (!Files.isRegularFile(input)) {
                LOG.error("Input image file not found at {}", input);
                metrics.incrementOutcome(MediaType.IMAGE, "detect", "source_not_found");
                return DetectionResult.sourceNotFound();
            }

            RgbImageBuffer image = read(input, "detect_image_watermark");
            DetectionResult result = DetectionResult.fromOptional(codec.decode(image, key, expectedMaxLenChars));
            metrics.incrementOutcome(MediaType.IMAGE, "detect", result.status().name().toLowerCase(Locale.ROOT));
            LOG.info("Image watermark detection finished: status={}, size={}x{}",
                    result.status(), image.width(), image.height());
            return result;
        } catch (RuntimeException e) {
            metrics.incrementFailure(MediaType.IMAGE, "detect", e.getClass().getSimpleName());
            throw e;
        } finally {
            metrics.recordLatency(MediaType.IMAGE, "detect", System.nanoTime() - start);
        }
    }

    /**
     * Reports whether a watermark would fit into an image, without modifying anything.
     *
     * @param input         image to inspect
     * @param watermarkText candidate watermark; a generated UUID is measured when blank
     * @return the report, or empty when the file does not exist
     */
    public Optional<CapacityReport> checkCapacity(Path input, String watermarkText) {
        Objects.requireNonNull(input, "input");
        if (!Files.isRegularFile(input)) {
            return Optional.empty();
        }
        RgbImageBuffer image = read(input, "check_image_capacity");
        String watermark = WatermarkIdGenerator.orGenerate(watermarkText);
        return Optional.of(codec.check(image.width(), image.height(), watermark));
    }

    private RgbImageBuffer read(Path input, String operation) {
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(input.toFile());
        } catch (IOException e) {
            throw WatermarkProcessingExceptionBuilder.create("Failed to decode image")
                    .operation(operation)
                    .cause(e)
                    .metadata("file", input.getFileName())
                    .build();
        }
        if (decoded == null) {
            throw new MissingDependencyException(ImageFormats.extensionOf(input).orElse("unknown"));
        }
        return RgbImageBuffer.fromBufferedImage(decoded);
    }

    private void write(BufferedImage image, String format, Path output) {
        Path target = output.toAbsolutePath();
        Path dir = target.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, ".cipherseal-", "." + format);
            if (!ImageIO.write(image, format, tmp.toFile())) {
                throw new MissingDependencyException(format);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
        } catch (IOException e) {
            throw WatermarkProcessingExceptionBuilder.create("Failed to write watermarked image")
                    .operation("add_image_watermark")
                    .cause(e)
                    .metadata("format", format)
                    .metadata("file", target.getFileName())
                    .build();
        } finally {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary file {}: {}", path, e.getMessage());
        }
    }
}
