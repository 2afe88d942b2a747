package com.phillippitts.cipherseal.service.text;

import com.phillippitts.cipherseal.domain.DetectionResult;
import com.phillippitts.cipherseal.domain.EmbedResult;
import com.phillippitts.cipherseal.domain.MediaType;
import com.phillippitts.cipherseal.domain.WatermarkKey;
import com.phillippitts.cipherseal.exception.InvalidWatermarkRequestException;
import com.phillippitts.cipherseal.exception.WatermarkProcessingExceptionBuilder;
import com.phillippitts.cipherseal.service.WatermarkIdGenerator;
import com.phillippitts.cipherseal.service.metrics.WatermarkMetrics;
import com.phillippitts.cipherseal.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * File-level text watermarking on UTF-8 text files, delegating to a {@link TextWatermarker}.
 */
@Service
public class TextWatermarkService {

    private static final Logger LOG = LogManager.getLogger(TextWatermarkService.class);

    private final TextWatermarker watermarker;
    private final WatermarkMetrics metrics;

    public TextWatermarkService(TextWatermarker watermarker, WatermarkMetrics metrics) {
        this.watermarker = Objects.requireNonNull(watermarker, "watermarker");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Embeds a watermark into a UTF-8 text file.
     *
     * @param input         source text file
     * @param output        destination file
     * @param watermarkText text to embed; a UUID is generated when null or blank
     * @param key           secret key
     * @return EMBEDDED or SOURCE_NOT_FOUND
     * @throws InvalidWatermarkRequestException if the input is not valid UTF-8
     */
    public EmbedResult addWatermark(Path input, Path output, String watermarkText, WatermarkKey key) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(key, "key");
        String watermark = WatermarkIdGenerator.orGenerate(watermarkText);
        long start = System.nanoTime();

        try {
            if (!Files.isRegularFile(input)) {
                LOG.error("Input text file not found at {}", input);
                metrics.incrementOutcome(MediaType.TEXT, "embed", "source_not_found");
                return EmbedResult.sourceNotFound(watermark);
            }

            String original = read(input, "add_text_watermark");
            LOG.debug("Embedding watermark '{}' into {} chars of text", LogSanitizer.preview(watermark),
                    original.length());
            write(watermarker.embed(original, watermark, key), output);

            metrics.incrementOutcome(MediaType.TEXT, "embed", "embedded");
            LOG.info("Text watermark embedded: payloadChars={}", watermark.length());
            return EmbedResult.embedded(watermark, output, "txt", null, List.of());
        } catch (RuntimeException e) {
            metrics.incrementFailure(MediaType.TEXT, "embed", e.getClass().getSimpleName());
            throw e;
        } finally {
            metrics.recordLatency(MediaType.TEXT, "embed", System.nanoTime() - start);
        }
    }

    /**
     * Looks for a watermark in a UTF-8 text file.
     *
     * @param input text file to inspect
     * @param key   secret key used at embed time
     * @return DETECTED, NOT_DETECTED or SOURCE_NOT_FOUND
     */
    public DetectionResult detectWatermark(Path input, WatermarkKey key) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(key, "key");
        long start = System.nanoTime();

        try {
            if (!Files.isRegularFile(input)) {
                LOG.error("Input text file not found at {}", input);
                metrics.incrementOutcome(MediaType.TEXT, "detect", "source_not_found");
                return DetectionResult.sourceNotFound();
            }

            DetectionResult result = DetectionResult.fromOptional(
                    watermarker.extract(read(input, "detect_text_watermark"), key));
            metrics.incrementOutcome(MediaType.TEXT, "detect", result.status().name().toLowerCase(Locale.ROOT));
            LOG.info("Text watermark detection finished: status={}", result.status());
            return result;
        } catch (RuntimeException e) {
            metrics.incrementFailure(MediaType.TEXT, "detect", e.getClass().getSimpleName());
            throw e;
        } finally {
            metrics.recordLatency(MediaType.TEXT, "detect", System.nanoTime() - start);
        }
    }

    private static String read(Path input, String operation) {
        try {
            return Files.readString(input, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new InvalidWatermarkRequestException("input is not valid UTF-8 text", e);
        } catch (IOException e) {
            throw WatermarkProcessingExceptionBuilder.create("Failed to read text file")
                    .operation(operation)
                    .cause(e)
                    .metadata("file", input.getFileName())
                    .build();
        }
    }

    private static void write(String text, Path output) {
        Path target = output.toAbsolutePath();
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), ".cipherseal-", ".txt");
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
        } catch (IOException e) {
            throw WatermarkProcessingExceptionBuilder.create("Failed to write watermarked text")
                    .operation("add_text_watermark")
                    .cause(e)
                    .metadata("file", target.getFileName())
                    .build();
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    LOG.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }
}
