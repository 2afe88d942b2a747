package com.phillippitts.cipherseal.presentation.controller;

import com.phillippitts.cipherseal.config.properties.WatermarkProperties;
import com.phillippitts.cipherseal.domain.CapacityReport;
import com.phillippitts.cipherseal.domain.DetectionResult;
import com.phillippitts.cipherseal.domain.EmbedResult;
import com.phillippitts.cipherseal.domain.WatermarkKey;
import com.phillippitts.cipherseal.exception.InvalidWatermarkRequestException;
import com.phillippitts.cipherseal.exception.WatermarkProcessingExceptionBuilder;
import com.phillippitts.cipherseal.service.WatermarkKeyProvider;
import com.phillippitts.cipherseal.service.files.TemporaryFileManager;
import com.phillippitts.cipherseal.service.image.ImageWatermarkService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * REST endpoints for keyed LSB image watermarking.
 */
@RestController
@RequestMapping("/watermark/image")
class ImageWatermarkController {

    private static final Logger LOG = LogManager.getLogger(ImageWatermarkController.class);

    static final String WARNING_HEADER = "X-Watermark-Warning";
    private static final String DEFAULT_EXTENSION = "png";
    private static final String DEFAULT_NAME = "image.png";

    private final ImageWatermarkService service;
    private final WatermarkKeyProvider keys;
    private final TemporaryFileManager files;
    private final WatermarkProperties properties;

    ImageWatermarkController(ImageWatermarkService service, WatermarkKeyProvider keys,
                             TemporaryFileManager files, WatermarkProperties properties) {
        this.service = service;
        this.keys = keys;
        this.files = files;
        this.properties = properties;
    }

    /**
     * Adds a watermark to an uploaded image and returns the watermarked image.
     * Without {@code watermark_text} a UUID is embedded.
     */
    @PostMapping(value = "/add", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<?> add(@RequestParam("file") MultipartFile file,
                          @RequestParam(value = "watermark_text", required = false) String watermarkText) {
        WatermarkKey key = keys.requireKey();
        Uploads.requireUsable(file, properties.getUpload().getMaxFileSizeBytes());
        String name = Uploads.displayName(file, DEFAULT_NAME);
        LOG.info("op=add_image_watermark filename='{}' - Processing started.", name);

        Path input = null;
        Path output = null;
        try {
            input = Uploads.spool(files, file, DEFAULT_EXTENSION);
            output = files.createOutput(file.getOriginalFilename(), DEFAULT_EXTENSION);

            EmbedResult result = service.addWatermark(input, output, watermarkText, key);
            switch (result.status()) {
                case EMBEDDED:
                    byte[] body = Files.readAllBytes(output);
                    LOG.info("op=add_image_watermark filename='{}' - Success, returning {} bytes.", name, body.length);
                    ResponseEntity.BodyBuilder ok = ResponseEntity.ok()
                            .contentType(contentTypeOf(result.format()))
                            .header(HttpHeaders.CONTENT_DISPOSITION,
                                    Uploads.attachment(file, DEFAULT_NAME, result.format()).toString());
                    if (!result.warnings().isEmpty()) {
                        ok.header(WARNING_HEADER, String.join("; ", result.warnings()));
                    }
                    return ok.body(body);
                case INSUFFICIENT_CAPACITY:
                    CapacityReport capacity = result.capacity();
                    LOG.warn("op=add_image_watermark filename='{}' - Watermark does not fit.", name);
                    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of(
                            "errorCode", "InsufficientCapacity",
                            "message", "Watermark too large for this image",
                            "details", "Required " + capacity.requiredBits() + " bits, available "
                                    + capacity.capacityBits() + " bits",
                            "timestamp", Instant.now().toString()));
                default:
                    throw WatermarkProcessingExceptionBuilder.create("Uploaded image disappeared before processing")
                            .operation("add_image_watermark")
                            .build();
            }
        } catch (IOException e) {
            throw WatermarkProcessingExceptionBuilder.create("Failed to read watermarked image")
                    .operation("add_image_watermark")
                    .cause(e)
                    .build();
        } finally {
            files.delete(input, output);
        }
    }

    /**
     * Detects a watermark in an uploaded image.
     */
    @PostMapping(value = "/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<Map<String, Object>> detect(@RequestParam("file") MultipartFile file,
                                               @RequestParam(value = "max_len", required = false) Integer maxLen) {
        WatermarkKey key = keys.requireKey();
        Uploads.requireUsable(file, properties.getUpload().getMaxFileSizeBytes());
        int expectedMaxLen = maxLen == null ? properties.getDefaultMaxLength() : maxLen;
        if (expectedMaxLen <= 0) {
            throw new InvalidWatermarkRequestException("max_len must be positive, got: " + expectedMaxLen);
        }
        String name = Uploads.displayName(file, DEFAULT_NAME);
        LOG.info("op=detect_image_watermark filename='{}' - Processing started.", name);

        Path input = null;
        try {
            input = Uploads.spool(files, file, DEFAULT_EXTENSION);
            DetectionResult result = service.detectWatermark(input, key, expectedMaxLen);
            return ResponseEntity.ok(DetectionResponses.of(result, name, "detect_image_watermark"));
        } finally {
            files.delete(input);
        }
    }

    /**
     * Reports whether a watermark fits into an uploaded image, without embedding it.
     */
    @PostMapping(value = "/capacity", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<CapacityResponse> capacity(@RequestParam("file") MultipartFile file,
                                              @RequestParam(value = "watermark_text", required = false) String watermarkText) {
        keys.requireKey();
        Uploads.requireUsable(file, properties.getUpload().getMaxFileSizeBytes());

        Path input = null;
        try {
            input = Uploads.spool(files, file, DEFAULT_EXTENSION);
            CapacityReport report = service.checkCapacity(input, watermarkText)
                    .orElseThrow(() -> WatermarkProcessingExceptionBuilder
                            .create("Uploaded image disappeared before processing")
                            .operation("check_image_capacity")
                            .build());
            return ResponseEntity.ok(CapacityResponse.of(report));
        } finally {
            files.delete(input);
        }
    }

    private static MediaType contentTypeOf(String format) {
        return MediaTypeFactory.getMediaType("watermarked." + format)
                .filter(type -> "image".equals(type.getType()))
                .orElse(MediaType.IMAGE_PNG);
    }

    /**
     * Capacity figures returned by the capacity endpoint.
     */
    record CapacityResponse(int width, int height, long capacityBits, long requiredBits, boolean fits) {

        static CapacityResponse of(CapacityReport report) {
            return new CapacityResponse(report.width(), report.height(), report.capacityBits(),
                    report.requiredBits(), report.fits());
        }
    }
}
