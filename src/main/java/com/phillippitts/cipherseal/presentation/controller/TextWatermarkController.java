package com.phillippitts.cipherseal.presentation.controller;

import com.phillippitts.cipherseal.config.properties.WatermarkProperties;
import com.phillippitts.cipherseal.domain.DetectionResult;
import com.phillippitts.cipherseal.domain.EmbedResult;
import com.phillippitts.cipherseal.domain.WatermarkKey;
import com.phillippitts.cipherseal.exception.WatermarkProcessingExceptionBuilder;
import com.phillippitts.cipherseal.service.WatermarkKeyProvider;
import com.phillippitts.cipherseal.service.files.TemporaryFileManager;
import com.phillippitts.cipherseal.service.text.TextWatermarkService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * REST endpoints for keyed text watermarking of UTF-8 text files.
 */
@RestController
@RequestMapping("/watermark/text")
class TextWatermarkController {

    private static final Logger LOG = LogManager.getLogger(TextWatermarkController.class);

    private static final String DEFAULT_EXTENSION = "txt";
    private static final String DEFAULT_NAME = "document.txt";
    private static final MediaType TEXT_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final TextWatermarkService service;
    private final WatermarkKeyProvider keys;
    private final TemporaryFileManager files;
    private final WatermarkProperties properties;

    TextWatermarkController(TextWatermarkService service, WatermarkKeyProvider keys,
                            TemporaryFileManager files, WatermarkProperties properties) {
        this.service = service;
        this.keys = keys;
        this.files = files;
        this.properties = properties;
    }

    @PostMapping(value = "/add", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<byte[]> add(@RequestParam("file") MultipartFile file,
                               @RequestParam(value = "watermark_text", required = false) String watermarkText) {
        WatermarkKey key = keys.requireKey();
        Uploads.requireUsable(file, properties.getUpload().getMaxTextFileSizeBytes());
        String name = Uploads.displayName(file, DEFAULT_NAME);
        LOG.info("op=add_text_watermark filename='{}' - Processing started.", name);

        Path input = null;
        Path output = null;
        try {
            input = Uploads.spool(files, file, DEFAULT_EXTENSION);
            output = files.createOutput(file.getOriginalFilename(), DEFAULT_EXTENSION);

            EmbedResult result = service.addWatermark(input, output, watermarkText, key);
            if (!result.isEmbedded()) {
                throw WatermarkProcessingExceptionBuilder.create("Uploaded text disappeared before processing")
                        .operation("add_text_watermark")
                        .build();
            }
            byte[] body = Files.readAllBytes(output);
            LOG.info("op=add_text_watermark filename='{}' - Success, returning {} bytes.", name, body.length);
            return ResponseEntity.ok()
                    .contentType(TEXT_UTF8)
                    .header(HttpHeaders.CONTENT_DISPOSITION, Uploads.attachment(file, DEFAULT_NAME).toString())
                    .body(body);
        } catch (IOException e) {
            throw WatermarkProcessingExceptionBuilder.create("Failed to read watermarked text")
                    .operation("add_text_watermark")
                    .cause(e)
                    .build();
        } finally {
            files.delete(input, output);
        }
    }

    @PostMapping(value = "/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<Map<String, Object>> detect(@RequestParam("file") MultipartFile file) {
        WatermarkKey key = keys.requireKey();
        Uploads.requireUsable(file, properties.getUpload().getMaxTextFileSizeBytes());
        String name = Uploads.displayName(file, DEFAULT_NAME);
        LOG.info("op=detect_text_watermark filename='{}' - Processing started.", name);

        Path input = null;
        try {
            input = Uploads.spool(files, file, DEFAULT_EXTENSION);
            DetectionResult result = service.detectWatermark(input, key);
            return ResponseEntity.ok(DetectionResponses.of(result, name, "detect_text_watermark"));
        } finally {
            files.delete(input);
        }
    }
}
