package com.phillippitts.cipherseal.presentation.controller;

import com.phillippitts.cipherseal.exception.InvalidWatermarkRequestException;
import com.phillippitts.cipherseal.exception.WatermarkProcessingExceptionBuilder;
import com.phillippitts.cipherseal.service.files.TemporaryFileManager;
import com.phillippitts.cipherseal.util.LogSanitizer;
import org.springframework.http.ContentDisposition;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Upload checks and spooling shared by the watermark controllers.
 */
final class Uploads {

    private Uploads() {}

    /**
     * Rejects empty or oversized uploads.
     *
     * @throws InvalidWatermarkRequestException when the upload is unusable
     */
    static void requireUsable(MultipartFile file, long maxBytes) {
        if (file == null || file.isEmpty()) {
            throw new InvalidWatermarkRequestException("uploaded file is empty");
        }
        if (file.getSize() > maxBytes) {
            throw new InvalidWatermarkRequestException("uploaded file too large: " + file.getSize()
                    + " bytes. Max: " + maxBytes + " bytes");
        }
    }

    /** Copies the upload to a temporary file. */
    static Path spool(TemporaryFileManager files, MultipartFile file, String defaultExtension) {
        try {
            return files.spool(file.getInputStream(), file.getOriginalFilename(), defaultExtension);
        } catch (IOException e) {
            throw WatermarkProcessingExceptionBuilder.create("Error reading uploaded file")
                    .operation("spool_upload")
                    .cause(e)
                    .build();
        }
    }

    /** Client file name safe for logs, or a placeholder. */
    static String displayName(MultipartFile file, String fallback) {
        String name = file.getOriginalFilename();
        return name == null || name.isBlank() ? fallback : LogSanitizer.singleLine(name);
    }

    /** {@code attachment; filename="watermarked_<name>"}. */
    static ContentDisposition attachment(MultipartFile file, String fallback) {
        return attachment(file, fallback, null);
    }

    /**
     * As {@link #attachment(MultipartFile, String)}, with the extension replaced by
     * {@code extension} when the name carries a different one.
     */
    static ContentDisposition attachment(MultipartFile file, String fallback, String extension) {
        String name = displayName(file, fallback);
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        String base = name.substring(slash + 1);
        if (extension != null) {
            int dot = base.lastIndexOf('.');
            String stem = dot > 0 ? base.substring(0, dot) : base;
            if (!base.substring(stem.length()).equalsIgnoreCase("." + extension)) {
                base = stem + "." + extension;
            }
        }
        String filename = "watermarked_" + base;
        ContentDisposition.Builder builder = ContentDisposition.attachment();
        if (StandardCharsets.US_ASCII.newEncoder().canEncode(filename)) {
            builder.filename(filename);
        } else {
            builder.filename(filename, StandardCharsets.UTF_8);
        }
        return builder.build();
    }
}
