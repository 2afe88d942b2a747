package com.phillippitts.cipherseal.presentation.controller;

import com.phillippitts.cipherseal.domain.DetectionResult;
import com.phillippitts.cipherseal.exception.WatermarkProcessingExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * JSON bodies for detect endpoints:
 * {@code {"detected_watermark": "..."}} or {@code {"message": "No watermark detected."}}.
 */
final class DetectionResponses {

    private static final Logger LOG = LogManager.getLogger(DetectionResponses.class);

    static final String NOT_DETECTED_MESSAGE = "No watermark detected.";

    private DetectionResponses() {}

    static Map<String, Object> of(DetectionResult result, String fileName, String operation) {
        switch (result.status()) {
            case DETECTED:
                LOG.info("op={} filename='{}' - Watermark detected.", operation, fileName);
                return Map.of("detected_watermark", result.watermark());
            case NOT_DETECTED:
                LOG.info("op={} filename='{}' - No watermark detected.", operation, fileName);
                return Map.of("message", NOT_DETECTED_MESSAGE);
            default:
                throw WatermarkProcessingExceptionBuilder.create("Uploaded file disappeared before processing")
                        .operation(operation)
                        .build();
        }
    }
}
