package com.phillippitts.cipherseal.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of looking for a watermark.
 *
 * <p>Note: an empty watermark string is a valid detection (an empty payload was embedded).
 *
 * @param status    outcome of the detection
 * @param watermark extracted payload; non-null only when status is {@link DetectionStatus#DETECTED}
 */
public record DetectionResult(DetectionStatus status, String watermark) {

    public DetectionResult {
        Objects.requireNonNull(status, "status must not be null");
        if (status == DetectionStatus.DETECTED) {
            Objects.requireNonNull(watermark, "Detected watermark must not be null");
        } else if (watermark != null) {
            throw new IllegalArgumentException("Only a detected result carries a watermark");
        }
    }

    public static DetectionResult detected(String watermark) {
        return new DetectionResult(DetectionStatus.DETECTED, watermark);
    }

    public static DetectionResult notDetected() {
        return new DetectionResult(DetectionStatus.NOT_DETECTED, null);
    }

    public static DetectionResult sourceNotFound() {
        return new DetectionResult(DetectionStatus.SOURCE_NOT_FOUND, null);
    }

    public static DetectionResult fromOptional(Optional<String> watermark) {
        return watermark.map(DetectionResult::detected).orElseGet(DetectionResult::notDetected);
    }

    public boolean isDetected() {
        return status == DetectionStatus.DETECTED;
    }
}
