package com.phillippitts.cipherseal.domain;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result of embedding a watermark into a file.
 *
 * @param status    outcome of the operation
 * @param watermark the payload that was (or would have been) embedded
 * @param output    output file; null unless status is {@link EmbedStatus#EMBEDDED}
 * @param format    format actually written (e.g. "png", "txt"); null unless embedded
 * @param capacity  capacity check for image carriers; null for text carriers or missing sources
 * @param warnings  non-fatal warnings (e.g., lossy output format); never null
 */
public record EmbedResult(
        EmbedStatus status,
        String watermark,
        Path output,
        String format,
        CapacityReport capacity,
        List<String> warnings
) {

    public EmbedResult {
        Objects.requireNonNull(status, "status must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static EmbedResult embedded(String watermark, Path output, String format,
                                       CapacityReport capacity, List<String> warnings) {
        return new EmbedResult(EmbedStatus.EMBEDDED, watermark, output, format, capacity, warnings);
    }

    public static EmbedResult insufficientCapacity(String watermark, CapacityReport capacity) {
        return new EmbedResult(EmbedStatus.INSUFFICIENT_CAPACITY, watermark, null, null, capacity, List.of());
    }

    public static EmbedResult sourceNotFound(String watermark) {
        return new EmbedResult(EmbedStatus.SOURCE_NOT_FOUND, watermark, null, null, null, List.of());
    }

    public boolean isEmbedded() {
        return status == EmbedStatus.EMBEDDED;
    }
}
