package com.phillippitts.cipherseal.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing WatermarkProcessingException with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw WatermarkProcessingExceptionBuilder.create("Failed to write watermarked image")
 *         .operation("add_image_watermark")
 *         .cause(ioException)
 *         .metadata("format", "png")
 *         .build();
 * </pre>
 */
public final class WatermarkProcessingExceptionBuilder {

    private final String message;
    private String operation;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private WatermarkProcessingExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static WatermarkProcessingExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new WatermarkProcessingExceptionBuilder(message);
    }

    /**
     * Sets the failing operation (e.g., "add_image_watermark", "detect_text_watermark").
     *
     * @param operation operation name
     * @return this builder for chaining
     */
    public WatermarkProcessingExceptionBuilder operation(String operation) {
        this.operation = operation;
        return this;
    }

    /**
     * Sets the root cause of the exception.
     *
     * @param cause underlying exception
     * @return this builder for chaining
     */
    public WatermarkProcessingExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public WatermarkProcessingExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} ({key1}={val1}, ...) (operation: {operation})
     * </pre>
     *
     * @return constructed WatermarkProcessingException
     */
    public WatermarkProcessingException build() {
        String detailedMessage = buildDetailedMessage();
        String op = operation != null ? operation : "unknown";

        if (cause != null) {
            return new WatermarkProcessingException(detailedMessage, op, cause);
        } else {
            return new WatermarkProcessingException(detailedMessage, op);
        }
    }

    private String buildDetailedMessage() {
        if (metadata.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append(")");
        return sb.toString();
    }
}
