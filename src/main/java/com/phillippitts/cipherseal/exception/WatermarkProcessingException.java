package com.phillippitts.cipherseal.exception;

/**
 * Thrown when a watermark operation fails for an unexpected reason (I/O fault, write failure,
 * corrupt input). Always carries the underlying cause when there is one.
 */
public class WatermarkProcessingException extends CipherSealException {

    private final String operation;

    public WatermarkProcessingException(String message) {
        super(message);
        this.operation = "unknown";
    }

    public WatermarkProcessingException(String message, String operation) {
        super(message + " (operation: " + operation + ")");
        this.operation = operation;
    }

    public WatermarkProcessingException(String message, Throwable cause) {
        super(message, cause);
        this.operation = "unknown";
    }

    public WatermarkProcessingException(String message, String operation, Throwable cause) {
        super(message + " (operation: " + operation + ")", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
