package com.phillippitts.cipherseal.exception;

/**
 * Thrown when a watermark request carries unusable input: an empty or oversized upload,
 * a non-positive length hint, or a file that is not valid UTF-8 text.
 */
public class InvalidWatermarkRequestException extends CipherSealException {

    private final String reason;

    public InvalidWatermarkRequestException(String reason) {
        super("Invalid watermark request: " + reason);
        this.reason = reason;
    }

    public InvalidWatermarkRequestException(String reason, Throwable cause) {
        super("Invalid watermark request: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
