package com.phillippitts.cipherseal.exception;

/**
 * Thrown when no installed decoder or encoder can handle an image format,
 * i.e. the underlying image I/O capability for that input is unavailable.
 */
public class MissingDependencyException extends CipherSealException {

    private final String format;

    public MissingDependencyException(String format) {
        super("No image codec available for format: " + format);
        this.format = format;
    }

    public MissingDependencyException(String format, Throwable cause) {
        super("No image codec available for format: " + format, cause);
        this.format = format;
    }

    public String getFormat() {
        return format;
    }
}
