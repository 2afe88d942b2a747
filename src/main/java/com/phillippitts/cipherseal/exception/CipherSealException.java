package com.phillippitts.cipherseal.exception;

/**
 * Base exception for all CipherSeal application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CipherSealException extends RuntimeException {

    public CipherSealException(String message) {
        super(message);
    }

    public CipherSealException(String message, Throwable cause) {
        super(message, cause);
    }

    public CipherSealException(Throwable cause) {
        super(cause);
    }
}
