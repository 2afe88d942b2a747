package com.phillippitts.cipherseal.presentation.exception;

import com.phillippitts.cipherseal.exception.InvalidWatermarkRequestException;
import com.phillippitts.cipherseal.exception.MissingDependencyException;
import com.phillippitts.cipherseal.exception.ServiceNotConfiguredException;
import com.phillippitts.cipherseal.exception.WatermarkProcessingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Missing secret key - the service refuses to run (HTTP 503).
     */
    @ExceptionHandler(ServiceNotConfiguredException.class)
    ResponseEntity<ApiError> handleNotConfigured(ServiceNotConfiguredException ex) {
        LOG.error("Watermark service not configured: missing {}", ex.getSetting());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Watermarking service unavailable",
                "Server is not configured for watermarking. Contact administrator.",
                Instant.now()
            ));
    }

    /**
     * No codec for the uploaded format (HTTP 415).
     */
    @ExceptionHandler(MissingDependencyException.class)
    ResponseEntity<ApiError> handleMissingDependency(MissingDependencyException ex) {
        LOG.warn("No image codec available: format={}", ex.getFormat());
        return ResponseEntity
            .status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Unsupported file format",
                "No codec available for format: " + ex.getFormat(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidWatermarkRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidWatermarkRequestException ex) {
        LOG.warn("Invalid watermark request: reason={}", ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Malformed multipart request (HTTP 400).
     */
    @ExceptionHandler({
        MissingServletRequestPartException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Upload above the multipart limit (HTTP 413).
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload rejected: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Uploaded file too large",
                "Maximum upload size: " + ex.getMaxUploadSize() + " bytes",
                Instant.now()
            ));
    }

    /**
     * Unexpected failure while processing a watermark (HTTP 500).
     */
    @ExceptionHandler(WatermarkProcessingException.class)
    ResponseEntity<ApiError> handleProcessingFailure(WatermarkProcessingException ex) {
        LOG.error("Watermark processing failed: operation={}", ex.getOperation(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Failed to process watermark request",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500). Spring MVC exceptions keep their own status.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            LOG.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
            return ResponseEntity
                .status(status)
                .body(new ApiError(
                    ex.getClass().getSimpleName(),
                    "Request could not be handled",
                    ex.getMessage(),
                    Instant.now()
                ));
        }
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
