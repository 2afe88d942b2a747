/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.cipherseal.exception.InvalidWatermarkRequestException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.cipherseal.exception.MissingDependencyException} → 415 Unsupported Media Type</li>
 *   <li>{@link com.phillippitts.cipherseal.exception.ServiceNotConfiguredException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.cipherseal.exception.WatermarkProcessingException} → 500 Internal Server Error</li>
 *   <li>{@code Exception} (catch-all) → 500, or the status a Spring MVC exception carries</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidWatermarkRequestException",
 *   "message": "Invalid request",
 *   "details": "Invalid watermark request: uploaded file is empty",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>Responses never carry stack traces, server file paths or key material.
 */
package com.phillippitts.cipherseal.presentation.exception;
