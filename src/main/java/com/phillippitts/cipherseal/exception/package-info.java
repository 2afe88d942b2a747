/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.cipherseal.exception.CipherSealException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.cipherseal.exception.ServiceNotConfiguredException} - Thrown when
 *       the master secret key is missing</li>
 *   <li>{@link com.phillippitts.cipherseal.exception.MissingDependencyException} - Thrown when no
 *       image codec can read or write the requested format</li>
 *   <li>{@link com.phillippitts.cipherseal.exception.InvalidWatermarkRequestException} - Thrown when
 *       request input is unusable (empty or oversized upload, bad length hint)</li>
 *   <li>{@link com.phillippitts.cipherseal.exception.WatermarkProcessingException} - Thrown for
 *       unexpected I/O or processing faults, always with context</li>
 * </ul>
 *
 * <p>Insufficient capacity and "no watermark found" are not exceptions: they are expected
 * outcomes reported through {@link com.phillippitts.cipherseal.domain.EmbedResult} and
 * {@link com.phillippitts.cipherseal.domain.DetectionResult}.
 *
 * @see com.phillippitts.cipherseal.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.cipherseal.exception;
