/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /} - liveness message, degraded when the secret key is missing</li>
 *   <li>{@code POST /watermark/image/add}, {@code /detect}, {@code /capacity} - keyed LSB image watermarking</li>
 *   <li>{@code POST /watermark/text/add}, {@code /detect} - keyed zero-width text watermarking</li>
 * </ul>
 *
 * <p>Controllers check the key and the upload, spool it to a temporary file, delegate to the
 * service layer and always remove the temporary files. Failures are left to
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.cipherseal.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.cipherseal.presentation.controller;
