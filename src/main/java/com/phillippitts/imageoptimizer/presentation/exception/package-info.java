/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.imageoptimizer.exception.ValidationException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.imageoptimizer.exception.SidecarNotFoundException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.imageoptimizer.exception.TransportException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.imageoptimizer.exception.PartialBatchException} → 502 Bad Gateway, with
 *       {@code partialResults}</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "SidecarException",
 *   "message": "Image optimization failed",
 *   "details": "Image sidecar failed; partial results included",
 *   "timestamp": "2025-10-17T15:42:32.529Z",
 *   "partialResults": [ ... ]
 * }
 * </pre>
 */
package com.phillippitts.imageoptimizer.presentation.exception;
