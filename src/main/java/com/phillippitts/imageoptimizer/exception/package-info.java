/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.imageoptimizer.exception.ImageOptimizerException} - base for all
 *       application errors</li>
 *   <li>{@link com.phillippitts.imageoptimizer.exception.ValidationException} - a task was rejected
 *       before any work started</li>
 *   <li>{@link com.phillippitts.imageoptimizer.exception.SidecarNotFoundException} - the configured
 *       sidecar binary is missing or not executable (startup)</li>
 *   <li>{@link com.phillippitts.imageoptimizer.exception.TransportException} - the batch file could
 *       not be prepared; no process was launched</li>
 *   <li>{@link com.phillippitts.imageoptimizer.exception.PartialBatchException} - a started batch
 *       failed; carries the results received so far
 *     <ul>
 *       <li>{@link com.phillippitts.imageoptimizer.exception.SidecarException} - spawn failure,
 *           non-zero exit or cancellation</li>
 *       <li>{@link com.phillippitts.imageoptimizer.exception.ProtocolException} - malformed or
 *           missing result payload</li>
 *     </ul>
 *   </li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via
 * {@code GlobalExceptionHandler}. Failures while cleaning up temporary files are logged, not thrown.
 */
package com.phillippitts.imageoptimizer.exception;
