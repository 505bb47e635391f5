package com.phillippitts.imageoptimizer.presentation.exception;

import com.phillippitts.imageoptimizer.domain.OptimizationResult;
import com.phillippitts.imageoptimizer.exception.PartialBatchException;
import com.phillippitts.imageoptimizer.exception.SidecarException;
import com.phillippitts.imageoptimizer.exception.SidecarNotFoundException;
import com.phillippitts.imageoptimizer.exception.TransportException;
import com.phillippitts.imageoptimizer.exception.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.List;

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
     * Client error - a task was rejected before any work started (HTTP 400).
     */
    @ExceptionHandler(ValidationException.class)
    ResponseEntity<ApiError> handleValidation(ValidationException ex) {
        LOG.warn("Invalid task: path={}, reason={}", ex.getPath(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(ApiError.of(ex.getClass().getSimpleName(), "Invalid optimization request", ex.getMessage()));
    }

    /**
     * Client error - body is not a JSON array of tasks (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(ApiError.of("InvalidRequestBody", "Invalid optimization request",
                "Request body must be a JSON array of tasks"));
    }

    /**
     * Setup error - sidecar binary missing (HTTP 503).
     */
    @ExceptionHandler(SidecarNotFoundException.class)
    ResponseEntity<ApiError> handleSidecarNotFound(SidecarNotFoundException ex) {
        LOG.error("Sidecar binary unavailable at path: {}", ex.getBinaryPath());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(ApiError.of(ex.getClass().getSimpleName(), "Image optimization unavailable",
                "Sidecar not installed. Contact administrator."));
    }

    /**
     * Transient error - batch file could not be prepared, nothing was started (HTTP 503).
     */
    @ExceptionHandler(TransportException.class)
    ResponseEntity<ApiError> handleTransport(TransportException ex) {
        LOG.error("Batch transport failed: file={}", ex.getFilePath(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(ApiError.of(ex.getClass().getSimpleName(), "Image optimization temporarily unavailable",
                "Please retry in a few seconds"));
    }

    /**
     * Sidecar or protocol failure after work started (HTTP 502). The body carries the results
     * that completed before the failure so clients do not redo them.
     */
    @ExceptionHandler(PartialBatchException.class)
    ResponseEntity<ApiError> handlePartialBatch(PartialBatchException ex) {
        boolean cancelled = ex instanceof SidecarException se && se.isCancelled();
        LOG.error("Batch failed: type={}, cancelled={}, partialResults={}",
            ex.getClass().getSimpleName(), cancelled, ex.getPartialResults().size(), ex);
        String details = cancelled
            ? "Request cancelled before all images were processed"
            : "Image sidecar failed; partial results included";
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(ex.getClass().getSimpleName(), "Image optimization failed", details,
                Instant.now(), ex.getPartialResults()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiError.of("InternalServerError", "An unexpected error occurred",
                "Please contact support with request ID"));
    }

    /**
     * Standardized error response for API clients.
     *
     * @param partialResults results completed before a batch failure; empty for other errors
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp,
        List<OptimizationResult> partialResults
    ) {
        static ApiError of(String errorCode, String message, String details) {
            return new ApiError(errorCode, message, details, Instant.now(), List.of());
        }
    }
}
