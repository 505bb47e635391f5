package com.phillippitts.imageoptimizer.exception;

/**
 * Base exception for all image-optimizer application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ImageOptimizerException extends RuntimeException {

    public ImageOptimizerException(String message) {
        super(message);
    }

    public ImageOptimizerException(String message, Throwable cause) {
        super(message, cause);
    }

    public ImageOptimizerException(Throwable cause) {
        super(cause);
    }
}
