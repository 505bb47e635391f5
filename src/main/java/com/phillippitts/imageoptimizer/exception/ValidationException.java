package com.phillippitts.imageoptimizer.exception;

/**
 * Thrown when a task is rejected before any transport or process work happens
 * (missing input, unsupported extension, out-of-range settings).
 */
public class ValidationException extends ImageOptimizerException {

    private final String path;
    private final String reason;

    public ValidationException(String reason) {
        super("Invalid task: " + reason);
        this.path = null;
        this.reason = reason;
    }

    public ValidationException(String path, String reason) {
        super("Invalid task (" + path + "): " + reason);
        this.path = path;
        this.reason = reason;
    }

    /**
     * Offending path, or null when the failure is not tied to a path.
     */
    public String getPath() {
        return path;
    }

    public String getReason() {
        return reason;
    }
}
