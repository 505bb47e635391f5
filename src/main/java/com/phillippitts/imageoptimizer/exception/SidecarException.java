package com.phillippitts.imageoptimizer.exception;

import com.phillippitts.imageoptimizer.domain.OptimizationResult;

import java.util.List;

/**
 * Thrown when the sidecar process cannot be started, exits non-zero, or is cancelled.
 * Use {@link SidecarExceptionBuilder} to attach exit code, timing and diagnostics.
 */
public class SidecarException extends PartialBatchException {

    /** Exit code used when the process never produced one. */
    public static final int NO_EXIT_CODE = -1;

    private final int exitCode;
    private final boolean cancelled;

    public SidecarException(String message) {
        this(message, NO_EXIT_CODE, false, List.of(), null);
    }

    public SidecarException(String message, Throwable cause) {
        this(message, NO_EXIT_CODE, false, List.of(), cause);
    }

    public SidecarException(String message, int exitCode, boolean cancelled,
                            List<OptimizationResult> partialResults, Throwable cause) {
        super(message, partialResults, cause);
        this.exitCode = exitCode;
        this.cancelled = cancelled;
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public SidecarException withPartialResults(List<OptimizationResult> results) {
        SidecarException copy = new SidecarException(getMessage(), exitCode, cancelled, results, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
