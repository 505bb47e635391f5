package com.phillippitts.imageoptimizer.exception;

import com.phillippitts.imageoptimizer.domain.OptimizationResult;

import java.util.List;

/**
 * Thrown when the sidecar's framed result payload is malformed or missing altogether.
 */
public class ProtocolException extends PartialBatchException {

    public ProtocolException(String message) {
        super(message, List.of(), null);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, List.of(), cause);
    }

    public ProtocolException(String message, List<OptimizationResult> partialResults, Throwable cause) {
        super(message, partialResults, cause);
    }

    @Override
    public ProtocolException withPartialResults(List<OptimizationResult> results) {
        ProtocolException copy = new ProtocolException(getMessage(), results, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
