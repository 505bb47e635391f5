package com.phillippitts.imageoptimizer.exception;

import com.phillippitts.imageoptimizer.domain.OptimizationResult;

import java.util.List;

/**
 * Failure of a batch that had already started, carrying the per-task results parsed before the
 * failure so callers can keep completed work.
 */
public abstract class PartialBatchException extends ImageOptimizerException {

    private final List<OptimizationResult> partialResults;

    protected PartialBatchException(String message, List<OptimizationResult> partialResults, Throwable cause) {
        super(message, cause);
        this.partialResults = partialResults == null ? List.of() : List.copyOf(partialResults);
    }

    /**
     * Results received before the failure, in task order. Never null.
     */
    public List<OptimizationResult> getPartialResults() {
        return partialResults;
    }

    /**
     * Returns an equivalent exception whose partial results are replaced by {@code results}.
     * Used when earlier chunks of a multi-chunk call have to be folded in.
     */
    public abstract PartialBatchException withPartialResults(List<OptimizationResult> results);
}
