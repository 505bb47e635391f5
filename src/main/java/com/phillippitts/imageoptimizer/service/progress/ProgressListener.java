package com.phillippitts.imageoptimizer.service.progress;

import com.phillippitts.imageoptimizer.domain.BatchProgressEvent;
import com.phillippitts.imageoptimizer.domain.ProgressEvent;

/**
 * Receives progress while an optimization call runs.
 *
 * <p>{@link #onProgress(ProgressEvent)} is called synchronously on the thread reading sidecar
 * output, in the order the sidecar printed the underlying lines, so implementations should
 * return quickly.
 */
public interface ProgressListener {

    /** Listener that ignores everything. */
    ProgressListener NOOP = event -> {
    };

    void onProgress(ProgressEvent event);

    /**
     * Called after each chunk of a multi-chunk call and once more when the call completes.
     */
    default void onBatchProgress(BatchProgressEvent event) {
    }
}
