package com.phillippitts.imageoptimizer.service.metrics;

import com.phillippitts.imageoptimizer.domain.OptimizationResult;

/**
 * Capability interface for pipeline metrics. The implementation is chosen once at startup;
 * {@link #NOOP} is used when metrics are disabled and in tests.
 */
public interface BatchMetricsSink {

    BatchMetricsSink NOOP = new BatchMetricsSink() {
        @Override
        public void recordBatch(int taskCount, long durationNanos) {
        }

        @Override
        public void recordResult(OptimizationResult result) {
        }

        @Override
        public void recordFailure(String reason) {
        }

        @Override
        public void recordWarmup(boolean success, long durationNanos) {
        }
    };

    /**
     * Records one completed sidecar run.
     */
    void recordBatch(int taskCount, long durationNanos);

    /**
     * Records the outcome of one task.
     */
    void recordResult(OptimizationResult result);

    /**
     * Records a failed batch.
     *
     * @param reason short category such as "transport", "sidecar", "protocol", "cancelled"
     */
    void recordFailure(String reason);

    void recordWarmup(boolean success, long durationNanos);
}
