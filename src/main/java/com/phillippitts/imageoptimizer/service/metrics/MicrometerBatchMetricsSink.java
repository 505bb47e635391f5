package com.phillippitts.imageoptimizer.service.metrics;

import com.phillippitts.imageoptimizer.domain.OptimizationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed {@link BatchMetricsSink}.
 *
 * <p>Metrics (available at /actuator/prometheus):
 * <ul>
 *   <li>{@code imageoptimizer.batch.latency} - sidecar run duration</li>
 *   <li>{@code imageoptimizer.task.success} / {@code imageoptimizer.task.failure} - per-task outcomes</li>
 *   <li>{@code imageoptimizer.bytes.saved} - cumulative bytes saved by successful tasks</li>
 *   <li>{@code imageoptimizer.batch.failure} - failed batches tagged by reason</li>
 *   <li>{@code imageoptimizer.warmup} - warmup runs tagged by outcome</li>
 * </ul>
 */
public class MicrometerBatchMetricsSink implements BatchMetricsSink {

    private static final String METRIC_PREFIX = "imageoptimizer";

    private final MeterRegistry registry;

    public MicrometerBatchMetricsSink(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void recordBatch(int taskCount, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".batch.latency")
                .description("Time taken by one sidecar run")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".batch.tasks")
                .description("Number of tasks sent to the sidecar")
                .register(registry)
                .increment(taskCount);
    }

    @Override
    public void recordResult(OptimizationResult result) {
        if (result.success()) {
            Counter.builder(METRIC_PREFIX + ".task.success")
                    .description("Number of successfully optimized images")
                    .register(registry)
                    .increment();
            if (result.savedBytes() > 0) {
                Counter.builder(METRIC_PREFIX + ".bytes.saved")
                        .description("Bytes saved by optimization")
                        .baseUnit("bytes")
                        .register(registry)
                        .increment(result.savedBytes());
            }
        } else {
            Counter.builder(METRIC_PREFIX + ".task.failure")
                    .description("Number of images the sidecar failed to optimize")
                    .register(registry)
                    .increment();
        }
    }

    @Override
    public void recordFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".batch.failure")
                .description("Number of failed batches")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    @Override
    public void recordWarmup(boolean success, long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".warmup")
                .description("Startup warmup runs")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".warmup.latency")
                .description("Startup warmup duration")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
