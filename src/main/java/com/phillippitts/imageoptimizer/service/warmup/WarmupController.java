package com.phillippitts.imageoptimizer.service.warmup;

import com.phillippitts.imageoptimizer.config.properties.WarmupProperties;
import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.OptimizationResult;
import com.phillippitts.imageoptimizer.service.CancellationToken;
import com.phillippitts.imageoptimizer.service.metrics.BatchMetricsSink;
import com.phillippitts.imageoptimizer.service.orchestration.ImageOptimizationService;
import com.phillippitts.imageoptimizer.service.progress.ProgressListener;
import com.phillippitts.imageoptimizer.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Pushes a 1x1 PNG through the whole pipeline once the application is ready, so the sidecar's
 * first real call does not pay its cold-start cost.
 *
 * <p>The warmup runs once, off the startup thread, with a timeout from
 * {@code optimizer.warmup.timeout}. Failures never propagate; they are logged and reflected in
 * {@link #status()} for the health endpoint.
 */
@Component
@ConditionalOnProperty(name = "optimizer.warmup.enabled", havingValue = "true", matchIfMissing = true)
public class WarmupController {

    private static final Logger LOG = LogManager.getLogger(WarmupController.class);

    static final String WARMUP_PNG_BASE64 =
            "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAYAAAAfFcSJAAAADUlEQVR42mNkYPhfDwAChwGA60e6kgAAAABJRU5ErkJggg==";
    static final String TEMP_DIR_PREFIX = "image-optimizer-warmup-";

    /**
     * Outcome of the startup warmup.
     */
    public enum WarmupStatus {
        NOT_RUN, RUNNING, SUCCEEDED, FAILED
    }

    private final ImageOptimizationService optimizationService;
    private final WarmupProperties properties;
    private final BatchMetricsSink metrics;
    private final Executor executor;
    private final ScheduledExecutorService scheduler;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicReference<WarmupStatus> status = new AtomicReference<>(WarmupStatus.NOT_RUN);
    private volatile String lastError;

    @Autowired
    public WarmupController(ImageOptimizationService optimizationService,
                            WarmupProperties properties,
                            BatchMetricsSink metrics,
                            @Qualifier("warmupExecutor") Executor executor,
                            @Qualifier("timeoutScheduler") ThreadPoolTaskScheduler scheduler) {
        this(optimizationService, properties, metrics, executor, scheduler.getScheduledExecutor());
    }

    WarmupController(ImageOptimizationService optimizationService,
                     WarmupProperties properties,
                     BatchMetricsSink metrics,
                     Executor executor,
                     ScheduledExecutorService scheduler) {
        this.optimizationService = Objects.requireNonNull(optimizationService, "optimizationService");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = metrics != null ? metrics : BatchMetricsSink.NOOP;
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        executor.execute(this::runWarmup);
    }

    /**
     * Runs the warmup on the calling thread. Never throws.
     */
    void runWarmup() {
        status.set(WarmupStatus.RUNNING);
        long start = System.nanoTime();
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory(TEMP_DIR_PREFIX);
            Path input = workDir.resolve("warmup.png");
            Files.write(input, Base64.getDecoder().decode(WARMUP_PNG_BASE64));
            ImageTask task = ImageTask.of(input, workDir.resolve("warmup-optimized.png"));

            List<OptimizationResult> results;
            try (CancellationToken token = CancellationToken.cancelAfter(properties.timeout(), scheduler)) {
                results = optimizationService.optimize(List.of(task), ProgressListener.NOOP, token);
            }

            long elapsedMs = TimeUtils.elapsedMillis(start);
            status.set(WarmupStatus.SUCCEEDED);
            lastError = null;
            metrics.recordWarmup(true, System.nanoTime() - start);
            LOG.info("Sidecar warmup complete in {}ms (results={})", elapsedMs, results.size());
        } catch (IOException | RuntimeException e) {
            status.set(WarmupStatus.FAILED);
            lastError = e.getMessage();
            metrics.recordWarmup(false, System.nanoTime() - start);
            LOG.warn("Sidecar warmup failed after {}ms: {}", TimeUtils.elapsedMillis(start), e.toString());
        } finally {
            deleteQuietly(workDir);
        }
    }

    public WarmupStatus status() {
        return status.get();
    }

    /**
     * Message of the last warmup failure, or null.
     */
    public String lastError() {
        return lastError;
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    LOG.warn("Failed to delete warmup file {}: {}", path, e.toString());
                }
            });
        } catch (IOException e) {
            LOG.warn("Failed to clean up warmup directory {}: {}", dir, e.toString());
        }
    }
}
