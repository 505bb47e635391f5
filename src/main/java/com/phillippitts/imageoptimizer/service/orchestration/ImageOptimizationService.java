package com.phillippitts.imageoptimizer.service.orchestration;

import com.phillippitts.imageoptimizer.config.properties.BatchProperties;
import com.phillippitts.imageoptimizer.domain.BatchProgressEvent;
import com.phillippitts.imageoptimizer.domain.BenchmarkResult;
import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.OptimizationResult;
import com.phillippitts.imageoptimizer.exception.ImageOptimizerException;
import com.phillippitts.imageoptimizer.exception.PartialBatchException;
import com.phillippitts.imageoptimizer.exception.ProtocolException;
import com.phillippitts.imageoptimizer.exception.SidecarExceptionBuilder;
import com.phillippitts.imageoptimizer.exception.ValidationException;
import com.phillippitts.imageoptimizer.service.CancellationToken;
import com.phillippitts.imageoptimizer.service.batch.BatchChunker;
import com.phillippitts.imageoptimizer.service.progress.ProgressListener;
import com.phillippitts.imageoptimizer.service.validation.TaskValidator;
import com.phillippitts.imageoptimizer.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;

/**
 * Caller-facing entry point for image optimization.
 *
 * <p>Validates tasks, splits them into batches of at most {@code optimizer.batch.max-batch-size},
 * runs the batches one after another through {@link SidecarBatchExecutor} and concatenates their
 * results in task order. A failing batch aborts the call; the thrown
 * {@link PartialBatchException} carries the results of all earlier batches plus whatever the
 * failing batch produced.
 */
@Service
public class ImageOptimizationService {

    private static final Logger LOG = LogManager.getLogger(ImageOptimizationService.class);

    static final String BENCHMARK_DIR_PREFIX = "image-optimizer-benchmark-";

    private final TaskValidator validator;
    private final SidecarBatchExecutor batchExecutor;
    private final ProgressListener defaultListener;
    private final BatchProperties batchProperties;
    private final Executor executor;

    public ImageOptimizationService(TaskValidator validator,
                                    SidecarBatchExecutor batchExecutor,
                                    ProgressListener defaultListener,
                                    BatchProperties batchProperties,
                                    @Qualifier("batchExecutor") Executor executor) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.batchExecutor = Objects.requireNonNull(batchExecutor, "batchExecutor");
        this.defaultListener = Objects.requireNonNull(defaultListener, "defaultListener");
        this.batchProperties = Objects.requireNonNull(batchProperties, "batchProperties");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Optimizes {@code tasks} asynchronously, reporting progress to the default listener.
     */
    public CompletableFuture<List<OptimizationResult>> optimizeImages(List<ImageTask> tasks,
                                                                      CancellationToken token) {
        return optimizeImages(tasks, defaultListener, token);
    }

    /**
     * Optimizes {@code tasks} asynchronously on the batch executor.
     *
     * @param tasks    tasks in the order results should be returned
     * @param listener receives per-file and per-batch progress
     * @param token    cancellation signal; cancelling fails the future with the results so far
     * @return future completing with one result per task
     */
    public CompletableFuture<List<OptimizationResult>> optimizeImages(List<ImageTask> tasks,
                                                                      ProgressListener listener,
                                                                      CancellationToken token) {
        return CompletableFuture.supplyAsync(() -> optimize(tasks, listener, token), executor);
    }

    /**
     * Optimizes a single image.
     *
     * @return future completing with the task's result, or failing with {@link ProtocolException}
     *         when the sidecar reported nothing for it
     */
    public CompletableFuture<OptimizationResult> optimizeImage(ImageTask task) {
        Objects.requireNonNull(task, "task");
        return optimizeImages(List.of(task), CancellationToken.none()).thenApply(results -> {
            if (results.isEmpty()) {
                throw new ProtocolException("No result received for " + task.inputPath());
            }
            return results.get(0);
        });
    }

    /**
     * Benchmarks the pipeline asynchronously on the batch executor.
     *
     * @see #runBenchmark(List)
     */
    public CompletableFuture<BenchmarkResult> benchmark(List<ImageTask> tasks) {
        return CompletableFuture.supplyAsync(() -> runBenchmark(tasks), executor);
    }

    /**
     * Synchronous variant reporting progress to the default listener.
     */
    public List<OptimizationResult> optimize(List<ImageTask> tasks, CancellationToken token) {
        return optimize(tasks, defaultListener, token);
    }

    /**
     * Synchronous core of {@link #optimizeImages(List, ProgressListener, CancellationToken)}.
     */
    public List<OptimizationResult> optimize(List<ImageTask> tasks, ProgressListener listener,
                                             CancellationToken token) {
        Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(token, "token");
        validator.validate(tasks);
        if (tasks.isEmpty()) {
            return List.of();
        }

        List<List<ImageTask>> batches = BatchChunker.chunk(tasks, batchProperties.maxBatchSize());
        LOG.info("Optimizing {} images in {} batch(es)", tasks.size(), batches.size());

        List<OptimizationResult> results = new ArrayList<>(tasks.size());
        int processed = 0;
        for (List<ImageTask> batch : batches) {
            if (token.isCancelled()) {
                throw SidecarExceptionBuilder.create("Optimization cancelled: " + token.reason())
                        .cancelled(true)
                        .partialResults(results)
                        .metadata("processed", processed)
                        .metadata("total", tasks.size())
                        .build();
            }
            try {
                results.addAll(batchExecutor.executeBatch(batch, listener, token));
            } catch (PartialBatchException e) {
                List<OptimizationResult> combined = new ArrayList<>(results);
                combined.addAll(e.getPartialResults());
                throw e.withPartialResults(combined);
            }
            processed += batch.size();
            notifyBatchProgress(listener, BatchProgressEvent.of(processed, tasks.size(),
                    BatchProgressEvent.STATUS_PROCESSING));
        }
        notifyBatchProgress(listener, BatchProgressEvent.of(tasks.size(), tasks.size(),
                BatchProgressEvent.STATUS_COMPLETE));
        return List.copyOf(results);
    }

    /**
     * Runs {@code tasks} with outputs redirected to a scratch directory and reports timing.
     * The scratch directory is removed afterwards.
     *
     * @throws ValidationException if {@code tasks} is empty
     */
    public BenchmarkResult runBenchmark(List<ImageTask> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            throw new ValidationException("No images provided for benchmark");
        }

        Path scratch = createBenchmarkDirectory();
        try {
            List<ImageTask> redirected = new ArrayList<>(tasks.size());
            for (int i = 0; i < tasks.size(); i++) {
                ImageTask task = tasks.get(i);
                Path fileName = task.outputPath().getFileName();
                redirected.add(task.withOutputPath(scratch.resolve(i + "-" + fileName)));
            }

            long start = System.nanoTime();
            List<OptimizationResult> results = optimize(redirected, ProgressListener.NOOP, CancellationToken.none());
            long elapsedMs = TimeUtils.elapsedMillis(start);

            long inputBytes = results.stream().mapToLong(OptimizationResult::originalSize).sum();
            long outputBytes = results.stream().mapToLong(OptimizationResult::optimizedSize).sum();
            BenchmarkResult benchmark = BenchmarkResult.from(elapsedMs, tasks.size(), inputBytes, outputBytes);
            LOG.info("Benchmark: {} images in {}ms ({} images/s)",
                    benchmark.imageCount(), benchmark.totalTimeMs(), benchmark.throughputImagesPerSec());
            return benchmark;
        } finally {
            deleteRecursively(scratch);
        }
    }

    private Path createBenchmarkDirectory() {
        try {
            return Files.createTempDirectory(Path.of(batchProperties.tempDir()),
                    BENCHMARK_DIR_PREFIX + System.currentTimeMillis() + "-");
        } catch (IOException e) {
            throw new ImageOptimizerException("Failed to create benchmark directory", e);
        }
    }

    private static void notifyBatchProgress(ProgressListener listener, BatchProgressEvent event) {
        try {
            listener.onBatchProgress(event);
        } catch (RuntimeException e) {
            LOG.warn("Progress listener failed for batch progress {}: {}", event, e.toString());
        }
    }

    static void deleteRecursively(Path root) {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    LOG.warn("Failed to delete {}: {}", path, e.toString());
                }
            });
        } catch (IOException e) {
            LOG.warn("Failed to clean up {}: {}", root, e.toString());
        }
    }
}
