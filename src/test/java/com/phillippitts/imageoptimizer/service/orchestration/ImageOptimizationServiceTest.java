package com.phillippitts.imageoptimizer.service.orchestration;

import com.phillippitts.imageoptimizer.config.properties.BatchProperties;
import com.phillippitts.imageoptimizer.config.properties.ProtocolProperties;
import com.phillippitts.imageoptimizer.config.properties.SidecarProperties;
import com.phillippitts.imageoptimizer.domain.BatchProgressEvent;
import com.phillippitts.imageoptimizer.domain.BenchmarkResult;
import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.OptimizationResult;
import com.phillippitts.imageoptimizer.exception.ProtocolException;
import com.phillippitts.imageoptimizer.exception.SidecarException;
import com.phillippitts.imageoptimizer.exception.ValidationException;
import com.phillippitts.imageoptimizer.service.CancellationToken;
import com.phillippitts.imageoptimizer.service.metrics.BatchMetricsSink;
import com.phillippitts.imageoptimizer.service.sidecar.SidecarSupervisor;
import com.phillippitts.imageoptimizer.service.transport.MemoryMappedTransport;
import com.phillippitts.imageoptimizer.service.validation.TaskValidator;
import com.phillippitts.imageoptimizer.testutil.RecordingProgressListener;
import com.phillippitts.imageoptimizer.testutil.SidecarLines;
import com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.ProcessBehavior;
import com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.StubProcessFactory;
import com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.TestProcess;
import com.phillippitts.imageoptimizer.testutil.SyncExecutor;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageOptimizationServiceTest {

    @TempDir
    Path tempDir;

    private Path workDir;
    private Deque<String> scriptedRuns;
    private Deque<Integer> scriptedExitCodes;
    private StubProcessFactory factory;
    private RecordingProgressListener listener;

    @BeforeEach
    void setUp() throws IOException {
        workDir = Files.createDirectories(tempDir.resolve("work"));
        Files.createDirectories(tempDir.resolve("in"));
        scriptedRuns = new ArrayDeque<>();
        scriptedExitCodes = new ArrayDeque<>();
        factory = new StubProcessFactory(() -> new TestProcess(
                ProcessBehavior.exits(scriptedRuns.removeFirst(), scriptedExitCodes.removeFirst())));
        listener = new RecordingProgressListener();
    }

    private ImageOptimizationService service(int maxBatchSize) {
        BatchProperties batchProps = new BatchProperties(maxBatchSize, workDir.toString(), "svc-batch");
        SidecarBatchExecutor batchExecutor = new SidecarBatchExecutor(new MemoryMappedTransport(batchProps),
                new SidecarSupervisor(factory, SidecarProperties.of("/opt/sidecar/sharp-sidecar")),
                BatchMetricsSink.NOOP, new ProtocolProperties(false));
        return new ImageOptimizationService(new TaskValidator(), batchExecutor, listener, batchProps,
                new SyncExecutor());
    }

    private List<ImageTask> inputs(int count) throws IOException {
        List<ImageTask> tasks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Path input = Files.write(tempDir.resolve("in/photo" + i + ".png"), new byte[100 * (i + 1)]);
            tasks.add(ImageTask.of(input, tempDir.resolve("out/photo" + i + ".png")));
        }
        return tasks;
    }

    private void scriptSuccess(List<ImageTask> chunk) {
        List<JSONObject> results = new ArrayList<>();
        for (ImageTask task : chunk) {
            results.add(SidecarLines.result(task.outputPath().toString(), 1000, 400));
        }
        script(SidecarLines.framedPayload(results), 0);
    }

    private void script(String stdout, int exitCode) {
        scriptedRuns.addLast(stdout);
        scriptedExitCodes.addLast(exitCode);
    }

    @Test
    void splitsIntoChunksAndKeepsTaskOrder() throws IOException {
        List<ImageTask> tasks = inputs(5);
        scriptSuccess(tasks.subList(0, 2));
        scriptSuccess(tasks.subList(2, 4));
        scriptSuccess(tasks.subList(4, 5));

        List<OptimizationResult> results = service(2).optimize(tasks, CancellationToken.none());

        assertThat(factory.startCount()).isEqualTo(3);
        assertThat(results).extracting(OptimizationResult::originalPath)
                .containsExactlyElementsOf(tasks.stream().map(ImageTask::taskId).toList());
        assertThat(results).extracting(OptimizationResult::optimizedPath)
                .containsExactlyElementsOf(tasks.stream().map(t -> t.outputPath().toString()).toList());
        assertThat(Files.isDirectory(tempDir.resolve("out"))).isTrue();
    }

    @Test
    void publishesBatchProgressAfterEachChunk() throws IOException {
        List<ImageTask> tasks = inputs(5);
        scriptSuccess(tasks.subList(0, 2));
        scriptSuccess(tasks.subList(2, 4));
        scriptSuccess(tasks.subList(4, 5));

        service(2).optimize(tasks, CancellationToken.none());

        assertThat(listener.batchEvents).containsExactly(
                BatchProgressEvent.of(2, 5, BatchProgressEvent.STATUS_PROCESSING),
                BatchProgressEvent.of(4, 5, BatchProgressEvent.STATUS_PROCESSING),
                BatchProgressEvent.of(5, 5, BatchProgressEvent.STATUS_PROCESSING),
                BatchProgressEvent.of(5, 5, BatchProgressEvent.STATUS_COMPLETE));
    }

    @Test
    void failingChunkCarriesResultsOfEarlierChunks() throws IOException {
        List<ImageTask> tasks = inputs(5);
        scriptSuccess(tasks.subList(0, 2));
        script(SidecarLines.lines(SidecarLines.complete(tasks.get(2).taskId(),
                SidecarLines.result(tasks.get(2).outputPath().toString(), 1000, 400), 1, 2), "fatal: out of memory"), 137);
        ImageOptimizationService service = service(2);

        assertThatThrownBy(() -> service.optimize(tasks, CancellationToken.none()))
                .isInstanceOf(SidecarException.class)
                .satisfies(e -> assertThat(((SidecarException) e).getPartialResults())
                        .extracting(OptimizationResult::originalPath)
                        .containsExactly(tasks.get(0).taskId(), tasks.get(1).taskId(), tasks.get(2).taskId()));
        assertThat(factory.startCount()).isEqualTo(2);
    }

    @Test
    void cancellationBetweenChunksStopsBeforeNextSpawn() throws IOException {
        List<ImageTask> tasks = inputs(4);
        scriptSuccess(tasks.subList(0, 2));
        CancellationToken token = CancellationToken.create();
        RecordingProgressListener cancelling = new RecordingProgressListener() {
            @Override
            public void onBatchProgress(BatchProgressEvent event) {
                super.onBatchProgress(event);
                token.cancel("enough");
            }
        };

        assertThatThrownBy(() -> service(2).optimize(tasks, cancelling, token))
                .isInstanceOf(SidecarException.class)
                .satisfies(e -> {
                    SidecarException se = (SidecarException) e;
                    assertThat(se.isCancelled()).isTrue();
                    assertThat(se.getPartialResults()).hasSize(2);
                });
        assertThat(factory.startCount()).isEqualTo(1);
    }

    @Test
    void invalidTaskFailsBeforeAnySpawn() throws IOException {
        List<ImageTask> tasks = new ArrayList<>(inputs(1));
        tasks.add(ImageTask.of(tempDir.resolve("in/missing.png"), tempDir.resolve("out/missing.png")));

        assertThatThrownBy(() -> service(10).optimize(tasks, CancellationToken.none()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("missing.png");
        assertThat(factory.startCount()).isZero();
    }

    @Test
    void emptyTaskListReturnsEmptyWithoutSpawning() {
        assertThat(service(10).optimize(List.of(), CancellationToken.none())).isEmpty();
        assertThat(factory.startCount()).isZero();
        assertThat(listener.batchEvents).isEmpty();
    }

    @Test
    void asyncVariantCompletesWithResults() throws IOException {
        List<ImageTask> tasks = inputs(2);
        scriptSuccess(tasks);

        List<OptimizationResult> results = service(10).optimizeImages(tasks, CancellationToken.none()).join();

        assertThat(results).hasSize(2);
    }

    @Test
    void singleImageReturnsItsResult() throws IOException {
        ImageTask task = inputs(1).get(0);
        scriptSuccess(List.of(task));

        OptimizationResult result = service(10).optimizeImage(task).join();

        assertThat(result.originalPath()).isEqualTo(task.taskId());
        assertThat(result.savedBytes()).isEqualTo(600L);
    }

    @Test
    void singleImageWithoutResultFails() throws IOException {
        ImageTask task = inputs(1).get(0);
        script(SidecarLines.framedPayload(List.of()), 0);

        assertThatThrownBy(() -> service(10).optimizeImage(task).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ProtocolException.class);
    }

    @Test
    void benchmarkReportsTotalsAndRemovesScratchOutputs() throws IOException {
        List<ImageTask> tasks = inputs(3);
        scriptSuccess(tasks);

        BenchmarkResult result = service(10).runBenchmark(tasks);

        assertThat(result.imageCount()).isEqualTo(3);
        assertThat(result.totalInputBytes()).isEqualTo(3000L);
        assertThat(result.totalOutputBytes()).isEqualTo(1200L);
        assertThat(result.throughputImagesPerSec()).isPositive();
        assertThat(Files.exists(tempDir.resolve("out"))).isFalse();
        try (Stream<Path> leftovers = Files.list(workDir)) {
            assertThat(leftovers).isEmpty();
        }
    }

    @Test
    void benchmarkRejectsEmptyInput() {
        assertThatThrownBy(() -> service(10).runBenchmark(List.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("No images provided for benchmark");
    }

    @Test
    void benchmarkRemovesScratchDirectoryOnFailure() throws IOException {
        List<ImageTask> tasks = inputs(1);
        script("crash\n", 2);

        assertThatThrownBy(() -> service(10).runBenchmark(tasks)).isInstanceOf(SidecarException.class);
        try (Stream<Path> leftovers = Files.list(workDir)) {
            assertThat(leftovers).isEmpty();
        }
    }
}
