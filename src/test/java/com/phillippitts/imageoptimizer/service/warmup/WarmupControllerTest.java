package com.phillippitts.imageoptimizer.service.warmup;

import com.phillippitts.imageoptimizer.config.properties.BatchProperties;
import com.phillippitts.imageoptimizer.config.properties.ProtocolProperties;
import com.phillippitts.imageoptimizer.config.properties.SidecarProperties;
import com.phillippitts.imageoptimizer.config.properties.WarmupProperties;
import com.phillippitts.imageoptimizer.service.orchestration.ImageOptimizationService;
import com.phillippitts.imageoptimizer.service.orchestration.SidecarBatchExecutor;
import com.phillippitts.imageoptimizer.service.progress.ProgressListener;
import com.phillippitts.imageoptimizer.service.sidecar.ProcessFactory;
import com.phillippitts.imageoptimizer.service.sidecar.SidecarSupervisor;
import com.phillippitts.imageoptimizer.service.transport.MemoryMappedTransport;
import com.phillippitts.imageoptimizer.service.validation.TaskValidator;
import com.phillippitts.imageoptimizer.service.warmup.WarmupController.WarmupStatus;
import com.phillippitts.imageoptimizer.testutil.RecordingMetricsSink;
import com.phillippitts.imageoptimizer.testutil.SidecarLines;
import com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.FailingProcessFactory;
import com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.ProcessBehavior;
import com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.StubProcessFactory;
import com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.TestProcess;
import com.phillippitts.imageoptimizer.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class WarmupControllerTest {

    @TempDir
    Path tempDir;

    private ScheduledExecutorService scheduler;
    private RecordingMetricsSink metrics;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        metrics = new RecordingMetricsSink();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private WarmupController controller(ProcessFactory factory, Duration timeout, Executor executor) {
        BatchProperties batchProps = new BatchProperties(10, tempDir.toString(), "warmup-batch");
        SidecarBatchExecutor batchExecutor = new SidecarBatchExecutor(new MemoryMappedTransport(batchProps),
                new SidecarSupervisor(factory, SidecarProperties.of("/opt/sidecar/sharp-sidecar")),
                metrics, new ProtocolProperties(true));
        ImageOptimizationService service = new ImageOptimizationService(new TaskValidator(), batchExecutor,
                ProgressListener.NOOP, batchProps, new SyncExecutor());
        return new WarmupController(service, new WarmupProperties(true, timeout), metrics, executor, scheduler);
    }

    private WarmupController controller(ProcessFactory factory) {
        return controller(factory, Duration.ofSeconds(5), new SyncExecutor());
    }

    private static long warmupDirectories() throws IOException {
        try (Stream<Path> entries = Files.list(Path.of(System.getProperty("java.io.tmpdir")))) {
            return entries.filter(p -> p.getFileName().toString().startsWith(WarmupController.TEMP_DIR_PREFIX))
                    .count();
        }
    }

    @Test
    void successfulWarmupMarksSucceeded() {
        String stdout = SidecarLines.framedPayload(List.of(SidecarLines.result("warmup.png", 70, 68)));
        StubProcessFactory factory = new StubProcessFactory(() -> new TestProcess(ProcessBehavior.exits(stdout, 0)));
        WarmupController warmup = controller(factory);

        warmup.runWarmup();

        assertThat(warmup.status()).isEqualTo(WarmupStatus.SUCCEEDED);
        assertThat(warmup.lastError()).isNull();
        assertThat(metrics.warmups).containsExactly(true);
        assertThat(factory.startCount()).isEqualTo(1);
    }

    @Test
    void failingSidecarMarksFailedWithoutThrowing() {
        StubProcessFactory factory = new StubProcessFactory(() -> new TestProcess(ProcessBehavior.exits("libvips missing\n", 127)));
        WarmupController warmup = controller(factory);

        assertThatCode(warmup::runWarmup).doesNotThrowAnyException();

        assertThat(warmup.status()).isEqualTo(WarmupStatus.FAILED);
        assertThat(warmup.lastError()).contains("non-zero");
        assertThat(metrics.warmups).containsExactly(false);
    }

    @Test
    void missingBinaryMarksFailed() {
        WarmupController warmup = controller(new FailingProcessFactory());

        warmup.runWarmup();

        assertThat(warmup.status()).isEqualTo(WarmupStatus.FAILED);
        assertThat(warmup.lastError()).contains("Failed to start sidecar");
    }

    @Test
    void hangingSidecarIsCancelledByTimeout() {
        StubProcessFactory factory = new StubProcessFactory(() -> new TestProcess(ProcessBehavior.hangsAfter("")));
        WarmupController warmup = controller(factory, Duration.ofMillis(200), new SyncExecutor());

        warmup.runWarmup();

        assertThat(warmup.status()).isEqualTo(WarmupStatus.FAILED);
        assertThat(warmup.lastError()).contains("Timed out");
    }

    @Test
    void warmupFilesAreRemoved() throws IOException {
        long before = warmupDirectories();
        StubProcessFactory factory = new StubProcessFactory(() -> new TestProcess(ProcessBehavior.exits("", 1)));

        controller(factory).runWarmup();

        assertThat(warmupDirectories()).isEqualTo(before);
    }

    @Test
    void runsOnlyOnceOnRepeatedReadyEvents() {
        AtomicInteger submissions = new AtomicInteger();
        Executor counting = command -> submissions.incrementAndGet();
        WarmupController warmup = controller(new FailingProcessFactory(), Duration.ofSeconds(5), counting);

        warmup.onApplicationReady();
        warmup.onApplicationReady();

        assertThat(submissions).hasValue(1);
        assertThat(warmup.status()).isEqualTo(WarmupStatus.NOT_RUN);
    }
}
