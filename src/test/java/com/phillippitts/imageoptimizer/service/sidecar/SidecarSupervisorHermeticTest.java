package com.phillippitts.imageoptimizer.service.sidecar;

import com.phillippitts.imageoptimizer.config.properties.SidecarProperties;
import com.phillippitts.imageoptimizer.exception.SidecarException;
import com.phillippitts.imageoptimizer.service.CancellationToken;
import com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.FailingProcessFactory;
import com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.ProcessBehavior;
import com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.StubProcessFactory;
import com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.TestProcess;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.imageoptimizer.testutil.SidecarTestDoubles.DESTROYED_EXIT_CODE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Hermetic tests for {@link SidecarSupervisor} using fake processes; no sidecar binary needed.
 */
class SidecarSupervisorHermeticTest {

    private static final Path BATCH_FILE = Path.of("/tmp/batch-1.mmap");

    private final List<String> lines = new CopyOnWriteArrayList<>();

    private static SidecarSupervisor supervisor(StubProcessFactory factory) {
        return new SidecarSupervisor(factory, SidecarProperties.of("/opt/sidecar/sharp-sidecar"));
    }

    @Test
    void forwardsTrimmedNonBlankLinesFromBothStreams() {
        TestProcess process = new TestProcess(new ProcessBehavior("first\n\n   second  \n", "warning: slow\n", 0, true));
        StubProcessFactory factory = new StubProcessFactory(process);

        SidecarRunOutcome outcome = supervisor(factory).run(BATCH_FILE, lines::add, CancellationToken.none());

        assertThat(lines).containsExactlyInAnyOrder("first", "second", "warning: slow");
        assertThat(lines.indexOf("first")).isLessThan(lines.indexOf("second"));
        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.cancelled()).isFalse();
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(factory.startCount()).isEqualTo(1);
    }

    @Test
    void nonZeroExitIsReportedNotThrown() {
        TestProcess process = new TestProcess(ProcessBehavior.exits("decoding a.png\nboom\n", 1));

        SidecarRunOutcome outcome = supervisor(new StubProcessFactory(process))
                .run(BATCH_FILE, lines::add, CancellationToken.none());

        assertThat(outcome.exitCode()).isEqualTo(1);
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.outputTail()).contains("boom");
    }

    @Test
    void spawnFailureBecomesSidecarException() {
        FailingProcessFactory factory = new FailingProcessFactory();
        SidecarSupervisor supervisor = new SidecarSupervisor(factory, SidecarProperties.of("/missing/sidecar"));

        assertThatThrownBy(() -> supervisor.run(BATCH_FILE, lines::add, CancellationToken.none()))
                .isInstanceOf(SidecarException.class)
                .hasMessageContaining("Failed to start sidecar")
                .satisfies(e -> assertThat(((SidecarException) e).isCancelled()).isFalse());
        assertThat(factory.attempts()).isEqualTo(1);
        assertThat(lines).isEmpty();
    }

    @Test
    void cancellationDestroysHangingProcess() {
        TestProcess process = new TestProcess(ProcessBehavior.hangsAfter("working on a.png\n"));
        CancellationToken token = CancellationToken.create();
        SidecarSupervisor supervisor = supervisor(new StubProcessFactory(process));

        CompletableFuture<SidecarRunOutcome> run =
                CompletableFuture.supplyAsync(() -> supervisor.run(BATCH_FILE, lines::add, token));
        await().atMost(5, TimeUnit.SECONDS).until(() -> lines.contains("working on a.png"));
        token.cancel("user request");

        SidecarRunOutcome outcome = run.orTimeout(5, TimeUnit.SECONDS).join();
        assertThat(outcome.cancelled()).isTrue();
        assertThat(outcome.exitCode()).isEqualTo(DESTROYED_EXIT_CODE);
        assertThat(process.wasDestroyCalled()).isTrue();
        assertThat(process.isAlive()).isFalse();
    }

    @Test
    void alreadyCancelledTokenStopsImmediately() {
        TestProcess process = new TestProcess(ProcessBehavior.hangsAfter(""));
        CancellationToken token = CancellationToken.create();
        token.cancel("shutdown");

        SidecarRunOutcome outcome = supervisor(new StubProcessFactory(process)).run(BATCH_FILE, lines::add, token);

        assertThat(outcome.cancelled()).isTrue();
        assertThat(process.wasDestroyCalled()).isTrue();
    }

    @Test
    void linesPrintedBeforeCancellationStillReachTheSink() {
        TestProcess process = new TestProcess(ProcessBehavior.hangsAfter("first\nsecond-complete\nthird-complete\n"));
        CancellationToken token = CancellationToken.create();
        SidecarSupervisor supervisor = supervisor(new StubProcessFactory(process));

        SidecarRunOutcome outcome = supervisor.run(BATCH_FILE, line -> {
            lines.add(line);
            token.cancel("user request");
        }, token);

        assertThat(outcome.cancelled()).isTrue();
        assertThat(lines).containsExactly("first", "second-complete", "third-complete");
        assertThat(outcome.outputTail()).contains("third-complete");
        assertThat(process.wasDestroyCalled()).isTrue();
    }

    @Test
    void sinkFailureDestroysProcessAndPropagates() {
        TestProcess process = new TestProcess(ProcessBehavior.hangsAfter("bad line\n"));
        SidecarSupervisor supervisor = supervisor(new StubProcessFactory(process));

        assertThatThrownBy(() -> supervisor.run(BATCH_FILE, line -> {
            throw new IllegalStateException("parser rejected " + line);
        }, CancellationToken.none()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("parser rejected bad line");
        assertThat(process.wasDestroyCalled()).isTrue();
    }

    @Test
    void commandIsBinaryVerbAndAbsoluteBatchPath() {
        SidecarProperties props = new SidecarProperties("/opt/sidecar/sharp-sidecar", "optimize-batch-mmap",
                List.of(), Map.of());
        SidecarSupervisor supervisor = new SidecarSupervisor(new StubProcessFactory(() -> null), props);

        List<String> cmd = supervisor.buildCommand(Path.of("batch.mmap"));

        assertThat(cmd).hasSize(3);
        assertThat(cmd.get(0)).isEqualTo(Path.of("/opt/sidecar/sharp-sidecar").toString());
        assertThat(cmd.get(1)).isEqualTo("optimize-batch-mmap");
        assertThat(Path.of(cmd.get(2)).isAbsolute()).isTrue();
        assertThat(cmd.get(2)).endsWith("batch.mmap");
    }

    @Test
    void relativeBinaryIsResolvedAgainstWorkingDirectory() {
        SidecarSupervisor supervisor = new SidecarSupervisor(new StubProcessFactory(() -> null),
                SidecarProperties.of("binaries/sharp-sidecar"));

        String binary = supervisor.buildCommand(BATCH_FILE).get(0);

        assertThat(Path.of(binary).isAbsolute()).isTrue();
        assertThat(binary).endsWith(Path.of("binaries", "sharp-sidecar").toString());
    }

    @Test
    void configuredEnvironmentIsPassedToProcess() {
        TestProcess process = new TestProcess(ProcessBehavior.exits("", 0));
        StubProcessFactory factory = new StubProcessFactory(process);
        SidecarProperties props = new SidecarProperties("/opt/sidecar/sharp-sidecar", "optimize-batch-mmap",
                List.of(), Map.of("UV_THREADPOOL_SIZE", "4"));

        new SidecarSupervisor(factory, props).run(BATCH_FILE, lines::add, CancellationToken.none());

        assertThat(factory.lastEnvironment()).containsEntry("UV_THREADPOOL_SIZE", "4");
        assertThat(factory.lastCommand()).contains("optimize-batch-mmap");
    }

    @Test
    void closeIsIdempotent() {
        SidecarSupervisor supervisor = supervisor(new StubProcessFactory(
                new TestProcess(ProcessBehavior.exits("done\n", 0))));
        supervisor.run(BATCH_FILE, lines::add, CancellationToken.none());

        supervisor.close();
        supervisor.close();

        assertThat(lines).containsExactly("done");
    }
}
