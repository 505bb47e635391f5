package com.phillippitts.imageoptimizer.service.sidecar;

import com.phillippitts.imageoptimizer.config.properties.SidecarProperties;
import com.phillippitts.imageoptimizer.exception.SidecarException;
import com.phillippitts.imageoptimizer.exception.SidecarExceptionBuilder;
import com.phillippitts.imageoptimizer.service.CancellationToken;
import com.phillippitts.imageoptimizer.util.ProcessTimeouts;
import com.phillippitts.imageoptimizer.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs the sidecar for one batch file and streams its output to a line consumer.
 *
 * <p>Responsibilities:
 * - Build the command {@code <binary> <verb> <batch-file>} from {@link SidecarProperties}
 * - Start the process via {@link ProcessFactory}
 * - Drain stdout and stderr concurrently into one queue so lines reach the consumer in arrival
 *   order, with both channels treated the same
 * - Honour a {@link CancellationToken} by terminating the process, still forwarding the output
 *   it had printed before termination
 * - Idempotent {@link #close()} for cleanup
 *
 * <p>The batch file itself is owned by the caller, which releases it after this method returns.
 * Calls are expected to be serialized by the caller; {@link #close()} only tracks the most
 * recent process.
 */
@Component
public class SidecarSupervisor implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(SidecarSupervisor.class);

    private final ProcessFactory processFactory;
    private final SidecarProperties properties;
    private final Map<String, String> environment;

    private volatile Process current;
    private volatile Thread outReader;
    private volatile Thread errReader;

    /**
     * One queued output line, or the end-of-stream signal of one reader.
     */
    private record OutputLine(String text) {
        static final OutputLine END_OF_STREAM = new OutputLine(null);

        boolean isEndOfStream() {
            return text == null;
        }
    }

    @Autowired
    public SidecarSupervisor(SidecarProperties properties) {
        this(new DefaultProcessFactory(), properties);
    }

    public SidecarSupervisor(ProcessFactory processFactory, SidecarProperties properties) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.environment = SidecarEnvironment.build(properties);
    }

    /**
     * Runs the sidecar against {@code batchFile} until it exits or {@code token} is cancelled.
     *
     * <p>Every non-blank output line from either stream is trimmed and passed to
     * {@code lineSink} on the calling thread. If the sink throws, the process is destroyed and
     * the exception propagates unchanged.
     *
     * @param batchFile batch file prepared by the transport
     * @param lineSink  consumer of output lines
     * @param token     cancellation signal, checked between reads
     * @return exit status; a non-zero or cancelled outcome is not thrown here
     * @throws SidecarException if the process cannot be started or supervision is interrupted
     */
    public SidecarRunOutcome run(Path batchFile, Consumer<String> lineSink, CancellationToken token) {
        Objects.requireNonNull(batchFile, "batchFile");
        Objects.requireNonNull(lineSink, "lineSink");
        Objects.requireNonNull(token, "token");

        List<String> command = buildCommand(batchFile);
        long startTime = System.nanoTime();

        Process process;
        try {
            process = processFactory.start(command, null, environment);
        } catch (IOException e) {
            throw SidecarExceptionBuilder.create("Failed to start sidecar: " + e.getMessage())
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("binaryPath", command.get(0))
                    .metadata("batchFile", batchFile)
                    .cause(e)
                    .build();
        }
        this.current = process;
        LOG.debug("Sidecar started: pid={}, command={}", pidOf(process), command);

        BlockingQueue<OutputLine> queue = new LinkedBlockingQueue<>();
        Thread out = startReader(process.getInputStream(), queue, SidecarConstants.STDOUT_READER_NAME);
        Thread err = startReader(process.getErrorStream(), queue, SidecarConstants.STDERR_READER_NAME);
        this.outReader = out;
        this.errReader = err;

        OutputTail tail = new OutputTail(SidecarConstants.OUTPUT_TAIL_LINES);
        try {
            boolean cancelled = pumpOutput(process, queue, lineSink, tail, token);
            if (cancelled && process.isAlive()) {
                destroyProcess(process);
            }
            int exitCode = awaitExit(process);
            long durationMs = TimeUtils.elapsedMillis(startTime);
            LOG.debug("Sidecar finished: exitCode={}, cancelled={}, durationMs={}", exitCode, cancelled, durationMs);
            return new SidecarRunOutcome(exitCode, cancelled, durationMs, tail.snapshot());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyProcess(process);
            throw SidecarExceptionBuilder.create("Interrupted while supervising sidecar")
                    .cancelled(true)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("output", tail.snapshot())
                    .cause(e)
                    .build();
        } catch (RuntimeException e) {
            destroyProcess(process);
            throw e;
        } finally {
            joinQuietly(out, ProcessTimeouts.READER_FLUSH_TIMEOUT);
            joinQuietly(err, ProcessTimeouts.READER_FLUSH_TIMEOUT);
            if (process.isAlive()) {
                destroyProcess(process);
            }
            this.current = null;
        }
    }

    /**
     * Forwards queued lines until both streams reach EOF or the token is cancelled. On
     * cancellation the process is destroyed and lines it had already printed are still
     * forwarded, up to {@link ProcessTimeouts#CANCEL_DRAIN_TIMEOUT}.
     *
     * @return true if stopped by cancellation
     */
    private boolean pumpOutput(Process process, BlockingQueue<OutputLine> queue, Consumer<String> lineSink,
                               OutputTail tail, CancellationToken token) throws InterruptedException {
        int openStreams = 2;
        long pollMillis = ProcessTimeouts.OUTPUT_POLL_INTERVAL.toMillis();
        while (openStreams > 0) {
            if (token.isCancelled()) {
                LOG.info("Cancelling sidecar: {}", token.reason());
                destroyProcess(process);
                drainAfterCancel(queue, lineSink, tail, openStreams);
                return true;
            }
            OutputLine line = queue.poll(pollMillis, TimeUnit.MILLISECONDS);
            if (line == null) {
                continue;
            }
            if (line.isEndOfStream()) {
                openStreams--;
                continue;
            }
            tail.add(line.text());
            lineSink.accept(line.text());
        }
        return token.isCancelled();
    }

    private void drainAfterCancel(BlockingQueue<OutputLine> queue, Consumer<String> lineSink,
                                  OutputTail tail, int openStreams) throws InterruptedException {
        long deadline = System.nanoTime() + ProcessTimeouts.CANCEL_DRAIN_TIMEOUT.toNanos();
        int forwarded = 0;
        while (openStreams > 0) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                LOG.warn("Sidecar output still open {}ms after cancellation; dropping the rest",
                        ProcessTimeouts.CANCEL_DRAIN_TIMEOUT.toMillis());
                break;
            }
            OutputLine line = queue.poll(remaining, TimeUnit.NANOSECONDS);
            if (line == null) {
                continue;
            }
            if (line.isEndOfStream()) {
                openStreams--;
                continue;
            }
            tail.add(line.text());
            lineSink.accept(line.text());
            forwarded++;
        }
        LOG.debug("Forwarded {} lines printed before cancellation", forwarded);
    }

    private int awaitExit(Process process) throws InterruptedException {
        Duration timeout = ProcessTimeouts.EXIT_WAIT_TIMEOUT;
        boolean exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!exited) {
            LOG.warn("Sidecar closed its output but did not exit within {}ms; terminating", timeout.toMillis());
            destroyProcess(process);
        }
        return exitCodeOf(process);
    }

    List<String> buildCommand(Path batchFile) {
        List<String> cmd = new ArrayList<>(3);
        cmd.add(resolvePath(properties.binaryPath()).toString());
        cmd.add(properties.command());
        cmd.add(batchFile.toAbsolutePath().toString());
        return cmd;
    }

    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private Thread startReader(InputStream inputStream, BlockingQueue<OutputLine> queue, String name) {
        Thread thread = new Thread(new LineReader(inputStream, queue, name), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads trimmed, non-blank lines into the shared queue and always signals end of stream.
     */
    private static final class LineReader implements Runnable {
        private final InputStream inputStream;
        private final BlockingQueue<OutputLine> queue;
        private final String name;

        LineReader(InputStream inputStream, BlockingQueue<OutputLine> queue, String name) {
            this.inputStream = inputStream;
            this.queue = queue;
            this.name = name;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    String trimmed = line.trim();
                    if (!trimmed.isEmpty()) {
                        queue.add(new OutputLine(trimmed));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Output reader '{}' stopped: {}", name, e.toString());
            } finally {
                queue.add(OutputLine.END_OF_STREAM);
            }
        }
    }

    /**
     * Bounded window over the most recent output lines.
     */
    private static final class OutputTail {
        private final int maxLines;
        private final Deque<String> lines = new ArrayDeque<>();

        OutputTail(int maxLines) {
            this.maxLines = maxLines;
        }

        void add(String line) {
            if (lines.size() == maxLines) {
                lines.removeFirst();
            }
            lines.addLast(line);
        }

        String snapshot() {
            String joined = String.join("\n", lines);
            int max = SidecarConstants.OUTPUT_TAIL_MAX_CHARS;
            return joined.length() <= max ? joined : joined.substring(joined.length() - max);
        }
    }

    private static int exitCodeOf(Process process) {
        try {
            return process.exitValue();
        } catch (IllegalThreadStateException e) {
            return SidecarException.NO_EXIT_CODE;
        }
    }

    private static String pidOf(Process process) {
        try {
            return String.valueOf(process.pid());
        } catch (UnsupportedOperationException e) {
            return "n/a";
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Sidecar still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying sidecar");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying sidecar: {}", e.toString());
        }
    }

    /**
     * Idempotent cleanup of any running sidecar and reader threads.
     */
    @Override
    public void close() {
        Process process = this.current;
        this.current = null;
        if (process != null && process.isAlive()) {
            destroyProcess(process);
        }
        joinQuietly(outReader, ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        joinQuietly(errReader, ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        outReader = null;
        errReader = null;
    }
}
