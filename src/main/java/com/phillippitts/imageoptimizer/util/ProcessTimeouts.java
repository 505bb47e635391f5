package com.phillippitts.imageoptimizer.util;

import java.time.Duration;

/**
 * Standard timeout values for sidecar process and reader thread management.
 *
 * @see com.phillippitts.imageoptimizer.service.sidecar.SidecarSupervisor
 */
public final class ProcessTimeouts {

    /**
     * How long the supervisor blocks on the output queue before re-checking cancellation.
     * Bounds the delay between {@code cancel()} and process termination.
     */
    public static final Duration OUTPUT_POLL_INTERVAL = Duration.ofMillis(50);

    /**
     * Upper bound on forwarding output already printed by a cancelled sidecar, counted from the
     * moment it has been terminated.
     */
    public static final Duration CANCEL_DRAIN_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Timeout for reader threads to flush buffered output after the process has exited.
     */
    public static final Duration READER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for reader threads during cleanup. They are daemon threads, so this is best-effort.
     */
    public static final Duration READER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Upper bound on waiting for an exit code once both output streams have closed.
     */
    public static final Duration EXIT_WAIT_TIMEOUT = Duration.ofSeconds(10);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
