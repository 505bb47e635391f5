package com.phillippitts.imageoptimizer.service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal for an optimization call.
 *
 * <p>The pipeline checks the token between chunks and while reading sidecar output; a cancelled
 * token terminates the running sidecar and fails the call with the results received so far.
 * Cancellation is one-way and the first reason wins.
 *
 * <p>A token from {@link #cancelAfter} holds a pending timer; close it once the guarded call has
 * finished so the timer does not outlive the call:
 * <pre>
 * try (CancellationToken token = CancellationToken.cancelAfter(timeout, scheduler)) {
 *     return service.optimize(tasks, token);
 * }
 * </pre>
 */
public final class CancellationToken implements AutoCloseable {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private volatile String reason;
    private volatile ScheduledFuture<?> timer;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * A token that can never be cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Creates a token that cancels itself after {@code timeout}.
     *
     * @param timeout   delay before cancellation
     * @param scheduler scheduler owning the timer
     * @return new token
     */
    public static CancellationToken cancelAfter(Duration timeout, ScheduledExecutorService scheduler) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(scheduler, "scheduler");
        CancellationToken token = create();
        token.timer = scheduler.schedule(
                () -> token.cancel("Timed out after " + timeout.toMillis() + "ms"),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        return token;
    }

    /**
     * Requests cancellation. Subsequent calls keep the first reason.
     *
     * @throws UnsupportedOperationException on {@link #none()}
     */
    public synchronized void cancel(String reason) {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        if (this.reason == null) {
            this.reason = reason == null || reason.isBlank() ? "Cancelled" : reason;
        }
    }

    public boolean isCancelled() {
        return reason != null;
    }

    /**
     * Reason passed to {@link #cancel(String)}, or null while not cancelled.
     */
    public String reason() {
        return reason;
    }

    /**
     * Whether a {@link #cancelAfter} timer is still waiting to fire.
     */
    public boolean hasPendingTimer() {
        ScheduledFuture<?> pending = timer;
        return pending != null && !pending.isDone();
    }

    /**
     * Cancels the pending timer, if any, without cancelling the token. Idempotent.
     */
    @Override
    public void close() {
        ScheduledFuture<?> pending = timer;
        timer = null;
        if (pending != null) {
            pending.cancel(false);
        }
    }
}
