package com.phillippitts.imageoptimizer.service.orchestration;

import com.phillippitts.imageoptimizer.config.properties.ProtocolProperties;
import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.OptimizationResult;
import com.phillippitts.imageoptimizer.exception.PartialBatchException;
import com.phillippitts.imageoptimizer.exception.ProtocolException;
import com.phillippitts.imageoptimizer.exception.SidecarException;
import com.phillippitts.imageoptimizer.exception.SidecarExceptionBuilder;
import com.phillippitts.imageoptimizer.exception.TransportException;
import com.phillippitts.imageoptimizer.service.CancellationToken;
import com.phillippitts.imageoptimizer.service.metrics.BatchMetricsSink;
import com.phillippitts.imageoptimizer.service.progress.ProgressListener;
import com.phillippitts.imageoptimizer.service.protocol.SidecarOutputParser;
import com.phillippitts.imageoptimizer.service.sidecar.SidecarRunOutcome;
import com.phillippitts.imageoptimizer.service.sidecar.SidecarSupervisor;
import com.phillippitts.imageoptimizer.service.transport.BatchTransport;
import com.phillippitts.imageoptimizer.service.transport.TransportHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one batch through transport, sidecar and parser.
 *
 * <p>Batches are serialized: the sidecar of batch N is not spawned until batch N-1's sidecar has
 * terminated. The batch file is released on every exit path, after the sidecar has exited.
 *
 * <p>Failure mapping:
 * <ul>
 *   <li>batch file cannot be prepared: {@link TransportException}, no process started</li>
 *   <li>spawn failure, non-zero exit or cancellation: {@link SidecarException}</li>
 *   <li>malformed or missing result payload: {@link ProtocolException}</li>
 * </ul>
 * Both batch-level exceptions carry the results parsed before the failure.
 */
@Component
public class SidecarBatchExecutor {

    private static final Logger LOG = LogManager.getLogger(SidecarBatchExecutor.class);

    static final String MDC_BATCH_ID = "batchId";
    static final String MDC_BATCH_SIZE = "batchSize";

    private final BatchTransport transport;
    private final SidecarSupervisor supervisor;
    private final BatchMetricsSink metrics;
    private final boolean legacyFallback;
    private final ReentrantLock pipelineLock = new ReentrantLock(true);
    private final AtomicLong batchCounter = new AtomicLong();

    public SidecarBatchExecutor(BatchTransport transport,
                                SidecarSupervisor supervisor,
                                BatchMetricsSink metrics,
                                ProtocolProperties protocolProperties) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.metrics = metrics != null ? metrics : BatchMetricsSink.NOOP;
        this.legacyFallback = protocolProperties.legacyFallback();
    }

    /**
     * Executes one batch and returns its results in task order.
     *
     * @param batch    non-empty batch, at most the configured batch size
     * @param listener receives progress events while the sidecar runs
     * @param token    cancellation signal
     * @return one result per task reported by the sidecar
     */
    public List<OptimizationResult> executeBatch(List<ImageTask> batch, ProgressListener listener,
                                                 CancellationToken token) {
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(token, "token");
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("batch must not be empty");
        }

        acquirePipeline();
        String batchId = "batch-" + batchCounter.incrementAndGet();
        ThreadContext.put(MDC_BATCH_ID, batchId);
        ThreadContext.put(MDC_BATCH_SIZE, String.valueOf(batch.size()));
        long startTime = System.nanoTime();
        try {
            List<OptimizationResult> results = runBatch(batch, listener, token);
            metrics.recordBatch(batch.size(), System.nanoTime() - startTime);
            results.forEach(metrics::recordResult);
            LOG.info("Batch complete: tasks={}, results={}", batch.size(), results.size());
            return results;
        } catch (TransportException e) {
            metrics.recordFailure("transport");
            throw e;
        } catch (SidecarException e) {
            metrics.recordFailure(e.isCancelled() ? "cancelled" : "sidecar");
            throw e;
        } catch (ProtocolException e) {
            metrics.recordFailure("protocol");
            throw e;
        } finally {
            ThreadContext.remove(MDC_BATCH_ID);
            ThreadContext.remove(MDC_BATCH_SIZE);
            pipelineLock.unlock();
        }
    }

    private List<OptimizationResult> runBatch(List<ImageTask> batch, ProgressListener listener,
                                              CancellationToken token) {
        if (token.isCancelled()) {
            throw SidecarExceptionBuilder.create("Batch cancelled before start: " + token.reason())
                    .cancelled(true)
                    .build();
        }

        SidecarOutputParser parser = new SidecarOutputParser(batch, listener, legacyFallback);
        SidecarRunOutcome outcome;
        try (TransportHandle handle = transport.prepare(batch)) {
            outcome = supervisor.run(handle.path(), parser::onLine, token);
        } catch (PartialBatchException e) {
            throw e.getPartialResults().isEmpty() ? e.withPartialResults(parser.resultsSoFar()) : e;
        }

        if (outcome.cancelled()) {
            throw SidecarExceptionBuilder.create("Batch cancelled: " + token.reason())
                    .cancelled(true)
                    .exitCode(outcome.exitCode())
                    .durationMs(outcome.durationMs())
                    .partialResults(parser.resultsSoFar())
                    .build();
        }
        if (outcome.exitCode() != 0) {
            throw SidecarExceptionBuilder.create("Sidecar exited with non-zero status")
                    .exitCode(outcome.exitCode())
                    .durationMs(outcome.durationMs())
                    .partialResults(parser.resultsSoFar())
                    .metadata("output", outcome.outputTail())
                    .build();
        }
        return parser.finish();
    }

    private void acquirePipeline() {
        try {
            pipelineLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SidecarExceptionBuilder.create("Interrupted while waiting for the previous batch")
                    .cancelled(true)
                    .cause(e)
                    .build();
        }
    }
}
