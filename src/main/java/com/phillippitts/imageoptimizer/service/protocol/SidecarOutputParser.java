package com.phillippitts.imageoptimizer.service.protocol;

import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.OptimizationResult;
import com.phillippitts.imageoptimizer.domain.ProgressEvent;
import com.phillippitts.imageoptimizer.domain.ProgressType;
import com.phillippitts.imageoptimizer.exception.ProtocolException;
import com.phillippitts.imageoptimizer.service.progress.ProgressListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Stateful parser for the output of one sidecar run.
 *
 * <p>Lines between {@link ProtocolMarkers#BATCH_RESULT_START} and
 * {@link ProtocolMarkers#BATCH_RESULT_END} are buffered verbatim and parsed as the final payload
 * when the end marker arrives. Only exact marker lines frame the payload, so marker text inside a
 * JSON string is ordinary content. Every other line is decoded with
 * {@link SidecarMessageDecoder}; recognized messages become one {@link ProgressEvent} each and
 * are forwarded to the listener immediately, everything else is diagnostic text.
 *
 * <p>Terminal per-task outcomes seen in the progress stream are remembered so that a run which
 * dies before printing its payload still yields the tasks it finished. The framed payload, when
 * present, is authoritative and zipped positionally with the batch.
 *
 * <p>Not thread-safe; one instance per batch run, fed from a single thread.
 */
public final class SidecarOutputParser {

    private static final Logger LOG = LogManager.getLogger(SidecarOutputParser.class);

    private final List<ImageTask> tasks;
    private final Map<String, Integer> taskIndex;
    private final ProgressListener listener;
    private final boolean legacyFallback;

    private final StringBuilder payloadBuffer = new StringBuilder();
    private final TreeMap<Integer, OptimizationResult> streamedResults = new TreeMap<>();
    private boolean capturing;
    private List<OptimizationResult> payloadResults;
    private String lastUnframedPayload;

    public SidecarOutputParser(List<ImageTask> tasks, ProgressListener listener, boolean legacyFallback) {
        this.tasks = List.copyOf(Objects.requireNonNull(tasks, "tasks"));
        this.listener = Objects.requireNonNull(listener, "listener");
        this.legacyFallback = legacyFallback;
        this.taskIndex = new HashMap<>();
        for (int i = 0; i < this.tasks.size(); i++) {
            // First occurrence wins if the same input appears twice
            taskIndex.putIfAbsent(this.tasks.get(i).taskId(), i);
        }
    }

    /**
     * Consumes one trimmed output line.
     *
     * @throws ProtocolException if a framed payload is malformed
     */
    public void onLine(String line) {
        if (ProtocolMarkers.BATCH_RESULT_START.equals(line)) {
            LOG.debug("Received {} marker", ProtocolMarkers.BATCH_RESULT_START);
            capturing = true;
            payloadBuffer.setLength(0);
            return;
        }
        if (ProtocolMarkers.BATCH_RESULT_END.equals(line)) {
            if (!capturing) {
                LOG.warn("Ignoring {} without a preceding start marker", ProtocolMarkers.BATCH_RESULT_END);
                return;
            }
            capturing = false;
            completePayload();
            return;
        }
        if (capturing) {
            payloadBuffer.append(line).append('\n');
            return;
        }

        Optional<SidecarMessage> message = SidecarMessageDecoder.decode(line);
        if (message.isPresent()) {
            dispatch(message.get());
        } else if (legacyFallback && SidecarMessageDecoder.looksLikePayload(line)) {
            lastUnframedPayload = line;
        } else {
            LOG.trace("sidecar: {}", line);
        }
    }

    /**
     * Returns the final results once output has ended.
     *
     * @return framed payload results, or the legacy unframed payload when enabled
     * @throws ProtocolException if no results were received
     */
    public List<OptimizationResult> finish() {
        if (capturing) {
            LOG.warn("Sidecar output ended inside a result frame ({} buffered chars)", payloadBuffer.length());
        }
        if (payloadResults != null) {
            return payloadResults;
        }
        if (legacyFallback && lastUnframedPayload != null) {
            try {
                List<OptimizationResult> results = zip(SidecarMessageDecoder.decodePayload(lastUnframedPayload));
                LOG.debug("Using unframed result payload ({} results)", results.size());
                return results;
            } catch (IllegalArgumentException e) {
                LOG.debug("Unframed payload candidate rejected: {}", e.getMessage());
            }
        }
        throw new ProtocolException("No results received from sidecar", streamedResults(), null);
    }

    /**
     * Terminal outcomes seen in the progress stream so far, in batch order.
     */
    public List<OptimizationResult> streamedResults() {
        return List.copyOf(streamedResults.values());
    }

    /**
     * Best available results at this moment: the framed payload if one was parsed, otherwise
     * the streamed outcomes. Used when a run fails before {@link #finish()} would succeed.
     */
    public List<OptimizationResult> resultsSoFar() {
        return payloadResults != null ? payloadResults : streamedResults();
    }

    public boolean hasPayload() {
        return payloadResults != null;
    }

    private void completePayload() {
        String json = payloadBuffer.toString();
        payloadBuffer.setLength(0);
        BatchResultPayload payload;
        try {
            payload = SidecarMessageDecoder.decodePayload(json);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Malformed batch result payload: " + e.getMessage(), streamedResults(), e);
        }
        if (payloadResults != null) {
            LOG.warn("Sidecar printed more than one result payload; keeping the latest");
        }
        if (payload.results().size() != tasks.size()) {
            LOG.warn("Result payload has {} results for {} tasks", payload.results().size(), tasks.size());
        }
        payloadResults = zip(payload);
        LOG.debug("Parsed result payload: {} results, metrics={}", payloadResults.size(), payload.metrics());
    }

    private List<OptimizationResult> zip(BatchResultPayload payload) {
        int count = Math.min(payload.results().size(), tasks.size());
        List<OptimizationResult> results = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            results.add(ProgressNormalizer.toResult(payload.results().get(i), tasks.get(i)));
        }
        return List.copyOf(results);
    }

    private void dispatch(SidecarMessage message) {
        ProgressEvent event = ProgressNormalizer.normalize(message, this::findTask);
        recordTerminalOutcome(event);
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            LOG.warn("Progress listener failed for event type={}, task={}: {}",
                    event.type(), event.taskId(), e.toString());
        }
    }

    private void recordTerminalOutcome(ProgressEvent event) {
        if (event.result() == null || event.taskId() == null) {
            return;
        }
        if (event.type() != ProgressType.COMPLETE && event.type() != ProgressType.ERROR) {
            return;
        }
        Integer index = taskIndex.get(event.taskId());
        if (index == null) {
            LOG.debug("Progress for unknown task id: {}", event.taskId());
            return;
        }
        streamedResults.put(index, event.result());
    }

    private ImageTask findTask(String taskId) {
        Integer index = taskIndex.get(taskId);
        return index == null ? null : tasks.get(index);
    }
}
