package com.phillippitts.imageoptimizer.service.protocol;

import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.OptimizationResult;
import com.phillippitts.imageoptimizer.domain.ProgressEvent;
import com.phillippitts.imageoptimizer.domain.ProgressType;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns decoded sidecar messages into {@link ProgressEvent}s.
 *
 * <p>Each message yields exactly one event. Messages carrying size metrics get a human-readable
 * summary such as {@code "a.png optimized (12.50 KB saved / 42.5% compression)"}, which is stored
 * as the event's formatted message and under the {@code formattedMessage} metadata key.
 */
public final class ProgressNormalizer {

    public static final String KEY_FORMATTED_MESSAGE = "formattedMessage";
    public static final String KEY_FILE_NAME = "fileName";
    public static final String KEY_ORIGINAL_SIZE = "originalSize";
    public static final String KEY_OPTIMIZED_SIZE = "optimizedSize";
    public static final String KEY_SAVED_BYTES = "savedBytes";
    public static final String KEY_COMPRESSION_RATIO = "compressionRatio";
    public static final String KEY_FORMAT = "format";
    public static final String KEY_WORKER_ID = "workerId";
    public static final String KEY_SIDECAR_MESSAGE = "sidecarMessage";

    private ProgressNormalizer() {}

    /**
     * Normalizes any decoded message.
     *
     * @param message    decoded message
     * @param taskLookup resolves a task id to its task; may return null for unknown ids
     * @return normalized event
     */
    public static ProgressEvent normalize(SidecarMessage message, Function<String, ImageTask> taskLookup) {
        if (message instanceof ProgressMessage m) {
            return fromProgressMessage(m, taskLookup.apply(m.taskId()));
        }
        if (message instanceof SimplifiedProgressUpdate u) {
            return fromSimplifiedUpdate(u);
        }
        if (message instanceof DetailedProgressUpdate d) {
            return fromDetailedUpdate(d, taskLookup.apply(d.taskId()));
        }
        throw new IllegalArgumentException("Unsupported sidecar message: " + message.getClass().getName());
    }

    static ProgressEvent fromProgressMessage(ProgressMessage m, ImageTask task) {
        ProgressType type = switch (m.progressType()) {
            case ProgressMessage.START -> ProgressType.START;
            case ProgressMessage.COMPLETE -> ProgressType.COMPLETE;
            case ProgressMessage.ERROR -> ProgressType.ERROR;
            default -> ProgressType.UPDATE;
        };
        int completed = m.hasMetrics() ? m.completedTasks() : 0;
        int total = m.hasMetrics() ? m.totalTasks() : 0;

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (m.workerId() != null) {
            metadata.put(KEY_WORKER_ID, m.workerId());
        }

        OptimizationResult result = null;
        String formatted = null;
        String error = m.error();
        if (m.result() != null) {
            SidecarResult r = m.result();
            result = toResult(r, task);
            String fileName = fileName(r.path());
            formatted = String.format(Locale.ROOT, "%s optimized (%s KB saved / %s%% compression)",
                    fileName, formatKilobytes(r.savedBytes()), r.compressionRatio());
            putSizeMetadata(metadata, formatted, fileName, r.originalSize(), r.optimizedSize(),
                    r.savedBytes(), r.compressionRatio());
            if (error == null) {
                error = r.error();
            }
        } else if (type == ProgressType.ERROR) {
            String in = task != null ? task.inputPath().toString() : m.taskId();
            String out = task != null ? task.outputPath().toString() : m.taskId();
            result = OptimizationResult.failed(in, out, error);
            metadata.put(KEY_FILE_NAME, fileName(m.taskId()));
        }

        return new ProgressEvent(type, m.taskId(), percentage(completed, total), completed, total,
                m.progressType(), result, formatted, error, metadata);
    }

    static ProgressEvent fromSimplifiedUpdate(SimplifiedProgressUpdate u) {
        ProgressType type = switch (u.status()) {
            case "complete" -> ProgressType.COMPLETE;
            case "error" -> ProgressType.ERROR;
            default -> ProgressType.UPDATE;
        };
        Object formatted = u.metadata().get(KEY_FORMATTED_MESSAGE);
        Object error = u.metadata().get("error");
        return new ProgressEvent(type, null, clamp(u.progressPercentage()), u.completedTasks(), u.totalTasks(),
                u.status(), null,
                formatted instanceof String f ? f : null,
                error instanceof String err ? err : null,
                withoutNulls(u.metadata()));
    }

    static ProgressEvent fromDetailedUpdate(DetailedProgressUpdate d, ImageTask task) {
        DetailedProgressUpdate.OptimizationMetrics metrics = d.metrics();
        DetailedProgressUpdate.BatchCounters batch = d.batch();
        String fileName = d.fileName() == null || d.fileName().isBlank() ? fileName(d.taskId()) : d.fileName();
        String formatted = String.format(Locale.ROOT,
                "%s optimized (%s KB saved / %s%% compression) - Progress: %d%% (%d/%d)",
                fileName, formatKilobytes(metrics.savedBytes()), metrics.compressionRatio(),
                batch.progressPercentage(), batch.completedTasks(), batch.totalTasks());

        Map<String, Object> metadata = new LinkedHashMap<>();
        putSizeMetadata(metadata, formatted, fileName, metrics.originalSize(), metrics.optimizedSize(),
                metrics.savedBytes(), metrics.compressionRatio());
        if (metrics.format() != null) {
            metadata.put(KEY_FORMAT, metrics.format());
        }
        if (d.formattedMessage() != null) {
            metadata.put(KEY_SIDECAR_MESSAGE, d.formattedMessage());
        }

        // Detailed updates do not carry the written path; unknown tasks fall back to their id
        SidecarResult reported = new SidecarResult(task == null ? d.taskId() : null, metrics.originalSize(),
                metrics.optimizedSize(), metrics.savedBytes(), metrics.compressionRatio(), metrics.format(), true, null);
        return new ProgressEvent(ProgressType.COMPLETE, d.taskId(), clamp(batch.progressPercentage()),
                batch.completedTasks(), batch.totalTasks(), "complete", toResult(reported, task),
                formatted, null, metadata);
    }

    /**
     * Converts a sidecar result into the caller-facing result.
     *
     * <p>The optimized path is the file the sidecar reports having written, which differs from the
     * requested output when a format conversion changed the extension. The requested output is
     * used only when the sidecar reported no path. The original path comes from the task when known.
     */
    public static OptimizationResult toResult(SidecarResult r, ImageTask task) {
        boolean reportedPath = r.path() != null && !r.path().isBlank();
        String originalPath = task != null ? task.inputPath().toString() : r.path();
        String optimizedPath = reportedPath || task == null ? r.path() : task.outputPath().toString();
        return new OptimizationResult(originalPath, optimizedPath, r.originalSize(), r.optimizedSize(),
                r.savedBytes(), r.compressionRatioValue(), r.format(), r.success(), r.error());
    }

    /**
     * Last path segment, accepting both separators since the sidecar may report Windows paths.
     */
    static String fileName(String path) {
        if (path == null || path.isEmpty()) {
            return "unknown";
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String name = path.substring(slash + 1);
        return name.isEmpty() ? "unknown" : name;
    }

    static String formatKilobytes(long bytes) {
        return String.format(Locale.ROOT, "%.2f", bytes / 1024.0);
    }

    static int percentage(int completed, int total) {
        if (total <= 0) {
            return 0;
        }
        return clamp((int) ((completed * 100L) / total));
    }

    private static int clamp(int percentage) {
        return Math.max(0, Math.min(100, percentage));
    }

    private static void putSizeMetadata(Map<String, Object> metadata, String formatted, String fileName,
                                        long originalSize, long optimizedSize, long savedBytes,
                                        String compressionRatio) {
        metadata.put(KEY_FORMATTED_MESSAGE, formatted);
        metadata.put(KEY_FILE_NAME, fileName);
        metadata.put(KEY_ORIGINAL_SIZE, originalSize);
        metadata.put(KEY_OPTIMIZED_SIZE, optimizedSize);
        metadata.put(KEY_SAVED_BYTES, savedBytes);
        metadata.put(KEY_COMPRESSION_RATIO, compressionRatio);
    }

    // JSONObject.toMap() keeps JSON nulls as Java nulls, which Map.copyOf rejects
    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }
}
