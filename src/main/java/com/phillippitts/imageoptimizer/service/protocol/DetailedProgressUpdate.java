package com.phillippitts.imageoptimizer.service.protocol;

/**
 * Per-file completion with size metrics and batch counters.
 *
 * @param fileName         display name of the file
 * @param taskId           task identifier (the input path)
 * @param metrics          size metrics of the finished file
 * @param batch            batch counters at the time the file finished
 * @param formattedMessage message composed by the sidecar, or null; kept in the event metadata
 */
public record DetailedProgressUpdate(
        String fileName,
        String taskId,
        OptimizationMetrics metrics,
        BatchCounters batch,
        String formattedMessage
) implements SidecarMessage {

    /**
     * @param compressionRatio ratio as printed by the sidecar
     * @param format           output format, or null
     */
    public record OptimizationMetrics(
            long originalSize,
            long optimizedSize,
            long savedBytes,
            String compressionRatio,
            String format
    ) {
    }

    public record BatchCounters(
            int completedTasks,
            int totalTasks,
            int progressPercentage
    ) {
    }
}
