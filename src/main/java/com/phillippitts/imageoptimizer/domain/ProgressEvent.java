package com.phillippitts.imageoptimizer.domain;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized progress notification derived from one sidecar output line.
 *
 * <p>Events are handed to the progress listener as soon as they are parsed and are never
 * stored by the orchestrator.
 *
 * @param type             event kind
 * @param taskId           task the event refers to, or null for batch-level updates
 * @param percentage       batch completion percentage (0-100)
 * @param completedTasks   tasks completed so far in the batch
 * @param totalTasks       tasks in the batch
 * @param status           raw status string reported by the sidecar
 * @param result           per-task result snapshot, or null
 * @param formattedMessage human-readable summary, or null
 * @param error            error message for {@link ProgressType#ERROR} events, or null
 * @param metadata         extra fields such as fileName, savedBytes and compressionRatio
 */
public record ProgressEvent(
        ProgressType type,
        String taskId,
        int percentage,
        int completedTasks,
        int totalTasks,
        String status,
        OptimizationResult result,
        String formattedMessage,
        String error,
        Map<String, Object> metadata
) {

    public ProgressEvent {
        Objects.requireNonNull(type, "Progress type must not be null");
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("Percentage must be between 0 and 100, got: " + percentage);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Optional<OptimizationResult> resultOptional() {
        return Optional.ofNullable(result);
    }
}
