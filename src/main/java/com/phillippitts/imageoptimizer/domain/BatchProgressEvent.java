package com.phillippitts.imageoptimizer.domain;

/**
 * Coarse progress across all chunks of one optimization call, published after each chunk.
 *
 * @param completed  tasks processed so far
 * @param total      tasks in the call
 * @param percentage completion percentage (0-100)
 * @param status     "processing" while chunks remain, "complete" at the end
 */
public record BatchProgressEvent(
        int completed,
        int total,
        int percentage,
        String status
) {

    public static final String STATUS_PROCESSING = "processing";
    public static final String STATUS_COMPLETE = "complete";

    public static BatchProgressEvent of(int completed, int total, String status) {
        int percentage = total == 0 ? 100 : (int) ((completed * 100L) / total);
        return new BatchProgressEvent(completed, total, percentage, status);
    }
}
