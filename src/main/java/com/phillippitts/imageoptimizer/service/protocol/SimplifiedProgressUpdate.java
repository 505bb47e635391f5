package com.phillippitts.imageoptimizer.service.protocol;

import java.util.Map;

/**
 * Batch-level counter update.
 *
 * <pre>
 * {"type":"progress_update","completedTasks":3,"totalTasks":10,"progressPercentage":30,
 *  "status":"processing","metadata":{...}}
 * </pre>
 */
public record SimplifiedProgressUpdate(
        int completedTasks,
        int totalTasks,
        int progressPercentage,
        String status,
        Map<String, Object> metadata
) implements SidecarMessage {

    public SimplifiedProgressUpdate {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
