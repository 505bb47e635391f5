package com.phillippitts.imageoptimizer.service.protocol;

/**
 * Generic per-task progress message.
 *
 * <pre>
 * {"type":"progress","progressType":"complete","taskId":"/in/a.png","workerId":2,
 *  "result":{...},"metrics":{"completedTasks":3,"totalTasks":10}}
 * </pre>
 *
 * @param progressType   one of start, progress, complete, error
 * @param taskId         task identifier (the input path)
 * @param workerId       sidecar worker that handled the task, or null
 * @param result         task result for complete messages, or null
 * @param error          error text for error messages, or null
 * @param completedTasks batch counter, or null when the message carries no metrics
 * @param totalTasks     batch size, or null when the message carries no metrics
 */
public record ProgressMessage(
        String progressType,
        String taskId,
        String workerId,
        SidecarResult result,
        String error,
        Integer completedTasks,
        Integer totalTasks
) implements SidecarMessage {

    public static final String START = "start";
    public static final String PROGRESS = "progress";
    public static final String COMPLETE = "complete";
    public static final String ERROR = "error";

    public boolean hasMetrics() {
        return completedTasks != null && totalTasks != null;
    }
}
