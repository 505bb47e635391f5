package com.phillippitts.imageoptimizer.testutil;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;

/**
 * Builders for the JSON lines a sidecar prints.
 */
public final class SidecarLines {

    public static final String START = "BATCH_RESULT_START";
    public static final String END = "BATCH_RESULT_END";

    private SidecarLines() {}

    /**
     * Successful result entry.
     *
     * @param writtenPath file the sidecar wrote, not the task's input
     */
    public static JSONObject result(String writtenPath, long originalSize, long optimizedSize) {
        long saved = originalSize - optimizedSize;
        String ratio = originalSize == 0 ? "0.00" : String.format(Locale.ROOT, "%.2f",
                saved * 100.0 / originalSize);
        return new JSONObject()
                .put("path", writtenPath)
                .put("original_size", originalSize)
                .put("optimized_size", optimizedSize)
                .put("saved_bytes", saved)
                .put("compression_ratio", ratio)
                .put("format", "png")
                .put("success", true);
    }

    public static JSONObject failedResult(String path, String error) {
        return new JSONObject()
                .put("path", path)
                .put("original_size", 0)
                .put("optimized_size", 0)
                .put("saved_bytes", 0)
                .put("compression_ratio", "0.00")
                .put("success", false)
                .put("error", error);
    }

    /**
     * Generic "complete" progress line for one task.
     */
    public static String complete(String taskId, JSONObject result, int completed, int total) {
        return new JSONObject()
                .put("progressType", "complete")
                .put("taskId", taskId)
                .put("workerId", 1)
                .put("result", result)
                .put("metrics", new JSONObject().put("completedTasks", completed).put("totalTasks", total))
                .toString();
    }

    /**
     * Framed payload as three output lines (start marker, JSON, end marker).
     */
    public static String framedPayload(List<JSONObject> results) {
        JSONObject payload = new JSONObject().put("results", new JSONArray(results));
        return START + "\n" + payload + "\n" + END;
    }

    public static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }
}
