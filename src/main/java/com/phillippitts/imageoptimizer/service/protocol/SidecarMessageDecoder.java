package com.phillippitts.imageoptimizer.service.protocol;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Decodes single sidecar output lines into {@link SidecarMessage}s and the framed payload into a
 * {@link BatchResultPayload}.
 *
 * <p>Line shapes are tried in a fixed order: generic progress message, simplified update,
 * detailed update. The first shape whose required fields are all present with the right JSON
 * types wins; unknown keys are ignored. Lines matching no shape are diagnostic text.
 */
public final class SidecarMessageDecoder {

    private static final Set<String> PROGRESS_TYPES = Set.of(
            ProgressMessage.START, ProgressMessage.PROGRESS, ProgressMessage.COMPLETE, ProgressMessage.ERROR);

    private static final List<Function<JSONObject, Optional<? extends SidecarMessage>>> DECODERS = List.of(
            SidecarMessageDecoder::decodeProgressMessage,
            SidecarMessageDecoder::decodeSimplifiedUpdate,
            SidecarMessageDecoder::decodeDetailedUpdate
    );

    private SidecarMessageDecoder() {}

    /**
     * Decodes one output line.
     *
     * @param line trimmed output line
     * @return decoded message, or empty for non-JSON or unrecognized lines
     */
    public static Optional<SidecarMessage> decode(String line) {
        Optional<JSONObject> json = parseObject(line);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        for (Function<JSONObject, Optional<? extends SidecarMessage>> decoder : DECODERS) {
            Optional<? extends SidecarMessage> message = decoder.apply(json.get());
            if (message.isPresent()) {
                return Optional.of(message.get());
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a line as a JSON object, or returns empty if it is not one.
     */
    static Optional<JSONObject> parseObject(String line) {
        if (line == null || line.isEmpty() || line.charAt(0) != '{') {
            return Optional.empty();
        }
        try {
            return Optional.of(new JSONObject(line));
        } catch (JSONException e) {
            return Optional.empty();
        }
    }

    /**
     * Decodes the framed result payload.
     *
     * @param json payload text (may span several lines)
     * @return decoded payload
     * @throws IllegalArgumentException if the text is not valid JSON or lacks a well-formed
     *                                  {@code results} array
     */
    public static BatchResultPayload decodePayload(String json) {
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Result payload is not a JSON object: " + e.getMessage(), e);
        }
        JSONArray array = obj.optJSONArray("results");
        if (array == null) {
            throw new IllegalArgumentException("Result payload has no 'results' array");
        }
        List<SidecarResult> results = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject entry = array.optJSONObject(i);
            SidecarResult result = entry == null ? null : decodeResult(entry).orElse(null);
            if (result == null) {
                throw new IllegalArgumentException("Malformed result at index " + i);
            }
            results.add(result);
        }
        JSONObject metrics = obj.optJSONObject("metrics");
        Map<String, Object> metricsMap = metrics == null ? Map.of() : metrics.toMap();
        return new BatchResultPayload(results, metricsMap);
    }

    /**
     * Whether a line looks like an unframed result payload (an object with a results array).
     */
    static boolean looksLikePayload(String line) {
        return parseObject(line).map(o -> o.optJSONArray("results") != null).orElse(false);
    }

    static Optional<ProgressMessage> decodeProgressMessage(JSONObject obj) {
        String progressType = string(obj, "progressType");
        String taskId = string(obj, "taskId");
        if (progressType == null || taskId == null || !PROGRESS_TYPES.contains(progressType)) {
            return Optional.empty();
        }

        SidecarResult result = null;
        if (isPresent(obj, "result")) {
            JSONObject raw = obj.optJSONObject("result");
            result = raw == null ? null : decodeResult(raw).orElse(null);
            if (result == null) {
                return Optional.empty();
            }
        }

        Integer completed = null;
        Integer total = null;
        if (isPresent(obj, "metrics")) {
            JSONObject metrics = obj.optJSONObject("metrics");
            completed = metrics == null ? null : count(metrics, "completedTasks");
            total = metrics == null ? null : count(metrics, "totalTasks");
            if (completed == null || total == null) {
                return Optional.empty();
            }
        }

        Object worker = obj.opt("workerId");
        String workerId = worker == null || JSONObject.NULL.equals(worker) ? null : String.valueOf(worker);
        return Optional.of(new ProgressMessage(progressType, taskId, workerId, result,
                string(obj, "error"), completed, total));
    }

    static Optional<SimplifiedProgressUpdate> decodeSimplifiedUpdate(JSONObject obj) {
        Integer completed = count(obj, "completedTasks");
        Integer total = count(obj, "totalTasks");
        Integer percentage = count(obj, "progressPercentage");
        String status = string(obj, "status");
        if (completed == null || total == null || percentage == null || status == null) {
            return Optional.empty();
        }
        JSONObject metadata = obj.optJSONObject("metadata");
        return Optional.of(new SimplifiedProgressUpdate(completed, total, percentage, status,
                metadata == null ? Map.of() : metadata.toMap()));
    }

    static Optional<DetailedProgressUpdate> decodeDetailedUpdate(JSONObject obj) {
        String fileName = string(obj, "fileName");
        String taskId = string(obj, "taskId");
        JSONObject metricsJson = obj.optJSONObject("optimizationMetrics");
        JSONObject batchJson = obj.optJSONObject("batchMetrics");
        if (fileName == null || taskId == null || metricsJson == null || batchJson == null) {
            return Optional.empty();
        }

        Long originalSize = integer(metricsJson, "originalSize");
        Long optimizedSize = integer(metricsJson, "optimizedSize");
        Long savedBytes = integer(metricsJson, "savedBytes");
        String ratio = ratioText(metricsJson, "compressionRatio");
        Integer completed = count(batchJson, "completedTasks");
        Integer total = count(batchJson, "totalTasks");
        Integer percentage = count(batchJson, "progressPercentage");
        if (originalSize == null || optimizedSize == null || savedBytes == null || ratio == null
                || completed == null || total == null || percentage == null) {
            return Optional.empty();
        }

        DetailedProgressUpdate.OptimizationMetrics metrics = new DetailedProgressUpdate.OptimizationMetrics(
                originalSize, optimizedSize, savedBytes, ratio, string(metricsJson, "format"));
        DetailedProgressUpdate.BatchCounters batch =
                new DetailedProgressUpdate.BatchCounters(completed, total, percentage);
        return Optional.of(new DetailedProgressUpdate(fileName, taskId, metrics, batch,
                string(obj, "formattedMessage")));
    }

    static Optional<SidecarResult> decodeResult(JSONObject obj) {
        String path = string(obj, "path");
        Long originalSize = integer(obj, "original_size");
        Long optimizedSize = integer(obj, "optimized_size");
        Long savedBytes = integer(obj, "saved_bytes");
        String ratio = ratioText(obj, "compression_ratio");
        Object success = obj.opt("success");
        if (path == null || originalSize == null || optimizedSize == null || savedBytes == null
                || ratio == null || !(success instanceof Boolean)) {
            return Optional.empty();
        }
        return Optional.of(new SidecarResult(path, originalSize, optimizedSize, savedBytes, ratio,
                string(obj, "format"), (Boolean) success, string(obj, "error")));
    }

    /**
     * Parses a printed compression ratio, falling back to 0.0.
     */
    static double parseRatio(String text) {
        if (text == null) {
            return 0.0;
        }
        try {
            double value = Double.parseDouble(text.trim());
            return Double.isFinite(value) ? value : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static boolean isPresent(JSONObject obj, String key) {
        return obj.has(key) && !obj.isNull(key);
    }

    private static String string(JSONObject obj, String key) {
        Object value = obj.opt(key);
        return value instanceof String s ? s : null;
    }

    // Integral JSON numbers only; 3.0 is not a count
    private static Long integer(JSONObject obj, String key) {
        Object value = obj.opt(key);
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        return null;
    }

    private static Integer count(JSONObject obj, String key) {
        Long value = integer(obj, key);
        if (value == null || value < 0 || value > Integer.MAX_VALUE) {
            return null;
        }
        return value.intValue();
    }

    // The sidecar prints ratios with toFixed(), so strings are normal; numbers are accepted too
    private static String ratioText(JSONObject obj, String key) {
        Object value = obj.opt(key);
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        return null;
    }
}
