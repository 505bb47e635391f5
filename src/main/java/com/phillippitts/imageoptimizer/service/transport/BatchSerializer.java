package com.phillippitts.imageoptimizer.service.transport;

import com.phillippitts.imageoptimizer.domain.ImageSettings;
import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.QualitySettings;
import com.phillippitts.imageoptimizer.domain.ResizeSettings;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Serializes a batch into the JSON array the sidecar reads from the batch file.
 *
 * <pre>
 * [{"input":"/in/a.png","output":"/out/a.webp","settings":{
 *    "quality":{"global":80,"jpeg":null,"png":null,"webp":85,"avif":null},
 *    "resize":{"width":null,"height":null,"maintainAspect":true,"mode":"none","size":null},
 *    "outputFormat":"webp"}}]
 * </pre>
 *
 * <p>Absent optional settings are written as explicit {@code null}; the sidecar distinguishes a
 * missing key from a null one.
 */
public final class BatchSerializer {

    private BatchSerializer() {
        // Utility class - prevent instantiation
    }

    public static byte[] serialize(List<ImageTask> batch) {
        return toJson(batch).toString().getBytes(StandardCharsets.UTF_8);
    }

    static JSONArray toJson(List<ImageTask> batch) {
        JSONArray array = new JSONArray();
        for (ImageTask task : batch) {
            JSONObject entry = new JSONObject();
            entry.put("input", task.inputPath().toString());
            entry.put("output", task.outputPath().toString());
            entry.put("settings", settingsJson(task.settings()));
            array.put(entry);
        }
        return array;
    }

    private static JSONObject settingsJson(ImageSettings settings) {
        JSONObject json = new JSONObject();
        json.put("quality", qualityJson(settings.quality()));
        json.put("resize", resizeJson(settings.resize()));
        json.put("outputFormat", settings.outputFormat());
        return json;
    }

    private static JSONObject qualityJson(QualitySettings quality) {
        JSONObject json = new JSONObject();
        json.put("global", quality.global());
        json.put("jpeg", nullable(quality.jpeg()));
        json.put("png", nullable(quality.png()));
        json.put("webp", nullable(quality.webp()));
        json.put("avif", nullable(quality.avif()));
        return json;
    }

    private static JSONObject resizeJson(ResizeSettings resize) {
        JSONObject json = new JSONObject();
        json.put("width", nullable(resize.width()));
        json.put("height", nullable(resize.height()));
        json.put("maintainAspect", resize.maintainAspect());
        json.put("mode", resize.mode());
        json.put("size", nullable(resize.size()));
        return json;
    }

    // JSONObject.put(key, null) removes the key
    private static Object nullable(Object value) {
        return value == null ? JSONObject.NULL : value;
    }
}
