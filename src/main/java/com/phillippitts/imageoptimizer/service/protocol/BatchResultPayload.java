package com.phillippitts.imageoptimizer.service.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final payload printed between the result markers: {@code {"results":[...],"metrics":{...}}}.
 *
 * @param results per-task results in batch order
 * @param metrics optional sidecar-side batch metrics, empty when absent
 */
public record BatchResultPayload(
        List<SidecarResult> results,
        Map<String, Object> metrics
) {

    public BatchResultPayload {
        results = List.copyOf(results);
        metrics = metrics == null ? Map.of() : withoutNulls(metrics);
    }

    // JSON nulls come through toMap() as Java nulls, which Map.copyOf rejects
    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
