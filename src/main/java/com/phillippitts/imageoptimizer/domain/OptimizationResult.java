package com.phillippitts.imageoptimizer.domain;

import java.util.Objects;

/**
 * Terminal outcome of one task as reported by the sidecar.
 *
 * <p>A failed task is an ordinary result with {@code success == false} and an error message;
 * it does not fail the batch.
 *
 * @param originalPath     input path of the task
 * @param optimizedPath    output path written by the sidecar
 * @param originalSize     input size in bytes
 * @param optimizedSize    output size in bytes
 * @param savedBytes       bytes saved (negative when the output grew)
 * @param compressionRatio percentage saved
 * @param format           output format reported by the sidecar, or null
 * @param success          whether the sidecar reported success
 * @param error            error message for failed tasks, or null
 */
public record OptimizationResult(
        String originalPath,
        String optimizedPath,
        long originalSize,
        long optimizedSize,
        long savedBytes,
        double compressionRatio,
        String format,
        boolean success,
        String error
) {

    public OptimizationResult {
        Objects.requireNonNull(originalPath, "Original path must not be null");
        Objects.requireNonNull(optimizedPath, "Optimized path must not be null");
    }

    public static OptimizationResult failed(String originalPath, String optimizedPath, String error) {
        return new OptimizationResult(originalPath, optimizedPath, 0, 0, 0, 0.0, null, false, error);
    }
}
