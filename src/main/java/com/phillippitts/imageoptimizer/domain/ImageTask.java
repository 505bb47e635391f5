package com.phillippitts.imageoptimizer.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One unit of work for the sidecar: read {@code inputPath}, write {@code outputPath}.
 *
 * <p>The input path doubles as the task identifier in the sidecar's progress stream, so it is
 * what streamed per-task outcomes are matched against.
 *
 * @param inputPath  source image
 * @param outputPath destination image
 * @param settings   encoding settings
 */
public record ImageTask(
        Path inputPath,
        Path outputPath,
        ImageSettings settings
) {

    public ImageTask {
        Objects.requireNonNull(inputPath, "Input path must not be null");
        Objects.requireNonNull(outputPath, "Output path must not be null");
        Objects.requireNonNull(settings, "Settings must not be null");
    }

    public static ImageTask of(Path inputPath, Path outputPath) {
        return new ImageTask(inputPath, outputPath, ImageSettings.defaults());
    }

    /**
     * Identifier the sidecar reports this task under.
     */
    public String taskId() {
        return inputPath.toString();
    }

    /**
     * Returns a copy writing to a different output path.
     */
    public ImageTask withOutputPath(Path newOutputPath) {
        return new ImageTask(inputPath, newOutputPath, settings);
    }
}
