package com.phillippitts.imageoptimizer.presentation.controller;

import com.phillippitts.imageoptimizer.domain.ImageSettings;
import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.QualitySettings;
import com.phillippitts.imageoptimizer.domain.ResizeSettings;
import com.phillippitts.imageoptimizer.exception.ValidationException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * JSON request body element for the optimization endpoints.
 *
 * <pre>
 * {"input": "/photos/a.jpg", "output": "/out/a.webp", "quality": 80,
 *  "width": 1024, "maintainAspect": true, "outputFormat": "webp"}
 * </pre>
 * Only {@code input} and {@code output} are required.
 */
record ImageTaskRequest(
        String input,
        String output,
        Integer quality,
        Integer width,
        Integer height,
        Boolean maintainAspect,
        String resizeMode,
        Integer size,
        String outputFormat
) {

    ImageTask toTask() {
        if (input == null || input.isBlank()) {
            throw new ValidationException("input path is required");
        }
        if (output == null || output.isBlank()) {
            throw new ValidationException(input, "output path is required");
        }
        QualitySettings qualitySettings = quality == null
                ? QualitySettings.defaults()
                : QualitySettings.of(quality);
        ResizeSettings resize = new ResizeSettings(width, height,
                maintainAspect == null || maintainAspect,
                resizeMode == null || resizeMode.isBlank() ? defaultResizeMode() : resizeMode,
                size);
        return new ImageTask(toPath(input), toPath(output), new ImageSettings(qualitySettings, resize, outputFormat));
    }

    private String defaultResizeMode() {
        if (width != null && height == null) {
            return "width";
        }
        if (height != null && width == null) {
            return "height";
        }
        return ResizeSettings.MODE_NONE;
    }

    private static Path toPath(String value) {
        try {
            return Paths.get(value);
        } catch (InvalidPathException e) {
            throw new ValidationException(value, "not a valid path");
        }
    }
}
