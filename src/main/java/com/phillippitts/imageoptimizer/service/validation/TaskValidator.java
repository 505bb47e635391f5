package com.phillippitts.imageoptimizer.service.validation;

import com.phillippitts.imageoptimizer.domain.ImageFormat;
import com.phillippitts.imageoptimizer.domain.ImageSettings;
import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.QualitySettings;
import com.phillippitts.imageoptimizer.domain.ResizeSettings;
import com.phillippitts.imageoptimizer.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Checks tasks before any transport or process work.
 *
 * <p>Input must be an existing regular file with a supported extension, the output must have a
 * supported extension, and settings must be in range. A missing output directory is created.
 */
@Component
public class TaskValidator {

    private static final int MIN_QUALITY = 1;
    private static final int MAX_QUALITY = 100;

    /**
     * Validates every task, failing on the first invalid one.
     *
     * @throws ValidationException when a task is invalid
     */
    public void validate(List<ImageTask> tasks) {
        if (tasks == null) {
            throw new ValidationException("Task list is null");
        }
        for (ImageTask task : tasks) {
            validate(task);
        }
    }

    /**
     * @throws ValidationException when the task is invalid or its output directory cannot be created
     */
    public void validate(ImageTask task) {
        if (task == null) {
            throw new ValidationException("Task is null");
        }
        validateInput(task.inputPath());
        validateOutput(task.outputPath());
        validateSettings(task.settings(), task.inputPath().toString());
    }

    private void validateInput(Path input) {
        if (!Files.exists(input)) {
            throw new ValidationException(input.toString(), "Input file does not exist");
        }
        if (!Files.isRegularFile(input)) {
            throw new ValidationException(input.toString(), "Input is not a regular file");
        }
        if (ImageFormat.fromPath(input).isEmpty()) {
            throw new ValidationException(input.toString(), "Unsupported input format");
        }
    }

    private void validateOutput(Path output) {
        if (ImageFormat.fromPath(output).isEmpty()) {
            throw new ValidationException(output.toString(), "Unsupported output format");
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new ValidationException(output.toString(),
                        "Cannot create output directory " + parent + ": " + e.getMessage());
            }
        }
    }

    private void validateSettings(ImageSettings settings, String path) {
        QualitySettings quality = settings.quality();
        checkQuality(path, "global", quality.global());
        checkOptionalQuality(path, "jpeg", quality.jpeg());
        checkOptionalQuality(path, "png", quality.png());
        checkOptionalQuality(path, "webp", quality.webp());
        checkOptionalQuality(path, "avif", quality.avif());

        ResizeSettings resize = settings.resize();
        checkDimension(path, "width", resize.width());
        checkDimension(path, "height", resize.height());
        checkDimension(path, "size", resize.size());

        String format = settings.outputFormat();
        if (!ImageSettings.ORIGINAL_FORMAT.equals(format) && ImageFormat.fromExtension(format).isEmpty()) {
            throw new ValidationException(path, "Unsupported output format setting: " + format);
        }
    }

    private static void checkQuality(String path, String name, int value) {
        if (value < MIN_QUALITY || value > MAX_QUALITY) {
            throw new ValidationException(path, "Quality '" + name + "' must be between "
                    + MIN_QUALITY + " and " + MAX_QUALITY + ", got: " + value);
        }
    }

    private static void checkOptionalQuality(String path, String name, Integer value) {
        if (value != null) {
            checkQuality(path, name, value);
        }
    }

    private static void checkDimension(String path, String name, Integer value) {
        if (value != null && value <= 0) {
            throw new ValidationException(path, "Resize " + name + " must be positive, got: " + value);
        }
    }
}
