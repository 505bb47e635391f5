package com.phillippitts.imageoptimizer.presentation.controller;

import com.phillippitts.imageoptimizer.domain.ImageSettings;
import com.phillippitts.imageoptimizer.domain.ImageTask;
import com.phillippitts.imageoptimizer.domain.QualitySettings;
import com.phillippitts.imageoptimizer.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageTaskRequestTest {

    @Test
    void minimalRequestUsesDefaults() {
        ImageTask task = new ImageTaskRequest("/in/a.jpg", "/out/a.jpg", null, null, null, null, null, null, null)
                .toTask();

        assertThat(task.inputPath()).isEqualTo(Path.of("/in/a.jpg"));
        assertThat(task.outputPath()).isEqualTo(Path.of("/out/a.jpg"));
        assertThat(task.settings().quality().global()).isEqualTo(QualitySettings.DEFAULT_GLOBAL);
        assertThat(task.settings().resize().mode()).isEqualTo("none");
        assertThat(task.settings().resize().maintainAspect()).isTrue();
        assertThat(task.settings().outputFormat()).isEqualTo(ImageSettings.ORIGINAL_FORMAT);
    }

    @Test
    void singleDimensionPicksMatchingResizeMode() {
        ImageTask byWidth = new ImageTaskRequest("/in/a.jpg", "/out/a.webp", 75, 1024, null, null, null, null, "webp")
                .toTask();
        ImageTask byHeight = new ImageTaskRequest("/in/a.jpg", "/out/a.jpg", null, null, 768, false, null, null, null)
                .toTask();

        assertThat(byWidth.settings().resize().mode()).isEqualTo("width");
        assertThat(byWidth.settings().quality().global()).isEqualTo(75);
        assertThat(byWidth.settings().outputFormat()).isEqualTo("webp");
        assertThat(byHeight.settings().resize().mode()).isEqualTo("height");
        assertThat(byHeight.settings().resize().maintainAspect()).isFalse();
    }

    @Test
    void explicitResizeModeIsKept() {
        ImageTask task = new ImageTaskRequest("/in/a.jpg", "/out/a.jpg", null, null, null, null, "longest", 2000, null)
                .toTask();

        assertThat(task.settings().resize().mode()).isEqualTo("longest");
        assertThat(task.settings().resize().size()).isEqualTo(2000);
    }

    @Test
    void missingPathsAreRejected() {
        assertThatThrownBy(() -> new ImageTaskRequest(null, "/out/a.jpg", null, null, null, null, null, null, null)
                .toTask())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("input path is required");
        assertThatThrownBy(() -> new ImageTaskRequest("/in/a.jpg", " ", null, null, null, null, null, null, null)
                .toTask())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("output path is required");
    }

    @Test
    void invalidPathIsRejected() {
        assertThatThrownBy(() -> new ImageTaskRequest("/in/a\0.jpg", "/out/a.jpg", null, null, null, null, null, null,
                null).toTask())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not a valid path");
    }
}
