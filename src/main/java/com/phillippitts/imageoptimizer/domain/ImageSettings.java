package com.phillippitts.imageoptimizer.domain;

import java.util.Objects;

/**
 * Per-task encoding settings. Opaque to the orchestrator beyond serialization.
 *
 * @param quality      compression quality
 * @param resize       resize instructions
 * @param outputFormat target format wire name, or "original" to keep the input format
 */
public record ImageSettings(
        QualitySettings quality,
        ResizeSettings resize,
        String outputFormat
) {

    public static final String ORIGINAL_FORMAT = "original";

    public ImageSettings {
        Objects.requireNonNull(quality, "Quality settings must not be null");
        Objects.requireNonNull(resize, "Resize settings must not be null");
        if (outputFormat == null || outputFormat.isBlank()) {
            outputFormat = ORIGINAL_FORMAT;
        }
    }

    public static ImageSettings defaults() {
        return new ImageSettings(QualitySettings.defaults(), ResizeSettings.none(), ORIGINAL_FORMAT);
    }
}
