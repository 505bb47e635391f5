package com.phillippitts.imageoptimizer.domain;

/**
 * Compression quality with optional per-format overrides.
 *
 * @param global quality applied when no format-specific override is set (1-100)
 * @param jpeg   JPEG override, or null
 * @param png    PNG override, or null
 * @param webp   WebP override, or null
 * @param avif   AVIF override, or null
 */
public record QualitySettings(
        int global,
        Integer jpeg,
        Integer png,
        Integer webp,
        Integer avif
) {

    public static final int DEFAULT_GLOBAL = 90;

    public static QualitySettings of(int global) {
        return new QualitySettings(global, null, null, null, null);
    }

    public static QualitySettings defaults() {
        return of(DEFAULT_GLOBAL);
    }
}
