package com.phillippitts.imageoptimizer.domain;

import java.util.Objects;

/**
 * Target dimensions for an optimization task.
 *
 * @param width          target width in pixels, or null
 * @param height         target height in pixels, or null
 * @param maintainAspect whether the sidecar keeps the aspect ratio
 * @param mode           one of "none", "width", "height", "longest", "shortest"
 * @param size           target size for the longest/shortest side modes, or null
 */
public record ResizeSettings(
        Integer width,
        Integer height,
        boolean maintainAspect,
        String mode,
        Integer size
) {

    public static final String MODE_NONE = "none";

    public ResizeSettings {
        Objects.requireNonNull(mode, "Resize mode must not be null");
    }

    public static ResizeSettings none() {
        return new ResizeSettings(null, null, true, MODE_NONE, null);
    }
}
