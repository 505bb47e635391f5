package com.phillippitts.imageoptimizer.domain;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Image formats the sidecar can read and write.
 */
public enum ImageFormat {
    JPEG("jpeg", Set.of("jpg", "jpeg")),
    PNG("png", Set.of("png")),
    WEBP("webp", Set.of("webp")),
    AVIF("avif", Set.of("avif"));

    private final String wireName;
    private final Set<String> extensions;

    ImageFormat(String wireName, Set<String> extensions) {
        this.wireName = wireName;
        this.extensions = extensions;
    }

    /**
     * Name used for this format in sidecar payloads and settings ("jpeg", "png", ...).
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a format from a file extension, case-insensitively and without the leading dot.
     *
     * @param extension file extension such as {@code "JPG"} or {@code "webp"}
     * @return matching format, or empty when unsupported
     */
    public static Optional<ImageFormat> fromExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        for (ImageFormat format : values()) {
            if (format.extensions.contains(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a format from the extension of the given path's file name.
     */
    public static Optional<ImageFormat> fromPath(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return fromExtension(name.substring(dot + 1));
    }
}
