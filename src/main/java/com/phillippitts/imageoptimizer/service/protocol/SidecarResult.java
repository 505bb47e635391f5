package com.phillippitts.imageoptimizer.service.protocol;

/**
 * Per-task result as the sidecar reports it (snake_case keys on the wire).
 *
 * @param path             file the sidecar wrote; its extension follows the output format, so it may
 *                         differ from the requested output path
 * @param originalSize     input size in bytes
 * @param optimizedSize    output size in bytes
 * @param savedBytes       bytes saved
 * @param compressionRatio percentage saved, as printed by the sidecar (usually a string such as "42.50")
 * @param format           output format, or null
 * @param success          whether the task succeeded
 * @param error            error message, or null
 */
public record SidecarResult(
        String path,
        long originalSize,
        long optimizedSize,
        long savedBytes,
        String compressionRatio,
        String format,
        boolean success,
        String error
) {

    /**
     * Numeric compression ratio; 0.0 when the sidecar printed something unparseable.
     */
    public double compressionRatioValue() {
        return SidecarMessageDecoder.parseRatio(compressionRatio);
    }
}
