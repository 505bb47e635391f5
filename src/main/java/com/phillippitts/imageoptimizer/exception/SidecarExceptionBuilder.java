package com.phillippitts.imageoptimizer.exception;

import com.phillippitts.imageoptimizer.domain.OptimizationResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for {@link SidecarException} with process context folded into the message.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw SidecarExceptionBuilder.create("Sidecar exited with non-zero status")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .partialResults(parsedSoFar)
 *         .metadata("binaryPath", binaryPath)
 *         .metadata("output", outputTail)
 *         .build();
 * </pre>
 */
public final class SidecarExceptionBuilder {

    private final String message;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private boolean cancelled;
    private List<OptimizationResult> partialResults = List.of();
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private SidecarExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static SidecarExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new SidecarExceptionBuilder(message);
    }

    public SidecarExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public SidecarExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public SidecarExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Marks the failure as caused by cancellation rather than by the sidecar itself.
     */
    public SidecarExceptionBuilder cancelled(boolean cancelled) {
        this.cancelled = cancelled;
        return this;
    }

    public SidecarExceptionBuilder partialResults(List<OptimizationResult> partialResults) {
        this.partialResults = partialResults == null ? List.of() : partialResults;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * <p>Common keys: binaryPath, transportFile, output.
     */
    public SidecarExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, cancelled=true, {key1}={val1}, ...)
     * </pre>
     */
    public SidecarException build() {
        int code = exitCode != null ? exitCode : SidecarException.NO_EXIT_CODE;
        return new SidecarException(buildDetailedMessage(), code, cancelled, partialResults, cause);
    }

    private String buildDetailedMessage() {
        StringBuilder details = new StringBuilder();
        if (exitCode != null) {
            appendDetail(details, "exitCode", String.valueOf(exitCode));
        }
        if (durationMs != null) {
            appendDetail(details, "durationMs", String.valueOf(durationMs));
        }
        if (cancelled) {
            appendDetail(details, "cancelled", "true");
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            appendDetail(details, entry.getKey(), entry.getValue());
        }
        if (details.isEmpty()) {
            return message;
        }
        return message + " (" + details + ")";
    }

    private static void appendDetail(StringBuilder sb, String key, String value) {
        if (!sb.isEmpty()) {
            sb.append(", ");
        }
        sb.append(key).append('=').append(value);
    }
}
