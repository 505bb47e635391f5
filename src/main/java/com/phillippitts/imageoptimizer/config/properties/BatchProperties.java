package com.phillippitts.imageoptimizer.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Batch sizing and transport file placement. Binds to "optimizer.batch".
 *
 * @param maxBatchSize largest number of tasks handed to one sidecar invocation
 * @param tempDir      directory for memory-mapped batch files; blank means {@code java.io.tmpdir}
 * @param filePrefix   file name prefix of batch files
 */
@ConfigurationProperties(prefix = "optimizer.batch")
@Validated
public record BatchProperties(
        @Min(value = 1, message = "Max batch size must be at least 1")
        @DefaultValue("500")
        int maxBatchSize,

        String tempDir,

        @NotBlank(message = "Batch file prefix must not be blank")
        @DefaultValue("image-optimizer-mmap")
        String filePrefix
) {

    public static final int DEFAULT_MAX_BATCH_SIZE = 500;
    public static final String DEFAULT_FILE_PREFIX = "image-optimizer-mmap";

    public BatchProperties {
        if (tempDir == null || tempDir.isBlank()) {
            tempDir = System.getProperty("java.io.tmpdir");
        }
    }

    public static BatchProperties defaults() {
        return new BatchProperties(DEFAULT_MAX_BATCH_SIZE, null, DEFAULT_FILE_PREFIX);
    }
}
