package com.phillippitts.imageoptimizer.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Startup warmup options. Binds to "optimizer.warmup".
 *
 * @param enabled whether a sample image is pushed through the pipeline once the application is ready
 * @param timeout how long the warmup may run before it is cancelled
 */
@ConfigurationProperties(prefix = "optimizer.warmup")
@Validated
public record WarmupProperties(
        @DefaultValue("true")
        boolean enabled,

        @NotNull
        @DefaultValue("30s")
        Duration timeout
) {
}
