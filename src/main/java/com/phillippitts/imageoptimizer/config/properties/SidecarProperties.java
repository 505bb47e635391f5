package com.phillippitts.imageoptimizer.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the image optimization sidecar process.
 * Binds to properties prefixed with "optimizer.sidecar".
 *
 * <p>Example application.properties:
 * <pre>
 * optimizer.sidecar.binary-path=binaries/sharp-sidecar
 * optimizer.sidecar.command=optimize-batch-mmap
 * optimizer.sidecar.library-paths=binaries/libvips
 * optimizer.sidecar.environment.UV_THREADPOOL_SIZE=8
 * </pre>
 *
 * @param binaryPath   path to the sidecar executable
 * @param command      verb passed as the first argument, before the batch file path
 * @param libraryPaths directories prepended to {@code LD_LIBRARY_PATH} on Linux
 * @param environment  extra environment variables for the sidecar process
 */
@ConfigurationProperties(prefix = "optimizer.sidecar")
@Validated
public record SidecarProperties(
        @NotBlank(message = "Sidecar binary path must not be blank")
        @DefaultValue("binaries/sharp-sidecar")
        String binaryPath,

        @NotBlank(message = "Sidecar command must not be blank")
        @DefaultValue("optimize-batch-mmap")
        String command,

        List<String> libraryPaths,

        Map<String, String> environment
) {

    public static final String DEFAULT_COMMAND = "optimize-batch-mmap";

    public SidecarProperties {
        libraryPaths = libraryPaths == null ? List.of() : List.copyOf(libraryPaths);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static SidecarProperties of(String binaryPath) {
        return new SidecarProperties(binaryPath, DEFAULT_COMMAND, List.of(), Map.of());
    }
}
