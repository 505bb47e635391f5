package com.phillippitts.imageoptimizer.service.sidecar;

import com.phillippitts.imageoptimizer.config.properties.SidecarProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the environment overrides for the sidecar process.
 *
 * <p>On Linux the native image library shipped next to the sidecar is not on the default loader
 * path, so configured library directories that exist are prepended to {@code LD_LIBRARY_PATH}.
 */
final class SidecarEnvironment {

    private static final Logger LOG = LogManager.getLogger(SidecarEnvironment.class);

    private SidecarEnvironment() {
        // Utility class - prevent instantiation
    }

    static Map<String, String> build(SidecarProperties properties) {
        return build(properties, System.getProperty("os.name", ""), System.getenv());
    }

    static Map<String, String> build(SidecarProperties properties, String osName,
                                     Map<String, String> inherited) {
        Map<String, String> env = new LinkedHashMap<>(properties.environment());
        if (!osName.toLowerCase(Locale.ROOT).contains("linux")) {
            return env;
        }

        List<String> entries = new ArrayList<>();
        for (String dir : properties.libraryPaths()) {
            Path path = Path.of(dir).toAbsolutePath().normalize();
            if (Files.isDirectory(path)) {
                entries.add(path.toString());
            } else {
                LOG.debug("Skipping missing sidecar library directory: {}", path);
            }
        }
        if (entries.isEmpty()) {
            return env;
        }

        String existing = env.getOrDefault(SidecarConstants.LD_LIBRARY_PATH,
                inherited.getOrDefault(SidecarConstants.LD_LIBRARY_PATH, ""));
        if (!existing.isEmpty()) {
            entries.add(existing);
        }
        String value = String.join(":", entries);
        LOG.debug("Setting LD_LIBRARY_PATH for sidecar: {}", value);
        env.put(SidecarConstants.LD_LIBRARY_PATH, value);
        return env;
    }
}
