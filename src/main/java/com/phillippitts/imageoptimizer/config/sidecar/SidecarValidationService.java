package com.phillippitts.imageoptimizer.config.sidecar;

import com.phillippitts.imageoptimizer.config.properties.SidecarProperties;
import com.phillippitts.imageoptimizer.exception.SidecarNotFoundException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Validates the sidecar binary at startup.
 *
 * Fail-fast: abort startup with an actionable message if the binary is missing, is not a
 * regular file, or is not executable. Configured library directories that do not exist are
 * reported as warnings only.
 */
@Component
@ConditionalOnProperty(name = "optimizer.sidecar.validation-enabled", havingValue = "true", matchIfMissing = true)
class SidecarValidationService {

    private static final Logger LOG = LogManager.getLogger(SidecarValidationService.class);

    private final SidecarProperties sidecar;

    SidecarValidationService(SidecarProperties sidecar) {
        this.sidecar = sidecar;
    }

    @PostConstruct
    void validateOnStartup() {
        LOG.info("Validating image sidecar... os={}, arch={}",
                System.getProperty("os.name"), System.getProperty("os.arch"));
        Path binary = validateBinary();
        validateLibraryPaths();
        LOG.info("Sidecar validation OK: binary='{}', command='{}'", binary, sidecar.command());
    }

    // Visible for tests
    Path validateBinary() {
        return validateBinary(System.getProperty("os.name", ""));
    }

    Path validateBinary(String osName) {
        Path binary = resolvePath(sidecar.binaryPath());

        if (!Files.exists(binary)) {
            throw new SidecarNotFoundException(binary.toString(),
                    "Sidecar binary not found: " + binary + " (configured as: " + sidecar.binaryPath() + ")");
        }
        if (!Files.isRegularFile(binary)) {
            throw new SidecarNotFoundException(binary.toString(),
                    "Sidecar binary is not a regular file: " + binary);
        }
        try {
            LOG.debug("Sidecar binary stats: size={} bytes, executable={}, lastModified={}",
                    Files.size(binary), Files.isExecutable(binary), Files.getLastModifiedTime(binary));
        } catch (IOException e) {
            LOG.debug("Could not read sidecar binary attributes: {}", e.toString());
        }
        if (!Files.isExecutable(binary)) {
            String hint = osName.toLowerCase(Locale.ROOT).contains("mac")
                    ? " (try: chmod +x '" + binary + "' && xattr -dr com.apple.quarantine '" + binary + "')"
                    : " (try: chmod +x '" + binary + "')";
            throw new SidecarNotFoundException(binary.toString(), "Sidecar binary not executable: " + binary + hint);
        }
        return binary;
    }

    void validateLibraryPaths() {
        for (String dir : sidecar.libraryPaths()) {
            if (!Files.isDirectory(Paths.get(dir))) {
                LOG.warn("Configured sidecar library directory does not exist: {}", dir);
            }
        }
    }

    /**
     * Resolves a configured path against the working directory when it is relative, logging a
     * warning since relative paths depend on where the application was launched.
     */
    private static Path resolvePath(String pathString) {
        Path path = Paths.get(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        Path resolved = Paths.get(".").toAbsolutePath().normalize().resolve(path).normalize();
        LOG.warn("Sidecar binary uses relative path '{}' - resolved to '{}'. "
                + "Consider an absolute path in production.", pathString, resolved);
        return resolved;
    }
}
