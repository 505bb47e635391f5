package com.phillippitts.imageoptimizer.service.sidecar;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir, Map<String, String> environment)
            throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        if (environment != null && !environment.isEmpty()) {
            pb.environment().putAll(environment);
        }
        // Both streams are read, but separately
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
