package com.phillippitts.imageoptimizer.service.sidecar;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of the sidecar supervisor.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub returning a fake
 * {@link Process} with scripted output and exit behavior.
 */
public interface ProcessFactory {

    /**
     * Starts a new process.
     *
     * @param command     full command line, executable first
     * @param workingDir  working directory, or null to inherit
     * @param environment variables added to (or overriding) the inherited environment
     * @return started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir, Map<String, String> environment) throws IOException;
}
