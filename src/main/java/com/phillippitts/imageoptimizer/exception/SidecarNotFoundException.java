package com.phillippitts.imageoptimizer.exception;

/**
 * Thrown when the sidecar binary is missing or cannot be executed.
 * Raised at startup so a misconfigured deployment fails before serving requests.
 */
public class SidecarNotFoundException extends ImageOptimizerException {

    private final String binaryPath;

    public SidecarNotFoundException(String binaryPath, String message) {
        super(message);
        this.binaryPath = binaryPath;
    }

    public SidecarNotFoundException(String binaryPath, String message, Throwable cause) {
        super(message, cause);
        this.binaryPath = binaryPath;
    }

    public String getBinaryPath() {
        return binaryPath;
    }
}
