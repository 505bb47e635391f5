package com.phillippitts.imageoptimizer.exception;

/**
 * Thrown when the memory-mapped batch file cannot be created, sized, mapped, written or flushed.
 * No sidecar process has been started when this is raised.
 */
public class TransportException extends ImageOptimizerException {

    private final String filePath;

    public TransportException(String message, String filePath, Throwable cause) {
        super(filePath == null ? message : message + " (file: " + filePath + ")", cause);
        this.filePath = filePath;
    }

    public TransportException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * Backing file involved in the failure, or null if it was never created.
     */
    public String getFilePath() {
        return filePath;
    }
}
