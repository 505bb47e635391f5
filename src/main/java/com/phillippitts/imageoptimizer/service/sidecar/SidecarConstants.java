package com.phillippitts.imageoptimizer.service.sidecar;

/**
 * Constants for sidecar process supervision.
 */
final class SidecarConstants {

    /** Output lines kept for diagnostics in exception messages and run outcomes. */
    static final int OUTPUT_TAIL_LINES = 20;

    /** Cap on the diagnostic tail length in characters. */
    static final int OUTPUT_TAIL_MAX_CHARS = 4096;

    static final String LD_LIBRARY_PATH = "LD_LIBRARY_PATH";

    static final String STDOUT_READER_NAME = "sidecar-out";
    static final String STDERR_READER_NAME = "sidecar-err";

    private SidecarConstants() {
        // Constants class - prevent instantiation
    }
}
