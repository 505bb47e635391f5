package com.phillippitts.imageoptimizer.service.protocol;

/**
 * Exact output lines framing the sidecar's final result payload.
 */
public final class ProtocolMarkers {

    public static final String BATCH_RESULT_START = "BATCH_RESULT_START";
    public static final String BATCH_RESULT_END = "BATCH_RESULT_END";

    private ProtocolMarkers() {
        // Constants class - prevent instantiation
    }
}
