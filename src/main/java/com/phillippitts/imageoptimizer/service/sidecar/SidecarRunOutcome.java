package com.phillippitts.imageoptimizer.service.sidecar;

/**
 * How one sidecar invocation ended.
 *
 * @param exitCode   process exit code, or -1 if none could be obtained
 * @param cancelled  whether the run was stopped because its cancellation token fired
 * @param durationMs wall-clock time from spawn to exit
 * @param outputTail last output lines, for diagnostics
 */
public record SidecarRunOutcome(
        int exitCode,
        boolean cancelled,
        long durationMs,
        String outputTail
) {

    public boolean isSuccess() {
        return !cancelled && exitCode == 0;
    }
}
