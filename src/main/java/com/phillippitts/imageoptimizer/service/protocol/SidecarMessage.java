package com.phillippitts.imageoptimizer.service.protocol;

/**
 * Marker for the structured progress shapes the sidecar prints on its own lines.
 *
 * @see SidecarMessageDecoder
 */
public interface SidecarMessage {
}
