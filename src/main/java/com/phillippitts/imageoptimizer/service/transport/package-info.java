/**
 * Batch hand-off to the sidecar through memory-mapped temp files.
 *
 * <p>A {@link com.phillippitts.imageoptimizer.service.transport.TransportHandle} is created per
 * batch execution and released with try-with-resources once the sidecar has exited.
 */
package com.phillippitts.imageoptimizer.service.transport;
