/**
 * Startup checks for the external image sidecar.
 *
 * <p>{@link com.phillippitts.imageoptimizer.config.sidecar.SidecarValidationService} runs on
 * context start (disable with {@code optimizer.sidecar.validation-enabled=false}) and throws
 * {@link com.phillippitts.imageoptimizer.exception.SidecarNotFoundException} when the binary
 * cannot be launched.
 */
package com.phillippitts.imageoptimizer.config.sidecar;
