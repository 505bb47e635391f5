/**
 * Sidecar process supervision: command construction, environment setup, output multiplexing,
 * cancellation and termination.
 */
package com.phillippitts.imageoptimizer.service.sidecar;
