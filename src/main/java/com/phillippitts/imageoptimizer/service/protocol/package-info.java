/**
 * Sidecar output protocol: newline-delimited UTF-8 text mixing diagnostics, JSON progress lines
 * and a final result payload framed by {@code BATCH_RESULT_START} / {@code BATCH_RESULT_END}.
 *
 * <p>{@link com.phillippitts.imageoptimizer.service.protocol.SidecarOutputParser} is the entry
 * point; decoding and normalization are pure functions and safe to call from any thread.
 */
package com.phillippitts.imageoptimizer.service.protocol;
