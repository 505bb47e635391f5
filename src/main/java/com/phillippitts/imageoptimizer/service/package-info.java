/**
 * Service layer for batch image optimization.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code batch} - splitting task lists into transfer-safe batches</li>
 *   <li>{@code transport} - memory-mapped hand-off of a batch to the sidecar</li>
 *   <li>{@code sidecar} - spawning and supervising the sidecar process</li>
 *   <li>{@code protocol} - parsing sidecar output into progress events and results</li>
 *   <li>{@code orchestration} - the caller-facing entry point tying the pipeline together</li>
 *   <li>{@code warmup} - one-off startup warmup</li>
 * </ul>
 */
package com.phillippitts.imageoptimizer.service;
