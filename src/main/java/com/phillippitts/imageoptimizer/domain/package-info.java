/**
 * Immutable domain models shared by the pipeline and its callers.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.imageoptimizer.domain.ImageTask} - one input/output pair with
 *       its encoding settings</li>
 *   <li>{@link com.phillippitts.imageoptimizer.domain.OptimizationResult} - terminal outcome of a
 *       task as reported by the sidecar</li>
 *   <li>{@link com.phillippitts.imageoptimizer.domain.ProgressEvent} - normalized progress
 *       notification streamed while a batch runs</li>
 * </ul>
 *
 * <p>All types are records validated in their compact constructors.
 */
package com.phillippitts.imageoptimizer.domain;
