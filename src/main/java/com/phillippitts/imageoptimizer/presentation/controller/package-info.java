/**
 * REST API controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/images/optimize} - JSON array of tasks in, array of results out</li>
 *   <li>{@code POST /api/images/benchmark} - same body, timing summary out; outputs are discarded</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; errors are mapped by
 * {@link com.phillippitts.imageoptimizer.presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.imageoptimizer.presentation.controller;
