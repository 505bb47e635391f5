/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on the service layer, never the other way round. Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST endpoints</li>
 *   <li>{@code presentation.exception} - mapping of domain exceptions to HTTP responses</li>
 * </ul>
 */
package com.phillippitts.imageoptimizer.presentation;
