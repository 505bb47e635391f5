/**
 * Logging infrastructure and ThreadContext (MDC) keys.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, set by
 *       {@link com.phillippitts.imageoptimizer.config.logging.MdcFilter}</li>
 *   <li>{@code batchId}, {@code batchSize} - per sidecar run, set by the batch executor</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [batch-pool-1] [requestId] [batch-3] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.imageoptimizer.config.logging;
