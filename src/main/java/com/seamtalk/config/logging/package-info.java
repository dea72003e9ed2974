/**
 * Logging infrastructure and MDC (Log4j2 ThreadContext) seeding.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - one per HTTP request, set by {@link com.seamtalk.config.logging.MdcFilter}</li>
 *   <li>{@code connectionId} - one per relayed client connection, set on the bridge's executor</li>
 *   <li>{@code turnId} - one per hold-to-talk turn on the client</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId] [connectionId] [turnId] LEVEL logger.name - message
 * </pre>
 */
package com.seamtalk.config.logging;
