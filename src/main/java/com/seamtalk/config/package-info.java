/**
 * Spring configuration and typed properties.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.relay} - realtime relay endpoint and upstream provider</li>
 *   <li>{@code config.collaborators} - translation and speech providers behind the REST endpoints</li>
 *   <li>{@code config.client} - desktop hold-to-talk client (off unless {@code client.enabled=true})</li>
 *   <li>{@code config.hotkey} - talk key bindings</li>
 *   <li>{@code config.audio} - microphone capture</li>
 *   <li>{@code config.logging} - MDC seeding for HTTP requests</li>
 * </ul>
 *
 * @see com.seamtalk.config.ThreadPoolConfig
 */
package com.seamtalk.config;
