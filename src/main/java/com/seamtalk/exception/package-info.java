/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend {@link com.seamtalk.exception.SeamTalkException}
 * so transport, protocol and collaborator failures can be handled in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.seamtalk.exception.DeviceUnavailableException} - microphone cannot be opened;
 *       the turn that needed it is aborted</li>
 *   <li>{@link com.seamtalk.exception.ProtocolViolationException} - malformed or out-of-order
 *       wire message; answered with an {@code error} event</li>
 *   <li>{@link com.seamtalk.exception.UpstreamHandshakeException} - WebSocket upgrade rejected,
 *       carries provider status and body</li>
 *   <li>{@link com.seamtalk.exception.UpstreamTransportException} - socket failed; no retry</li>
 *   <li>{@link com.seamtalk.exception.CollaboratorException} - translation / synthesis failure
 *       scoped to one turn</li>
 * </ul>
 *
 * @see com.seamtalk.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.seamtalk.exception;
