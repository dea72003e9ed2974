/**
 * Realtime speech session wire protocol: JSON text messages exchanged between client, relay
 * and the upstream recognition provider.
 *
 * <p>Parsing failures surface as {@link com.seamtalk.exception.ProtocolViolationException};
 * callers turn them into {@code error} messages or log them.
 */
package com.seamtalk.protocol;
