package com.seamtalk.transport;

/**
 * Receives events of one {@link TextSocket}. Calls are serialized by the transport,
 * but arrive on transport threads; implementations hand off to their own executor.
 *
 * <p>Exactly one of {@link #onClosed(int, String)} or {@link #onError(Throwable)} ends the stream.
 */
public interface SocketListener {

    /** A complete text message (fragments already joined). */
    void onText(String text);

    /** The peer closed the connection. */
    void onClosed(int statusCode, String reason);

    /** Transport failure after the handshake. No further events follow. */
    void onError(Throwable error);
}
