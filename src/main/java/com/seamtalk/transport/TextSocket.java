package com.seamtalk.transport;

/**
 * Outbound text WebSocket connection.
 *
 * <p>{@link #send(String)} is thread-safe and non-blocking: messages are queued and written in
 * call order. Callers on realtime threads (audio capture) may use it directly.
 */
public interface TextSocket {

    /** Queues a text frame. Silently ignored once the socket is closed. */
    void send(String text);

    /** Starts a normal closing handshake after all queued messages; aborts if the peer stalls. */
    void close(String reason);

    /** Tears the connection down immediately, discarding queued messages. Idempotent. */
    void abort();

    /** @return true while both directions are open */
    boolean isOpen();
}
