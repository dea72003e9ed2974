package com.seamtalk.relay;

/**
 * Outbound side of a relay client connection. Implementations are thread-safe and never throw:
 * a failed send means the client is gone, and the close callback follows.
 */
public interface ClientChannel {

    /** Connection identifier used in logs. */
    String id();

    void send(String text);

    void close(String reason);
}
