package com.seamtalk.transport;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Opens outbound WebSocket connections. Test seam for the relay bridge and the client session.
 */
public interface SocketConnector {

    /**
     * Starts the opening handshake.
     *
     * @param uri      ws:// or wss:// endpoint
     * @param headers  extra handshake headers (e.g. {@code Authorization})
     * @param listener receives messages once the connection is open
     * @return future completed with the open socket, or failed with
     *         {@link com.seamtalk.exception.UpstreamHandshakeException} when the server answers the
     *         upgrade with an HTTP error, or {@link com.seamtalk.exception.UpstreamTransportException}
     *         for any other failure
     */
    CompletableFuture<TextSocket> connect(URI uri, Map<String, String> headers, SocketListener listener);
}
