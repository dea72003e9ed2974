package com.seamtalk.transport;

import com.seamtalk.exception.UpstreamHandshakeException;
import com.seamtalk.exception.UpstreamTransportException;
import com.seamtalk.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * {@link SocketConnector} on top of the JDK {@link java.net.http.WebSocket} client.
 *
 * <p>The JDK client exposes the HTTP response of a rejected upgrade, which lets handshake
 * failures surface with provider status and body.
 */
public final class JdkSocketConnector implements SocketConnector {

    private static final Logger LOG = LogManager.getLogger(JdkSocketConnector.class);

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkSocketConnector(Duration connectTimeout) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build(), connectTimeout);
    }

    public JdkSocketConnector(HttpClient httpClient, Duration connectTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
    }

    @Override
    public CompletableFuture<TextSocket> connect(URI uri, Map<String, String> headers, SocketListener listener) {
        CompletableFuture<TextSocket> result = new CompletableFuture<>();
        WebSocket.Builder builder;
        try {
            builder = httpClient.newWebSocketBuilder().connectTimeout(connectTimeout);
            headers.forEach(builder::header);
        } catch (IllegalArgumentException e) {
            result.completeExceptionally(new UpstreamTransportException("Invalid handshake header: " + e.getMessage(), e));
            return result;
        }
        LOG.debug("Opening WebSocket to {}://{}{}", uri.getScheme(), uri.getHost(), uri.getPath());
        builder.buildAsync(uri, new ListenerAdapter(listener)).whenComplete((ws, err) -> {
            if (err != null) {
                result.completeExceptionally(translate(uri, err));
            } else {
                result.complete(new JdkTextSocket(ws));
            }
        });
        return result;
    }

    static RuntimeException translate(URI uri, Throwable err) {
        Throwable cause = err;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof WebSocketHandshakeException handshake) {
            HttpResponse<?> response = handshake.getResponse();
            return new UpstreamHandshakeException(response.statusCode(), bodyText(response.body()), handshake);
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new UpstreamTransportException("Connection to " + uri.getHost() + " failed: " + msg, cause);
    }

    private static String bodyText(Object body) {
        if (body == null) {
            return "";
        }
        if (body instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return String.valueOf(body);
    }

    /**
     * Joins fragmented frames and forwards complete messages. Binary frames are decoded as
     * UTF-8 text, matching what providers send on this protocol.
     */
    private static final class ListenerAdapter implements WebSocket.Listener {

        private final SocketListener delegate;
        private final StringBuilder text = new StringBuilder();
        private final ByteArrayOutputStream binary = new ByteArrayOutputStream();

        ListenerAdapter(SocketListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                String message = text.toString();
                text.setLength(0);
                deliver(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            binary.write(chunk, 0, chunk.length);
            if (last) {
                String message = binary.toString(StandardCharsets.UTF_8);
                binary.reset();
                deliver(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            try {
                delegate.onClosed(statusCode, reason == null ? "" : reason);
            } catch (RuntimeException e) {
                LOG.warn("Socket listener failed on close: {}", e.toString());
            }
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            try {
                delegate.onError(error);
            } catch (RuntimeException e) {
                LOG.warn("Socket listener failed on error: {}", e.toString());
            }
        }

        private void deliver(String message) {
            try {
                delegate.onText(message);
            } catch (RuntimeException e) {
                LOG.warn("Socket listener failed for message '{}': {}", LogSanitizer.preview(message), e.toString());
            }
        }
    }
}
