package com.seamtalk.transport;

import com.seamtalk.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TextSocket} over a JDK WebSocket.
 *
 * <p>The JDK client rejects a send while the previous one is pending, so sends are chained:
 * each message is written after the previous write completed, failed or not.
 */
final class JdkTextSocket implements TextSocket {

    private static final Logger LOG = LogManager.getLogger(JdkTextSocket.class);

    /** RFC 6455 caps the close reason at 123 bytes of UTF-8. */
    private static final int MAX_CLOSE_REASON_BYTES = 123;

    private final WebSocket webSocket;
    private final Object lock = new Object();
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

    JdkTextSocket(WebSocket webSocket) {
        this.webSocket = webSocket;
    }

    @Override
    public void send(String text) {
        if (closing.get() || webSocket.isOutputClosed()) {
            LOG.trace("Dropping send on closed socket");
            return;
        }
        synchronized (lock) {
            CompletableFuture<WebSocket> next = tail.handle((r, e) -> null)
                    .thenCompose(ignored -> webSocket.sendText(text, true));
            next.whenComplete((ws, err) -> {
                if (err != null) {
                    LOG.debug("WebSocket send failed: {}", err.toString());
                }
            });
            tail = next;
        }
    }

    @Override
    public void close(String reason) {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        String safeReason = limitReason(reason);
        synchronized (lock) {
            tail = tail.handle((r, e) -> null)
                    .thenCompose(ignored -> webSocket.sendClose(WebSocket.NORMAL_CLOSURE, safeReason));
        }
        CompletableFuture.delayedExecutor(ProcessTimeouts.SOCKET_CLOSE_GRACE.toMillis(), TimeUnit.MILLISECONDS)
                .execute(() -> {
                    if (!webSocket.isInputClosed()) {
                        LOG.debug("Peer did not complete closing handshake; aborting");
                        webSocket.abort();
                    }
                });
    }

    @Override
    public void abort() {
        closing.set(true);
        webSocket.abort();
    }

    @Override
    public boolean isOpen() {
        return !closing.get() && !webSocket.isOutputClosed() && !webSocket.isInputClosed();
    }

    static String limitReason(String reason) {
        if (reason == null) {
            return "";
        }
        String r = reason;
        while (r.getBytes(StandardCharsets.UTF_8).length > MAX_CLOSE_REASON_BYTES) {
            r = r.substring(0, r.offsetByCodePoints(r.length(), -1));
        }
        return r;
    }
}
