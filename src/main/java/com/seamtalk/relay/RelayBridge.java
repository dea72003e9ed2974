package com.seamtalk.relay;

import com.seamtalk.config.relay.RelayProperties;
import com.seamtalk.domain.Direction;
import com.seamtalk.domain.SessionConfiguration;
import com.seamtalk.exception.ProtocolViolationException;
import com.seamtalk.exception.UpstreamHandshakeException;
import com.seamtalk.protocol.ClientMessage;
import com.seamtalk.protocol.RecognitionEvent;
import com.seamtalk.protocol.RecognitionEventType;
import com.seamtalk.protocol.WireMessages;
import com.seamtalk.service.metrics.RelayMetrics;
import com.seamtalk.transport.SocketConnector;
import com.seamtalk.transport.SocketListener;
import com.seamtalk.transport.TextSocket;
import com.seamtalk.util.LogSanitizer;
import com.seamtalk.util.concurrent.SerialExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Bridges one client connection to one upstream recognition connection.
 *
 * <p>All state is confined to the bridge's {@link SerialExecutor}: client messages, upstream
 * messages and connect results are queued there and handled one at a time, so the bridge
 * needs no locks. Public methods only enqueue.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>The first valid {@code session.update} fixes the {@link SessionConfiguration} and starts
 *       the upstream handshake. Anything else before it is answered with {@code error}.</li>
 *   <li>While the handshake is pending, client messages are queued (bounded); once open, the
 *       original {@code session.update} is sent first, then the queue in order.</li>
 *   <li>Completed transcripts coming back are annotated with the resolved direction.</li>
 *   <li>When either side goes away the other is torn down. There is no reconnect.</li>
 * </ol>
 */
public final class RelayBridge {

    private static final Logger LOG = LogManager.getLogger(RelayBridge.class);

    static final String ERR_FIRST_MESSAGE = "First message must be session.update";
    static final String ERR_INVALID_JSON = "Invalid JSON from client";
    static final String ERR_MISSING_KEY = "Missing upstream API key";
    static final String ERR_ALREADY_CONFIGURED = "Session already configured; session.update is accepted only once";

    enum UpstreamState { NONE, CONNECTING, OPEN, CLOSED }

    private final ClientChannel client;
    private final SocketConnector connector;
    private final RelayProperties properties;
    private final RelayMetrics metrics;
    private final SerialExecutor executor;

    // Confined to executor
    private SessionConfiguration config;
    private UpstreamState upstreamState = UpstreamState.NONE;
    private TextSocket upstream;
    private final Deque<String> pending = new ArrayDeque<>();
    private boolean overflowReported;
    private boolean clientClosing;

    // Written on the executor, read by connect callbacks on transport threads
    private volatile boolean terminated;

    public RelayBridge(ClientChannel client,
                       SocketConnector connector,
                       RelayProperties properties,
                       RelayMetrics metrics,
                       SerialExecutor executor) {
        this.client = client;
        this.connector = connector;
        this.properties = properties;
        this.metrics = metrics;
        this.executor = executor;
    }

    public void onClientConnected() {
        executor.execute(() -> {
            metrics.connectionOpened();
            LOG.info("Client connected");
        });
    }

    public void onClientText(String text) {
        executor.execute(() -> handleClientText(text));
    }

    public void onClientClosed(int statusCode, String reason) {
        executor.execute(() -> handleClientClosed(statusCode, reason));
    }

    private void handleClientText(String text) {
        if (terminated || clientClosing) {
            return;
        }
        ClientMessage message;
        try {
            message = ClientMessage.parse(text);
        } catch (ProtocolViolationException e) {
            LOG.debug("Rejecting non-JSON client message '{}'", LogSanitizer.preview(text));
            rejectWith(ERR_INVALID_JSON, "invalid_json");
            return;
        }
        if (config == null) {
            startSession(message);
            return;
        }
        if (message.isSessionUpdate()) {
            LOG.warn("Ignoring repeated session.update");
            rejectWith(ERR_ALREADY_CONFIGURED, "duplicate_session_update");
            return;
        }
        forward(message.raw());
    }

    private void startSession(ClientMessage message) {
        if (!message.isSessionUpdate()) {
            LOG.debug("First message was '{}', expected session.update", message.rawType());
            rejectWith(ERR_FIRST_MESSAGE, "not_session_update");
            return;
        }
        RelayProperties.Upstream upstreamProps = properties.getUpstream();
        if (!upstreamProps.hasApiKey()) {
            LOG.error("Upstream API key is not configured (relay.upstream.api-key)");
            rejectWith(ERR_MISSING_KEY, "missing_api_key");
            return;
        }
        SessionConfiguration configuration = message.toSessionConfiguration();
        this.config = configuration;
        this.upstreamState = UpstreamState.CONNECTING;

        String model = configuration.modelOr(upstreamProps.getDefaultModel());
        URI uri = upstreamUri(upstreamProps.getBaseUrl(), model);
        LOG.info("Session configured: mode={}, sideA={}, sideB={}, model={}",
                configuration.mode().wireName(), configuration.sideALanguage(),
                configuration.sideBLanguage(), model);

        String firstMessage = message.raw();
        long startNanos = System.nanoTime();
        connector.connect(uri, Map.of("Authorization", "Bearer " + upstreamProps.getApiKey()), new UpstreamListener())
                .whenComplete((socket, err) -> {
                    executor.execute(() -> onUpstreamConnectResult(socket, err, firstMessage, startNanos));
                    // The executor drops tasks once the client is gone; make sure the socket does not leak
                    if (terminated && socket != null) {
                        socket.abort();
                    }
                });
    }

    private void onUpstreamConnectResult(TextSocket socket, Throwable err, String firstMessage, long startNanos) {
        if (err != null) {
            handleConnectFailure(unwrap(err));
            return;
        }
        if (terminated || upstreamState == UpstreamState.CLOSED) {
            socket.abort();
            return;
        }
        metrics.recordUpstreamHandshake(System.nanoTime() - startNanos);
        upstream = socket;
        upstreamState = UpstreamState.OPEN;
        LOG.info("Upstream open; flushing {} queued message(s)", pending.size());
        socket.send(firstMessage);
        while (!pending.isEmpty()) {
            socket.send(pending.poll());
        }
    }

    private void handleConnectFailure(Throwable cause) {
        upstreamState = UpstreamState.CLOSED;
        pending.clear();
        if (cause instanceof UpstreamHandshakeException handshake) {
            LOG.error("Upstream handshake failed. Status: {}, Body: {}",
                    handshake.getStatusCode(), LogSanitizer.truncate(handshake.getBody(), 500));
            metrics.incrementUpstreamFailure(String.valueOf(handshake.getStatusCode()));
            sendToClient(WireMessages.error(handshake.getMessage(), handshake.getBody()));
        } else {
            LOG.error("Upstream connection failed: {}", cause.getMessage());
            metrics.incrementUpstreamFailure("transport");
            sendToClient(WireMessages.error("Upstream error: " + describe(cause)));
        }
        closeClient("upstream unavailable");
    }

    private void forward(String raw) {
        switch (upstreamState) {
            case OPEN -> upstream.send(raw);
            case CONNECTING -> enqueue(raw);
            default -> LOG.trace("Upstream closed; dropping client message");
        }
    }

    private void enqueue(String raw) {
        if (pending.size() < properties.getPendingMessageLimit()) {
            pending.add(raw);
            return;
        }
        metrics.incrementDroppedMessage();
        if (!overflowReported) {
            overflowReported = true;
            LOG.warn("Upstream handshake pending and queue full (limit={}); dropping client messages",
                    properties.getPendingMessageLimit());
        }
    }

    private void handleUpstreamText(String text) {
        if (terminated || clientClosing) {
            return;
        }
        RecognitionEvent event;
        try {
            event = RecognitionEvent.parse(text);
        } catch (ProtocolViolationException e) {
            client.send(text);
            return;
        }
        if (event.type() != RecognitionEventType.COMPLETED) {
            client.send(text);
            return;
        }
        String detected = event.language().orElse(null);
        Direction direction = DirectionResolver.resolve(config, detected);
        WireMessages.annotate(event.json(), direction, config);
        metrics.incrementTranscript(direction.side().wireName());
        LOG.info("Transcript completed: detected={}, side={}, {}->{}, text='{}'",
                detected, direction.side().wireName(), direction.sourceLanguage(),
                direction.targetLanguage(), LogSanitizer.preview(event.transcript()));
        client.send(event.json().toString());
    }

    private void handleUpstreamClosed(int statusCode, String reason) {
        if (upstreamState == UpstreamState.CLOSED) {
            return;
        }
        LOG.info("Upstream closed. code={}, reason={}", statusCode, reason);
        upstreamState = UpstreamState.CLOSED;
        upstream = null;
        sendToClient(WireMessages.sessionFinished(reason));
        closeClient("upstream closed");
    }

    private void handleUpstreamError(Throwable error) {
        if (upstreamState == UpstreamState.CLOSED) {
            return;
        }
        LOG.error("Upstream error: {}", describe(error));
        metrics.incrementUpstreamFailure("transport");
        upstreamState = UpstreamState.CLOSED;
        if (upstream != null) {
            upstream.abort();
            upstream = null;
        }
        sendToClient(WireMessages.error("Upstream error: " + describe(error)));
        closeClient("upstream error");
    }

    private void handleClientClosed(int statusCode, String reason) {
        if (terminated) {
            return;
        }
        LOG.info("Client closed. code={}, reason={}", statusCode, reason);
        terminated = true;
        pending.clear();
        if (upstream != null) {
            upstream.abort();
            upstream = null;
        }
        upstreamState = UpstreamState.CLOSED;
        metrics.connectionClosed();
        executor.shutdown();
    }

    private void rejectWith(String message, String reason) {
        metrics.incrementProtocolError(reason);
        sendToClient(WireMessages.error(message));
    }

    private void sendToClient(String text) {
        if (!terminated && !clientClosing) {
            client.send(text);
        }
    }

    private void closeClient(String reason) {
        if (clientClosing || terminated) {
            return;
        }
        clientClosing = true;
        client.close(reason);
    }

    static URI upstreamUri(String baseUrl, String model) {
        String separator = baseUrl.contains("?") ? "&" : "?";
        return URI.create(baseUrl + separator + "model=" + URLEncoder.encode(model, StandardCharsets.UTF_8));
    }

    private static Throwable unwrap(Throwable err) {
        Throwable t = err;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /** State of the bridge, for tests. Must be called on the executor. */
    UpstreamState upstreamState() {
        return upstreamState;
    }

    SessionConfiguration configuration() {
        return config;
    }

    int pendingCount() {
        return pending.size();
    }

    private final class UpstreamListener implements SocketListener {

        @Override
        public void onText(String text) {
            executor.execute(() -> handleUpstreamText(text));
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            executor.execute(() -> handleUpstreamClosed(statusCode, reason));
        }

        @Override
        public void onError(Throwable error) {
            executor.execute(() -> handleUpstreamError(error));
        }
    }
}
