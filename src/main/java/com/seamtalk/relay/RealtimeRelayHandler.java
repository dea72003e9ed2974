package com.seamtalk.relay;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Terminates client WebSockets on the realtime path and hands each connection's traffic to its
 * {@link RelayBridge}. Binary frames are treated as UTF-8 text.
 */
public class RealtimeRelayHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(RealtimeRelayHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;

    private final RelayBridgeFactory bridgeFactory;
    private final int sendBufferLimit;
    private final Map<String, RelayBridge> bridges = new ConcurrentHashMap<>();

    public RealtimeRelayHandler(RelayBridgeFactory bridgeFactory, int sendBufferLimit) {
        this.bridgeFactory = bridgeFactory;
        this.sendBufferLimit = sendBufferLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ClientChannel channel = new WebSocketSessionChannel(session, SEND_TIME_LIMIT_MS, sendBufferLimit);
        RelayBridge bridge = bridgeFactory.create(channel);
        bridges.put(session.getId(), bridge);
        bridge.onClientConnected();
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        bridgeFor(session).onClientText(message.getPayload());
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        bridgeFor(session).onClientText(StandardCharsets.UTF_8.decode(message.getPayload()).toString());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.debug("Transport error on client {}: {}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        RelayBridge bridge = bridges.remove(session.getId());
        if (bridge != null) {
            bridge.onClientClosed(status.getCode(), status.getReason());
        }
    }

    /** @return number of open client connections */
    public int activeConnections() {
        return bridges.size();
    }

    private RelayBridge bridgeFor(WebSocketSession session) {
        RelayBridge bridge = bridges.get(session.getId());
        if (bridge == null) {
            throw new IllegalStateException("No relay bridge for session " + session.getId());
        }
        return bridge;
    }
}
