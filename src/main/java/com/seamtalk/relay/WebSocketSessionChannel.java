package com.seamtalk.relay;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link ClientChannel} over a Spring {@link WebSocketSession}. Sends go through a
 * {@link ConcurrentWebSocketSessionDecorator}, which serializes writers and bounds the buffer
 * of a slow client.
 */
final class WebSocketSessionChannel implements ClientChannel {

    private static final Logger LOG = LogManager.getLogger(WebSocketSessionChannel.class);

    private final WebSocketSession session;

    WebSocketSessionChannel(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String text) {
        if (!session.isOpen()) {
            LOG.trace("Client {} already closed; dropping message", session.getId());
            return;
        }
        try {
            session.sendMessage(new TextMessage(text));
        } catch (SessionLimitExceededException e) {
            LOG.warn("Client {} is not keeping up; connection closed: {}", session.getId(), e.getMessage());
        } catch (IOException | IllegalStateException e) {
            LOG.debug("Send to client {} failed: {}", session.getId(), e.toString());
        }
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL.withReason(reason));
        } catch (IOException e) {
            LOG.debug("Closing client {} failed: {}", session.getId(), e.toString());
        }
    }
}
