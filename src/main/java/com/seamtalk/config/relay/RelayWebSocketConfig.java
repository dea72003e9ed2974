package com.seamtalk.config.relay;

import com.seamtalk.relay.RealtimeRelayHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the realtime relay endpoint. Only {@link RelayProperties#getPath()} is upgraded.
 */
@Configuration
@EnableWebSocket
public class RelayWebSocketConfig implements WebSocketConfigurer {

    private static final Logger LOG = LogManager.getLogger(RelayWebSocketConfig.class);

    private final RealtimeRelayHandler handler;
    private final RelayProperties properties;

    public RelayWebSocketConfig(RealtimeRelayHandler handler, RelayProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        if (!properties.getUpstream().hasApiKey()) {
            LOG.warn("relay.upstream.api-key is not set; realtime sessions will be rejected");
        }
        registry.addHandler(handler, properties.getPath()).setAllowedOriginPatterns("*");
        LOG.info("Realtime relay listening on {} (upstream {})",
                properties.getPath(), properties.getUpstream().getBaseUrl());
    }
}
