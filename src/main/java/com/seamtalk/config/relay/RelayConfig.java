package com.seamtalk.config.relay;

import com.seamtalk.relay.RealtimeRelayHandler;
import com.seamtalk.relay.RelayBridgeFactory;
import com.seamtalk.service.metrics.RelayMetrics;
import com.seamtalk.transport.JdkSocketConnector;
import com.seamtalk.transport.SocketConnector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Beans of the realtime relay. Outbound upstream sockets use the JDK WebSocket client through
 * {@link JdkSocketConnector}.
 */
@Configuration
public class RelayConfig {

    /** Outbound buffer per client, in multiples of the largest inbound message. */
    private static final int SEND_BUFFER_FACTOR = 4;

    @Bean
    public SocketConnector upstreamSocketConnector(RelayProperties properties) {
        return new JdkSocketConnector(properties.getUpstream().getConnectTimeout());
    }

    @Bean
    public RelayBridgeFactory relayBridgeFactory(SocketConnector upstreamSocketConnector,
                                                 RelayProperties properties,
                                                 RelayMetrics metrics) {
        return new RelayBridgeFactory(upstreamSocketConnector, properties, metrics);
    }

    @Bean
    public RealtimeRelayHandler realtimeRelayHandler(RelayBridgeFactory relayBridgeFactory, RelayProperties properties) {
        return new RealtimeRelayHandler(relayBridgeFactory, properties.getMaxTextMessageBytes() * SEND_BUFFER_FACTOR);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(RelayProperties properties) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getMaxTextMessageBytes());
        container.setMaxBinaryMessageBufferSize(properties.getMaxTextMessageBytes());
        return container;
    }
}
