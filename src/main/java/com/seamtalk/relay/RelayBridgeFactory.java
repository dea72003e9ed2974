package com.seamtalk.relay;

import com.seamtalk.config.relay.RelayProperties;
import com.seamtalk.service.metrics.RelayMetrics;
import com.seamtalk.transport.SocketConnector;
import com.seamtalk.util.concurrent.SingleThreadSerialExecutor;

import java.util.Map;

/**
 * Creates one {@link RelayBridge} per client connection, each on its own serial executor whose
 * log lines carry the {@code connectionId}.
 */
public class RelayBridgeFactory {

    static final String CONNECTION_ID_KEY = "connectionId";

    private final SocketConnector connector;
    private final RelayProperties properties;
    private final RelayMetrics metrics;

    public RelayBridgeFactory(SocketConnector connector, RelayProperties properties, RelayMetrics metrics) {
        this.connector = connector;
        this.properties = properties;
        this.metrics = metrics;
    }

    public RelayBridge create(ClientChannel client) {
        SingleThreadSerialExecutor executor = new SingleThreadSerialExecutor(
                "relay-" + client.id(), Map.of(CONNECTION_ID_KEY, client.id()));
        return new RelayBridge(client, connector, properties, metrics, executor);
    }
}
