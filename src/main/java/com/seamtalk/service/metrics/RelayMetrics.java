package com.seamtalk.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics of the realtime relay.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Open client connections (gauge)</li>
 *   <li>Upstream handshake latency and failures by HTTP status</li>
 *   <li>Protocol errors sent back to clients, by reason</li>
 *   <li>Completed transcripts by resolved side</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class RelayMetrics {

    private static final String METRIC_PREFIX = "seamtalk.relay";

    private final MeterRegistry registry;
    private final AtomicInteger activeConnections = new AtomicInteger();

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge(METRIC_PREFIX + ".connections.active", activeConnections);
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    /**
     * Records the time from {@code session.update} to an open upstream socket.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordUpstreamHandshake(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".upstream.handshake")
                .description("Time taken to open the upstream recognition socket")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param status HTTP status of the rejected upgrade, or "transport" when no response was received
     */
    public void incrementUpstreamFailure(String status) {
        Counter.builder(METRIC_PREFIX + ".upstream.failure")
                .description("Number of upstream connections that failed to open or broke")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * @param reason short reason tag (invalid_json, not_session_update, duplicate_session_update, missing_api_key)
     */
    public void incrementProtocolError(String reason) {
        Counter.builder(METRIC_PREFIX + ".protocol.error")
                .description("Number of error messages sent to clients for protocol violations")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param side wire name of the resolved side
     */
    public void incrementTranscript(String side) {
        Counter.builder(METRIC_PREFIX + ".transcript")
                .description("Number of completed transcripts annotated by the relay")
                .tag("side", side)
                .register(registry)
                .increment();
    }

    /** Messages dropped because the pending queue was full or disabled. */
    public void incrementDroppedMessage() {
        Counter.builder(METRIC_PREFIX + ".message.dropped")
                .description("Number of client messages dropped while the upstream handshake was pending")
                .register(registry)
                .increment();
    }
}
