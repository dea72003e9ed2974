package com.seamtalk.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Client-side turn metrics: how turns end and how long finalizing takes.
 *
 * <p>Registered by the client configuration only, so the relay role does not export empty
 * {@code seamtalk.turn.*} meters.
 */
public class SessionMetrics {

    private static final String METRIC_PREFIX = "seamtalk.turn";

    private final MeterRegistry registry;

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records press-up to final transcript latency.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordFinalizeLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".finalize.latency")
                .description("Time from releasing the talk key to the final transcript")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementCompleted() {
        Counter.builder(METRIC_PREFIX + ".completed")
                .description("Number of turns that produced a final transcript")
                .register(registry)
                .increment();
    }

    /**
     * @param reason why the turn was abandoned (timeout, error, session_finished, closed, connect_failed, device_unavailable)
     */
    public void incrementAbandoned(String reason) {
        Counter.builder(METRIC_PREFIX + ".abandoned")
                .description("Number of turns that ended without a transcript")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome success or failure
     */
    public void incrementTranslation(String outcome) {
        Counter.builder(METRIC_PREFIX + ".translation")
                .description("Number of translation requests by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
