package com.seamtalk.relay;

import com.seamtalk.config.relay.RelayProperties;
import com.seamtalk.domain.SessionMode;
import com.seamtalk.exception.UpstreamHandshakeException;
import com.seamtalk.protocol.RecognitionEvent;
import com.seamtalk.protocol.RecognitionEventType;
import com.seamtalk.service.metrics.RelayMetrics;
import com.seamtalk.testutil.FakeClientChannel;
import com.seamtalk.testutil.FakeSocketConnector;
import com.seamtalk.testutil.FakeTextSocket;
import com.seamtalk.testutil.ManualSerialExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class RelayBridgeTest {

    private static final String UPDATE_AUTO =
            "{\"type\":\"session.update\",\"session\":{\"mode\":\"auto_detect\",\"left_lang\":\"zh\",\"right_lang\":\"en\"}}";
    private static final String APPEND_1 = "{\"type\":\"input_audio_buffer.append\",\"audio\":\"AAA=\"}";
    private static final String APPEND_2 = "{\"type\":\"input_audio_buffer.append\",\"audio\":\"BBB=\"}";
    private static final String COMMIT = "{\"type\":\"input_audio_buffer.commit\"}";

    private FakeClientChannel client;
    private FakeSocketConnector connector;
    private ManualSerialExecutor executor;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        client = new FakeClientChannel("c-1");
        connector = new FakeSocketConnector();
        executor = new ManualSerialExecutor();
        registry = new SimpleMeterRegistry();
    }

    private RelayBridge bridge(String apiKey, int pendingLimit) {
        RelayProperties props = new RelayProperties(null, pendingLimit, null,
                new RelayProperties.Upstream(apiKey, "wss://asr.example.com/realtime", "asr-default", null));
        RelayBridge bridge = new RelayBridge(client, connector, props, new RelayMetrics(registry), executor);
        bridge.onClientConnected();
        return bridge;
    }

    private RelayBridge bridge() {
        return bridge("sk-test", 16);
    }

    @Test
    void rejectsNonUpdateFirstMessageWithoutConnecting() {
        RelayBridge bridge = bridge();

        bridge.onClientText(APPEND_1);

        assertThat(connector.attempts()).isEmpty();
        RecognitionEvent error = RecognitionEvent.parse(client.lastSent());
        assertThat(error.type()).isEqualTo(RecognitionEventType.ERROR);
        assertThat(error.errorMessage()).isEqualTo(RelayBridge.ERR_FIRST_MESSAGE);
        assertThat(bridge.configuration()).isNull();
        assertThat(client.closed()).isFalse();
    }

    @Test
    void retryAfterInvalidFirstMessageIsAccepted() {
        RelayBridge bridge = bridge();

        bridge.onClientText("not json");
        bridge.onClientText(UPDATE_AUTO);

        assertThat(RecognitionEvent.parse(client.sent().get(0)).errorMessage()).isEqualTo(RelayBridge.ERR_INVALID_JSON);
        assertThat(connector.attempts()).hasSize(1);
        assertThat(bridge.configuration().mode()).isEqualTo(SessionMode.AUTO_DETECT);
    }

    @Test
    void missingApiKeyIsReportedPerConnection() {
        RelayBridge bridge = bridge(null, 16);

        bridge.onClientText(UPDATE_AUTO);

        assertThat(connector.attempts()).isEmpty();
        assertThat(RecognitionEvent.parse(client.lastSent()).errorMessage()).isEqualTo(RelayBridge.ERR_MISSING_KEY);
        assertThat(bridge.upstreamState()).isEqualTo(RelayBridge.UpstreamState.NONE);
    }

    @Test
    void connectsWithModelQueryAndBearerHeader() {
        RelayBridge bridge = bridge();

        bridge.onClientText("{\"type\":\"session.update\",\"session\":{\"model\":\"asr-custom\"}}");

        FakeSocketConnector.Attempt attempt = connector.last();
        assertThat(attempt.uri()).isEqualTo(URI.create("wss://asr.example.com/realtime?model=asr-custom"));
        assertThat(attempt.headers()).containsEntry("Authorization", "Bearer sk-test");
        assertThat(bridge.upstreamState()).isEqualTo(RelayBridge.UpstreamState.CONNECTING);
    }

    @Test
    void queuedMessagesAreFlushedInOrderAfterSessionUpdate() {
        RelayBridge bridge = bridge();
        bridge.onClientText(UPDATE_AUTO);
        bridge.onClientText(APPEND_1);
        bridge.onClientText(APPEND_2);
        bridge.onClientText(COMMIT);
        assertThat(bridge.pendingCount()).isEqualTo(3);

        FakeTextSocket upstream = connector.last().open();

        assertThat(upstream.sent()).containsExactly(UPDATE_AUTO, APPEND_1, APPEND_2, COMMIT);
        assertThat(bridge.pendingCount()).isZero();
        assertThat(bridge.upstreamState()).isEqualTo(RelayBridge.UpstreamState.OPEN);
    }

    @Test
    void messagesAfterOpenAreForwardedVerbatim() {
        RelayBridge bridge = bridge();
        bridge.onClientText(UPDATE_AUTO);
        FakeTextSocket upstream = connector.last().open();

        bridge.onClientText(APPEND_1);

        assertThat(upstream.sent()).containsExactly(UPDATE_AUTO, APPEND_1);
    }

    @Test
    void queueOverflowDropsExtraMessages() {
        RelayBridge bridge = bridge("sk-test", 1);
        bridge.onClientText(UPDATE_AUTO);
        bridge.onClientText(APPEND_1);
        bridge.onClientText(APPEND_2);

        FakeTextSocket upstream = connector.last().open();

        assertThat(upstream.sent()).containsExactly(UPDATE_AUTO, APPEND_1);
        assertThat(registry.counter("seamtalk.relay.message.dropped").count()).isEqualTo(1.0);
    }

    @Test
    void secondSessionUpdateIsRejected() {
        RelayBridge bridge = bridge();
        bridge.onClientText(UPDATE_AUTO);
        FakeTextSocket upstream = connector.last().open();

        bridge.onClientText("{\"type\":\"session.update\",\"session\":{\"left_lang\":\"ja\"}}");

        assertThat(upstream.sent()).containsExactly(UPDATE_AUTO);
        assertThat(RecognitionEvent.parse(client.lastSent()).errorMessage()).isEqualTo(RelayBridge.ERR_ALREADY_CONFIGURED);
        assertThat(bridge.configuration().sideALanguage()).isEqualTo("zh");
    }

    @Test
    void completedTranscriptIsAnnotated() {
        RelayBridge bridge = bridge();
        bridge.onClientText(UPDATE_AUTO);
        FakeSocketConnector.Attempt attempt = connector.last();
        attempt.open();

        attempt.listener().onText(
                "{\"type\":\"conversation.item.input_audio_transcription.completed\",\"transcript\":\"hello\",\"language\":\"en-US\"}");

        JSONObject sent = new JSONObject(client.lastSent());
        assertThat(sent.getString("transcript")).isEqualTo("hello");
        assertThat(sent.getString(RecognitionEvent.UI_SIDE)).isEqualTo("right");
        assertThat(sent.getString(RecognitionEvent.UI_SOURCE_LANG)).isEqualTo("en");
        assertThat(sent.getString(RecognitionEvent.UI_TARGET_LANG)).isEqualTo("zh");
        assertThat(sent.getString(RecognitionEvent.UI_MODE)).isEqualTo("auto_detect");
        assertThat(registry.counter("seamtalk.relay.transcript", "side", "right").count()).isEqualTo(1.0);
    }

    @Test
    void otherUpstreamEventsAreForwardedUntouched() {
        bridge().onClientText(UPDATE_AUTO);
        FakeSocketConnector.Attempt attempt = connector.last();
        attempt.open();
        String partial = "{\"type\":\"conversation.item.input_audio_transcription.text\",\"text\":\"hel\",\"stash\":\"lo\"}";

        attempt.listener().onText(partial);
        attempt.listener().onText("garbage");

        assertThat(client.sent()).containsExactly(partial, "garbage");
    }

    @Test
    void handshakeRejectionIsReportedAndClientClosed() {
        bridge().onClientText(UPDATE_AUTO);

        connector.last().fail(new UpstreamHandshakeException(401, "{\"message\":\"bad key\"}", null));

        RecognitionEvent error = RecognitionEvent.parse(client.lastSent());
        assertThat(error.type()).isEqualTo(RecognitionEventType.ERROR);
        assertThat(error.errorMessage()).isEqualTo("Upstream handshake failed: 401");
        assertThat(error.errorDetail()).isEqualTo("{\"message\":\"bad key\"}");
        assertThat(client.closed()).isTrue();
        assertThat(registry.counter("seamtalk.relay.upstream.failure", "status", "401").count()).isEqualTo(1.0);
    }

    @Test
    void transportFailureIsReportedAndClientClosed() {
        bridge().onClientText(UPDATE_AUTO);

        connector.last().fail(new IOException("connection refused"));

        assertThat(RecognitionEvent.parse(client.lastSent()).errorMessage())
                .isEqualTo("Upstream error: connection refused");
        assertThat(client.closed()).isTrue();
    }

    @Test
    void upstreamCloseSendsSessionFinished() {
        RelayBridge bridge = bridge();
        bridge.onClientText(UPDATE_AUTO);
        FakeSocketConnector.Attempt attempt = connector.last();
        attempt.open();

        attempt.listener().onClosed(1000, "done");

        RecognitionEvent finished = RecognitionEvent.parse(client.lastSent());
        assertThat(finished.type()).isEqualTo(RecognitionEventType.SESSION_FINISHED);
        assertThat(finished.finishReason()).isEqualTo("done");
        assertThat(client.closed()).isTrue();
        assertThat(bridge.upstreamState()).isEqualTo(RelayBridge.UpstreamState.CLOSED);
    }

    @Test
    void upstreamErrorAbortsAndClosesClient() {
        bridge().onClientText(UPDATE_AUTO);
        FakeSocketConnector.Attempt attempt = connector.last();
        FakeTextSocket upstream = attempt.open();

        attempt.listener().onError(new IOException("reset"));

        assertThat(upstream.aborted()).isTrue();
        assertThat(RecognitionEvent.parse(client.lastSent()).errorMessage()).isEqualTo("Upstream error: reset");
        assertThat(client.closed()).isTrue();
    }

    @Test
    void clientCloseAbortsUpstream() {
        RelayBridge bridge = bridge();
        bridge.onClientText(UPDATE_AUTO);
        FakeTextSocket upstream = connector.last().open();

        bridge.onClientClosed(1000, "bye");

        assertThat(upstream.aborted()).isTrue();
        assertThat(executor.isShutdown()).isTrue();
        assertThat(registry.get("seamtalk.relay.connections.active").gauge().value()).isZero();
    }

    @Test
    void handshakeCompletingAfterClientLeftIsAborted() {
        RelayBridge bridge = bridge();
        bridge.onClientText(UPDATE_AUTO);
        FakeSocketConnector.Attempt attempt = connector.last();

        bridge.onClientClosed(1001, "gone");
        FakeTextSocket late = attempt.open();

        assertThat(late.aborted()).isTrue();
        assertThat(late.sent()).isEmpty();
    }

    @Test
    void upstreamUriEncodesModelAndRespectsExistingQuery() {
        assertThat(RelayBridge.upstreamUri("wss://h/realtime", "m 1"))
                .isEqualTo(URI.create("wss://h/realtime?model=m+1"));
        assertThat(RelayBridge.upstreamUri("wss://h/realtime?x=1", "m"))
                .isEqualTo(URI.create("wss://h/realtime?x=1&model=m"));
    }
}
