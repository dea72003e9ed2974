package com.seamtalk.service.session;

import com.seamtalk.domain.SessionConfiguration;
import com.seamtalk.service.audio.capture.AudioStreamer;
import com.seamtalk.service.metrics.SessionMetrics;
import com.seamtalk.service.speech.SpeechSynthesisClient;
import com.seamtalk.service.translation.TranslationClient;
import com.seamtalk.transport.SocketConnector;
import com.seamtalk.util.concurrent.SerialExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link TalkSession}.
 *
 * <pre>{@code
 * TalkSession session = TalkSessionBuilder.builder()
 *     .configuration(config)
 *     .relayUri(URI.create("ws://localhost:8080/api/v1/asr/realtime"))
 *     .connector(connector)
 *     .audio(streamer)
 *     .translator(translationClient)
 *     .collaboratorExecutor(executor)
 *     .actor(new SingleThreadSerialExecutor("talk-session"))
 *     .build();
 * }</pre>
 *
 * <p>Speech, metrics, clock, finalize timeout and turn history are optional.
 */
public final class TalkSessionBuilder {

    static final Duration DEFAULT_FINALIZE_TIMEOUT = Duration.ofSeconds(3);
    static final int DEFAULT_TURN_HISTORY = 200;

    // Required
    SessionConfiguration configuration;
    URI relayUri;
    SocketConnector connector;
    AudioStreamer audio;
    TranslationClient translator;
    Executor collaboratorExecutor;
    SerialExecutor actor;

    // Optional
    SpeechSynthesisClient speech;
    boolean speakTranslations;
    SessionMetrics metrics;
    Duration finalizeTimeout = DEFAULT_FINALIZE_TIMEOUT;
    Clock clock = Clock.systemUTC();
    int turnHistory = DEFAULT_TURN_HISTORY;

    private TalkSessionBuilder() {
    }

    public static TalkSessionBuilder builder() {
        return new TalkSessionBuilder();
    }

    public TalkSessionBuilder configuration(SessionConfiguration configuration) {
        this.configuration = configuration;
        return this;
    }

    public TalkSessionBuilder relayUri(URI relayUri) {
        this.relayUri = relayUri;
        return this;
    }

    public TalkSessionBuilder connector(SocketConnector connector) {
        this.connector = connector;
        return this;
    }

    public TalkSessionBuilder audio(AudioStreamer audio) {
        this.audio = audio;
        return this;
    }

    public TalkSessionBuilder translator(TranslationClient translator) {
        this.translator = translator;
        return this;
    }

    /**
     * Sets the speech client and whether completed translations are spoken.
     *
     * @param speech            synthesis client, may be {@code null}
     * @param speakTranslations speak each non-empty translation
     * @return this builder
     */
    public TalkSessionBuilder speech(SpeechSynthesisClient speech, boolean speakTranslations) {
        this.speech = speech;
        this.speakTranslations = speakTranslations;
        return this;
    }

    /** Executor for blocking collaborator calls (translation, speech). */
    public TalkSessionBuilder collaboratorExecutor(Executor collaboratorExecutor) {
        this.collaboratorExecutor = collaboratorExecutor;
        return this;
    }

    /** Serial executor owning all session state. */
    public TalkSessionBuilder actor(SerialExecutor actor) {
        this.actor = actor;
        return this;
    }

    public TalkSessionBuilder metrics(SessionMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    public TalkSessionBuilder finalizeTimeout(Duration finalizeTimeout) {
        this.finalizeTimeout = finalizeTimeout;
        return this;
    }

    public TalkSessionBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public TalkSessionBuilder turnHistory(int turnHistory) {
        this.turnHistory = turnHistory;
        return this;
    }

    /**
     * @return configured session, idle
     * @throws NullPointerException if a required dependency is missing
     * @throws IllegalArgumentException if the finalize timeout is not positive
     */
    public TalkSession build() {
        Objects.requireNonNull(configuration, "configuration is required");
        Objects.requireNonNull(relayUri, "relayUri is required");
        Objects.requireNonNull(connector, "connector is required");
        Objects.requireNonNull(audio, "audio is required");
        Objects.requireNonNull(translator, "translator is required");
        Objects.requireNonNull(collaboratorExecutor, "collaboratorExecutor is required");
        Objects.requireNonNull(actor, "actor is required");
        Objects.requireNonNull(finalizeTimeout, "finalizeTimeout is required");
        Objects.requireNonNull(clock, "clock is required");
        if (finalizeTimeout.isNegative() || finalizeTimeout.isZero()) {
            throw new IllegalArgumentException("finalizeTimeout must be positive");
        }
        // Tests may omit metrics
        if (metrics == null) {
            metrics = new SessionMetrics(new SimpleMeterRegistry());
        }
        return new TalkSession(this);
    }
}
