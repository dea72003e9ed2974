package com.seamtalk.config.client;

import com.seamtalk.service.audio.capture.AudioStreamer;
import com.seamtalk.service.metrics.SessionMetrics;
import com.seamtalk.service.session.TalkSession;
import com.seamtalk.service.session.TalkSessionBuilder;
import com.seamtalk.service.speech.HttpSpeechSynthesisClient;
import com.seamtalk.service.speech.SpeechSynthesisClient;
import com.seamtalk.service.translation.HttpTranslationClient;
import com.seamtalk.service.translation.TranslationClient;
import com.seamtalk.transport.JdkSocketConnector;
import com.seamtalk.util.RestClients;
import com.seamtalk.util.concurrent.SingleThreadSerialExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Beans of the desktop hold-to-talk client. Only active with {@code client.enabled=true}.
 *
 * <p>The session talks to the relay over its own JDK WebSocket connector (one connection per
 * turn) and to the relay's REST endpoints for translation and speech.
 */
@Configuration
@ConditionalOnProperty(prefix = "client", name = "enabled", havingValue = "true")
public class ClientConfig {

    private static final Logger LOG = LogManager.getLogger(ClientConfig.class);

    static final Duration RELAY_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final Duration TRANSLATION_TIMEOUT = Duration.ofSeconds(30);
    static final Duration SPEECH_TIMEOUT = Duration.ofSeconds(60);

    @Bean
    public SessionMetrics sessionMetrics(MeterRegistry registry) {
        return new SessionMetrics(registry);
    }

    @Bean
    public TranslationClient translationClient(ClientProperties properties) {
        return new HttpTranslationClient(RestClients.withTimeout(TRANSLATION_TIMEOUT), properties.getRelayHttpUrl());
    }

    @Bean
    public SpeechSynthesisClient speechSynthesisClient(ClientProperties properties,
                                                       ApplicationEventPublisher publisher) {
        return new HttpSpeechSynthesisClient(RestClients.withTimeout(SPEECH_TIMEOUT),
                properties.getRelayHttpUrl(), publisher);
    }

    @Bean
    public TalkSession talkSession(ClientProperties properties,
                                   AudioStreamer audioStreamer,
                                   TranslationClient translationClient,
                                   SpeechSynthesisClient speechSynthesisClient,
                                   SessionMetrics sessionMetrics,
                                   @Qualifier("collaboratorExecutor") Executor collaboratorExecutor) {
        TalkSession session = TalkSessionBuilder.builder()
                .configuration(properties.toSessionConfiguration())
                .relayUri(properties.relayUri())
                .connector(new JdkSocketConnector(RELAY_CONNECT_TIMEOUT))
                .audio(audioStreamer)
                .translator(translationClient)
                .speech(speechSynthesisClient, properties.isSpeakTranslations())
                .collaboratorExecutor(collaboratorExecutor)
                .actor(new SingleThreadSerialExecutor("talk-session"))
                .metrics(sessionMetrics)
                .finalizeTimeout(properties.getFinalizeTimeout())
                .turnHistory(properties.getTurnHistory())
                .build();
        LOG.info("Client session ready: relay={}, mode={}, sideA={}, sideB={}",
                properties.getRelayUrl(), session.configuration().mode().wireName(),
                session.configuration().sideALanguage(), session.configuration().sideBLanguage());
        return session;
    }
}
