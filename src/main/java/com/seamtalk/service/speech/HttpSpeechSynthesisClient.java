package com.seamtalk.service.speech;

import com.seamtalk.exception.CollaboratorExceptionBuilder;
import com.seamtalk.exception.SynthesisException;
import com.seamtalk.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;

/**
 * Client-side {@link SpeechSynthesisClient} calling the relay's {@code /api/v1/tts}.
 * Best effort: failures are logged and swallowed at this boundary; audio is handed on as a
 * {@link SpeechSynthesizedEvent}.
 */
public class HttpSpeechSynthesisClient implements SpeechSynthesisClient {

    private static final Logger LOG = LogManager.getLogger(HttpSpeechSynthesisClient.class);

    static final String PATH = "/api/v1/tts";
    static final String PROVIDER = "relay";

    private final RestClient restClient;
    private final String url;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public HttpSpeechSynthesisClient(RestClient restClient, String relayHttpUrl, ApplicationEventPublisher publisher) {
        this(restClient, relayHttpUrl, publisher, Clock.systemUTC());
    }

    HttpSpeechSynthesisClient(RestClient restClient, String relayHttpUrl, ApplicationEventPublisher publisher,
                              Clock clock) {
        this.restClient = Objects.requireNonNull(restClient);
        String base = Objects.requireNonNull(relayHttpUrl);
        this.url = (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + PATH;
        this.publisher = Objects.requireNonNull(publisher);
        this.clock = clock;
    }

    @Override
    public void speak(String text, String language) {
        if (text == null || text.isBlank()) {
            return;
        }
        try {
            SpeechSynthesizedEvent event = synthesize(text, language);
            LOG.info("Speech ready for '{}' ({}, {})", LogSanitizer.preview(text), language, event.format());
            publisher.publishEvent(event);
        } catch (SynthesisException e) {
            LOG.warn("Speech synthesis failed: {}", e.getMessage());
        }
    }

    /**
     * @throws SynthesisException on transport failure, non-2xx or malformed response
     */
    SpeechSynthesizedEvent synthesize(String text, String language) {
        String body = new JSONObject().put("text", text).put("lang", language).toString();
        try {
            return restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        String payload = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw CollaboratorExceptionBuilder.synthesis("Speech request failed: " + status)
                                    .provider(PROVIDER)
                                    .status(status)
                                    .responseBody(payload)
                                    .metadata("detail", LogSanitizer.truncate(payload, 200))
                                    .build();
                        }
                        return toEvent(text, language, payload, status);
                    });
        } catch (RestClientException e) {
            throw CollaboratorExceptionBuilder.synthesis("Speech request failed: " + e.getMessage())
                    .provider(PROVIDER)
                    .cause(e)
                    .build();
        }
    }

    private SpeechSynthesizedEvent toEvent(String text, String language, String payload, int status) {
        JSONObject json;
        try {
            json = new JSONObject(payload);
        } catch (JSONException e) {
            throw CollaboratorExceptionBuilder.synthesis("Malformed speech response")
                    .provider(PROVIDER)
                    .status(status)
                    .responseBody(payload)
                    .cause(e)
                    .build();
        }
        String audioUrl = json.isNull("audio_url") ? null : json.optString("audio_url", null);
        String audioBase64 = json.isNull("audio_base64") ? null : json.optString("audio_base64", null);
        if (audioUrl == null && audioBase64 == null) {
            throw CollaboratorExceptionBuilder.synthesis("Speech response has no audio")
                    .provider(PROVIDER)
                    .status(status)
                    .responseBody(payload)
                    .build();
        }
        return new SpeechSynthesizedEvent(text, language, audioUrl, audioBase64,
                json.optString("format", "mp3"), clock.instant());
    }
}
