package com.seamtalk.service.speech;

import com.seamtalk.config.collaborators.CollaboratorProperties;
import com.seamtalk.exception.CollaboratorExceptionBuilder;
import com.seamtalk.exception.MissingCredentialsException;
import com.seamtalk.exception.SynthesisException;
import com.seamtalk.util.LogSanitizer;
import com.seamtalk.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Relay-side text-to-speech through DashScope multimodal generation. Audio comes back either
 * as a hosted URL or inline base64.
 */
public class DashScopeSpeechProvider {

    private static final Logger LOG = LogManager.getLogger(DashScopeSpeechProvider.class);

    static final String PROVIDER = "dashscope";
    static final String AUDIO_FORMAT = "mp3";
    static final int SAMPLE_RATE = 24_000;

    private final CollaboratorProperties.Speech props;
    private final RestClient restClient;

    public DashScopeSpeechProvider(CollaboratorProperties.Speech props, RestClient restClient) {
        this.props = Objects.requireNonNull(props);
        this.restClient = Objects.requireNonNull(restClient);
    }

    /**
     * @param voice provider voice, {@code null} for the configured default
     * @param model provider model, {@code null} for the configured default
     * @throws MissingCredentialsException if no API key is configured
     * @throws SynthesisException          on transport failure, non-2xx or malformed response
     */
    public SynthesisResult synthesize(String text, String language, String voice, String model) {
        if (!props.hasApiKey()) {
            throw new MissingCredentialsException(props.keyVariable());
        }
        String effectiveVoice = (voice == null || voice.isBlank()) ? props.getVoice() : voice;
        String effectiveModel = (model == null || model.isBlank()) ? props.getModel() : model;
        String body = requestBody(text, VoiceSelector.languageType(language), effectiveVoice, effectiveModel).toString();
        long t0 = System.nanoTime();
        try {
            SynthesisResult result = restClient.post()
                    .uri(props.getUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey())
                    .body(body)
                    .exchange((request, response) -> {
                        long ttfbMs = TimeUtils.elapsedMillis(t0);
                        int status = response.getStatusCode().value();
                        String payload = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw CollaboratorExceptionBuilder.synthesis("DashScope TTS error: " + status)
                                    .provider(PROVIDER)
                                    .status(status)
                                    .durationMs(TimeUtils.elapsedMillis(t0))
                                    .responseBody(payload)
                                    .metadata("detail", LogSanitizer.truncate(payload, 200))
                                    .build();
                        }
                        return parse(payload, status, ttfbMs, t0);
                    });
            LOG.info("Synthesized {} chars ({}, voice={}) in {} ms", text.length(), language, effectiveVoice, result.totalMs());
            return result;
        } catch (RestClientException e) {
            throw CollaboratorExceptionBuilder.synthesis("TTS failed: " + e.getMessage())
                    .provider(PROVIDER)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .cause(e)
                    .build();
        }
    }

    static JSONObject requestBody(String text, String languageType, String voice, String model) {
        return new JSONObject()
                .put("model", model)
                .put("input", new JSONObject()
                        .put("text", text)
                        .put("voice", voice)
                        .put("language_type", languageType))
                .put("parameters", new JSONObject()
                        .put("format", AUDIO_FORMAT)
                        .put("sample_rate", SAMPLE_RATE));
    }

    private static SynthesisResult parse(String payload, int status, long ttfbMs, long t0) {
        JSONObject json;
        try {
            json = new JSONObject(payload);
        } catch (JSONException e) {
            throw CollaboratorExceptionBuilder.synthesis("DashScope returned malformed JSON")
                    .provider(PROVIDER)
                    .status(status)
                    .responseBody(payload)
                    .cause(e)
                    .build();
        }
        JSONObject output = json.optJSONObject("output");
        JSONObject audio = output == null ? null : output.optJSONObject("audio");
        String url = audio == null ? null : emptyToNull(audio.optString("url", null));
        String data = audio == null ? null : emptyToNull(audio.optString("data", null));
        String format = url != null && url.toLowerCase(Locale.ROOT).contains(".mp3") ? "mp3" : "wav";
        return new SynthesisResult(url, data, format, json.toMap(), ttfbMs, TimeUtils.elapsedMillis(t0));
    }

    private static String emptyToNull(String s) {
        return (s == null || s.isEmpty()) ? null : s;
    }
}
