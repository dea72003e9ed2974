package com.seamtalk.service.translation;

import com.seamtalk.config.collaborators.CollaboratorProperties;
import com.seamtalk.exception.CollaboratorExceptionBuilder;
import com.seamtalk.exception.MissingCredentialsException;
import com.seamtalk.exception.TranslationException;
import com.seamtalk.util.LogSanitizer;
import com.seamtalk.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Relay-side translation through a chat-completions endpoint (Doubao). The model is prompted
 * to answer with the bare translation; sampling is kept near-deterministic and reasoning off.
 */
public class DoubaoTranslationProvider {

    private static final Logger LOG = LogManager.getLogger(DoubaoTranslationProvider.class);

    static final String PROVIDER = "doubao";
    static final int MAX_OUTPUT_TOKENS = 1024;
    static final double TEMPERATURE = 0.1;

    private final CollaboratorProperties.Translation props;
    private final RestClient restClient;

    public DoubaoTranslationProvider(CollaboratorProperties.Translation props, RestClient restClient) {
        this.props = Objects.requireNonNull(props);
        this.restClient = Objects.requireNonNull(restClient);
    }

    /**
     * @param model provider model, {@code null} for the configured default
     * @throws MissingCredentialsException if no API key is configured
     * @throws TranslationException        on transport failure, non-2xx or malformed response
     */
    public TranslationResult translate(String text, String sourceLanguage, String targetLanguage, String model) {
        if (!props.hasApiKey()) {
            throw new MissingCredentialsException(props.keyVariable());
        }
        String effectiveModel = (model == null || model.isBlank()) ? props.getModel() : model;
        String body = requestBody(text, sourceLanguage, targetLanguage, effectiveModel).toString();
        long t0 = System.nanoTime();
        LOG.debug("Translating {} chars {}->{} with {}", text.length(), sourceLanguage, targetLanguage, effectiveModel);
        try {
            TranslationResult result = restClient.post()
                    .uri(props.getUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey())
                    .body(body)
                    .exchange((request, response) -> {
                        long ttfbMs = TimeUtils.elapsedMillis(t0);
                        int status = response.getStatusCode().value();
                        String payload = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw CollaboratorExceptionBuilder.translation("Doubao error: " + status)
                                    .provider(PROVIDER)
                                    .status(status)
                                    .durationMs(TimeUtils.elapsedMillis(t0))
                                    .responseBody(payload)
                                    .metadata("detail", LogSanitizer.truncate(payload, 200))
                                    .build();
                        }
                        return parse(payload, status, ttfbMs, t0);
                    });
            LOG.info("Translation done in {} ms: '{}'", result.totalMs(), LogSanitizer.preview(result.translation()));
            return result;
        } catch (RestClientException e) {
            throw CollaboratorExceptionBuilder.translation("Translate failed: " + e.getMessage())
                    .provider(PROVIDER)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .cause(e)
                    .build();
        }
    }

    static JSONObject requestBody(String text, String sourceLanguage, String targetLanguage, String model) {
        String prompt = "Translate the following " + sourceLanguage + " sentence into " + targetLanguage + ".\n"
                + "Reply with the translation only, no explanations.\n\n"
                + "Source: " + text + "\n\nTranslation:";
        return new JSONObject()
                .put("model", model)
                .put("stream", false)
                .put("max_output_tokens", MAX_OUTPUT_TOKENS)
                .put("temperature", TEMPERATURE)
                .put("thinking", new JSONObject().put("type", "disabled"))
                .put("messages", new JSONArray().put(new JSONObject().put("role", "user").put("content", prompt)));
    }

    private static TranslationResult parse(String payload, int status, long ttfbMs, long t0) {
        JSONObject json;
        try {
            json = new JSONObject(payload);
        } catch (JSONException e) {
            throw CollaboratorExceptionBuilder.translation("Doubao returned malformed JSON")
                    .provider(PROVIDER)
                    .status(status)
                    .responseBody(payload)
                    .cause(e)
                    .build();
        }
        String translation = "";
        JSONArray choices = json.optJSONArray("choices");
        if (choices != null && !choices.isEmpty()) {
            JSONObject first = choices.optJSONObject(0);
            if (first == null) {
                throw CollaboratorExceptionBuilder.translation("Doubao returned malformed choices")
                        .provider(PROVIDER)
                        .status(status)
                        .responseBody(payload)
                        .build();
            }
            JSONObject message = first.optJSONObject("message");
            if (message != null) {
                translation = message.optString("content", "");
            }
        }
        return new TranslationResult(translation.trim(), json.toMap(), ttfbMs, TimeUtils.elapsedMillis(t0));
    }
}
