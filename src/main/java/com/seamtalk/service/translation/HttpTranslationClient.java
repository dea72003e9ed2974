package com.seamtalk.service.translation;

import com.seamtalk.exception.CollaboratorExceptionBuilder;
import com.seamtalk.exception.TranslationException;
import com.seamtalk.util.LogSanitizer;
import com.seamtalk.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Client-side {@link TranslationClient} calling the relay's {@code /api/v1/translate/text}.
 * Any non-2xx status or a response without a {@code translation} string is a
 * {@link TranslationException}.
 */
public class HttpTranslationClient implements TranslationClient {

    private static final Logger LOG = LogManager.getLogger(HttpTranslationClient.class);

    static final String PATH = "/api/v1/translate/text";
    static final String PROVIDER = "relay";

    private final RestClient restClient;
    private final String url;

    /**
     * @param restClient  client with bounded timeouts
     * @param relayHttpUrl relay base URL, e.g. {@code http://localhost:8080}
     */
    public HttpTranslationClient(RestClient restClient, String relayHttpUrl) {
        this.restClient = Objects.requireNonNull(restClient);
        this.url = stripTrailingSlash(Objects.requireNonNull(relayHttpUrl)) + PATH;
    }

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        String body = new JSONObject()
                .put("text", text)
                .put("source_lang", sourceLanguage)
                .put("target_lang", targetLanguage)
                .toString();
        long t0 = System.nanoTime();
        try {
            return restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        String payload = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw CollaboratorExceptionBuilder.translation("Translation request failed: " + status)
                                    .provider(PROVIDER)
                                    .status(status)
                                    .durationMs(TimeUtils.elapsedMillis(t0))
                                    .responseBody(payload)
                                    .metadata("detail", LogSanitizer.truncate(payload, 200))
                                    .build();
                        }
                        return extractTranslation(payload, status);
                    });
        } catch (RestClientException e) {
            LOG.debug("Translation call to {} failed: {}", url, e.getMessage());
            throw CollaboratorExceptionBuilder.translation("Translation request failed: " + e.getMessage())
                    .provider(PROVIDER)
                    .cause(e)
                    .build();
        }
    }

    private static String extractTranslation(String payload, int status) {
        try {
            JSONObject json = new JSONObject(payload);
            Object translation = json.opt("translation");
            if (translation instanceof String s) {
                return s;
            }
        } catch (JSONException e) {
            throw CollaboratorExceptionBuilder.translation("Malformed translation response")
                    .provider(PROVIDER)
                    .status(status)
                    .responseBody(payload)
                    .cause(e)
                    .build();
        }
        throw CollaboratorExceptionBuilder.translation("Translation response has no translation")
                .provider(PROVIDER)
                .status(status)
                .responseBody(payload)
                .build();
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
