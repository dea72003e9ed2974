package com.seamtalk.service.translation;

import com.seamtalk.config.collaborators.CollaboratorProperties;
import com.seamtalk.exception.CollaboratorException;
import com.seamtalk.exception.MissingCredentialsException;
import com.seamtalk.exception.TranslationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DoubaoTranslationProviderTest {

    private static final String URL = "https://llm.example.com/chat/completions";

    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    private DoubaoTranslationProvider provider(String apiKey) {
        return new DoubaoTranslationProvider(
                new CollaboratorProperties.Translation(apiKey, URL, "doubao-test", null), restClient);
    }

    @Test
    void returnsTrimmedTranslationAndRawResponse() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer key-1"))
                .andExpect(jsonPath("$.model").value("doubao-test"))
                .andExpect(jsonPath("$.stream").value(false))
                .andExpect(jsonPath("$.thinking.type").value("disabled"))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"  Hello  \"}}],\"id\":\"r1\"}",
                        MediaType.APPLICATION_JSON));

        TranslationResult result = provider("key-1").translate("你好", "zh", "en", null);

        assertThat(result.translation()).isEqualTo("Hello");
        assertThat(result.raw()).containsEntry("id", "r1");
        assertThat(result.totalMs()).isGreaterThanOrEqualTo(result.ttfbMs());
        server.verify();
    }

    @Test
    void requestedModelOverridesDefault() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.model").value("other-model"))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        TranslationResult result = provider("key-1").translate("a", "en", "zh", "other-model");

        assertThat(result.translation()).isEmpty();
        server.verify();
    }

    @Test
    void promptNamesBothLanguagesAndText() {
        String prompt = DoubaoTranslationProvider.requestBody("bonjour", "fr", "en", "m")
                .getJSONArray("messages").getJSONObject(0).getString("content");

        assertThat(prompt).contains("fr").contains("en").contains("bonjour");
    }

    @Test
    void missingKeyFailsWithoutCallingProvider() {
        assertThatThrownBy(() -> provider(" ").translate("a", "en", "zh", null))
                .isInstanceOf(MissingCredentialsException.class)
                .hasMessage("Missing env DOUBAO_API_KEY");
        server.verify();
    }

    @Test
    void nonSuccessStatusCarriesStatusAndBody() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("{\"error\":\"rate limited\"}"));

        assertThatThrownBy(() -> provider("key-1").translate("a", "en", "zh", null))
                .isInstanceOfSatisfying(TranslationException.class, e -> {
                    assertThat(e.getReason()).isEqualTo("Doubao error: 429");
                    assertThat(e.getHttpStatus()).isEqualTo(429);
                    assertThat(e.getResponseBody()).isEqualTo("{\"error\":\"rate limited\"}");
                    assertThat(e.getProvider()).isEqualTo("doubao");
                });
    }

    @Test
    void malformedJsonIsReported() {
        server.expect(requestTo(URL)).andRespond(withSuccess("<html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> provider("key-1").translate("a", "en", "zh", null))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("malformed JSON");
    }

    @Test
    void nonObjectChoiceIsReported() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"choices\":[\"oops\"]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider("key-1").translate("a", "en", "zh", null))
                .isInstanceOfSatisfying(TranslationException.class, e -> {
                    assertThat(e.getReason()).isEqualTo("Doubao returned malformed choices");
                    assertThat(e.getHttpStatus()).isEqualTo(200);
                    assertThat(e.getResponseBody()).isEqualTo("{\"choices\":[\"oops\"]}");
                });
    }

    @Test
    void transportFailureHasNoStatus() {
        server.expect(requestTo(URL)).andRespond(withException(new IOException("connect timed out")));

        assertThatThrownBy(() -> provider("key-1").translate("a", "en", "zh", null))
                .isInstanceOfSatisfying(TranslationException.class, e -> {
                    assertThat(e.hasHttpStatus()).isFalse();
                    assertThat(e.getHttpStatus()).isEqualTo(CollaboratorException.NO_STATUS);
                    assertThat(e.getReason()).startsWith("Translate failed:");
                });
    }
}
