package com.seamtalk.service.speech;

import com.seamtalk.config.collaborators.CollaboratorProperties;
import com.seamtalk.exception.MissingCredentialsException;
import com.seamtalk.exception.SynthesisException;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DashScopeSpeechProviderTest {

    private static final String URL = "https://tts.example.com/generation";

    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    private DashScopeSpeechProvider provider(String apiKey) {
        return new DashScopeSpeechProvider(
                new CollaboratorProperties.Speech(apiKey, URL, "tts-test", "Cherry", null), restClient);
    }

    @Test
    void returnsAudioUrlAndInfersFormat() {
        server.expect(requestTo(URL))
                .andExpect(header("Authorization", "Bearer key-2"))
                .andExpect(jsonPath("$.model").value("tts-test"))
                .andExpect(jsonPath("$.input.text").value("你好"))
                .andExpect(jsonPath("$.input.voice").value("Cherry"))
                .andExpect(jsonPath("$.input.language_type").value("Chinese"))
                .andExpect(jsonPath("$.parameters.format").value("mp3"))
                .andRespond(withSuccess(
                        "{\"output\":{\"audio\":{\"url\":\"https://cdn.example.com/a.mp3?sig=1\",\"data\":\"\"}}}",
                        MediaType.APPLICATION_JSON));

        SynthesisResult result = provider("key-2").synthesize("你好", "zh-CN", null, null);

        assertThat(result.audioUrl()).isEqualTo("https://cdn.example.com/a.mp3?sig=1");
        assertThat(result.audioBase64()).isNull();
        assertThat(result.format()).isEqualTo("mp3");
        server.verify();
    }

    @Test
    void inlineAudioWithoutUrlIsWav() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.input.voice").value("Ethan"))
                .andRespond(withSuccess("{\"output\":{\"audio\":{\"data\":\"UklGRg==\"}}}", MediaType.APPLICATION_JSON));

        SynthesisResult result = provider("key-2").synthesize("hi", "en", "Ethan", null);

        assertThat(result.audioUrl()).isNull();
        assertThat(result.audioBase64()).isEqualTo("UklGRg==");
        assertThat(result.format()).isEqualTo("wav");
    }

    @Test
    void requestBodyShape() {
        JSONObject body = DashScopeSpeechProvider.requestBody("t", "Korean", "v", "m");

        assertThat(body.getJSONObject("parameters").getInt("sample_rate")).isEqualTo(24_000);
        assertThat(body.getJSONObject("input").getString("language_type")).isEqualTo("Korean");
    }

    @Test
    void missingKeyFails() {
        assertThatThrownBy(() -> provider(null).synthesize("hi", "en", null, null))
                .isInstanceOf(MissingCredentialsException.class)
                .hasMessage("Missing env DASHSCOPE_API_KEY");
    }

    @Test
    void nonSuccessStatusCarriesStatusAndBody() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST).body("bad voice"));

        assertThatThrownBy(() -> provider("key-2").synthesize("hi", "en", null, null))
                .isInstanceOfSatisfying(SynthesisException.class, e -> {
                    assertThat(e.getReason()).isEqualTo("DashScope TTS error: 400");
                    assertThat(e.getHttpStatus()).isEqualTo(400);
                    assertThat(e.getResponseBody()).isEqualTo("bad voice");
                });
    }

    @Test
    void transportFailureHasNoStatus() {
        server.expect(requestTo(URL)).andRespond(withException(new IOException("reset")));

        assertThatThrownBy(() -> provider("key-2").synthesize("hi", "en", null, null))
                .isInstanceOfSatisfying(SynthesisException.class, e -> {
                    assertThat(e.hasHttpStatus()).isFalse();
                    assertThat(e.getReason()).startsWith("TTS failed:");
                });
    }
}
