package com.seamtalk.config.collaborators;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the translation and speech-synthesis providers behind the relay's REST
 * endpoints. Missing keys do not fail startup; the affected endpoint answers 500.
 */
@Validated
@ConfigurationProperties(prefix = "collaborators")
public class CollaboratorProperties {

    @Valid
    private final Translation translation;

    @Valid
    private final Speech speech;

    @ConstructorBinding
    public CollaboratorProperties(Translation translation, Speech speech) {
        this.translation = translation == null ? new Translation(null, null, null, null) : translation;
        this.speech = speech == null ? new Speech(null, null, null, null, null) : speech;
    }

    public Translation getTranslation() { return translation; }
    public Speech getSpeech() { return speech; }

    /**
     * Chat-completions translation provider.
     */
    public static class Translation {

        static final String KEY_VARIABLE = "DOUBAO_API_KEY";
        static final String DEFAULT_URL = "https://ark.cn-beijing.volces.com/api/v3/chat/completions";
        static final String DEFAULT_MODEL = "doubao-seed-1-6-flash-250828";
        static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

        private final String apiKey;

        @NotBlank
        private final String url;

        @NotBlank
        private final String model;

        private final Duration timeout;

        public Translation(String apiKey, String url, String model, Duration timeout) {
            this.apiKey = (apiKey == null || apiKey.isBlank()) ? null : apiKey.trim();
            this.url = (url == null || url.isBlank()) ? DEFAULT_URL : url;
            this.model = (model == null || model.isBlank()) ? DEFAULT_MODEL : model;
            this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        }

        public String getApiKey() { return apiKey; }
        public boolean hasApiKey() { return apiKey != null; }
        public String keyVariable() { return KEY_VARIABLE; }
        public String getUrl() { return url; }
        public String getModel() { return model; }
        public Duration getTimeout() { return timeout; }
    }

    /**
     * Text-to-speech provider.
     */
    public static class Speech {

        static final String KEY_VARIABLE = "DASHSCOPE_API_KEY";
        static final String DEFAULT_URL =
                "https://dashscope-intl.aliyuncs.com/api/v1/services/aigc/multimodal-generation/generation";
        static final String DEFAULT_MODEL = "qwen3-tts-flash";
        static final String DEFAULT_VOICE = "Cherry";
        static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

        private final String apiKey;

        @NotBlank
        private final String url;

        @NotBlank
        private final String model;

        @NotBlank
        private final String voice;

        private final Duration timeout;

        public Speech(String apiKey, String url, String model, String voice, Duration timeout) {
            this.apiKey = (apiKey == null || apiKey.isBlank()) ? null : apiKey.trim();
            this.url = (url == null || url.isBlank()) ? DEFAULT_URL : url;
            this.model = (model == null || model.isBlank()) ? DEFAULT_MODEL : model;
            this.voice = (voice == null || voice.isBlank()) ? DEFAULT_VOICE : voice;
            this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        }

        public String getApiKey() { return apiKey; }
        public boolean hasApiKey() { return apiKey != null; }
        public String keyVariable() { return KEY_VARIABLE; }
        public String getUrl() { return url; }
        public String getModel() { return model; }
        public String getVoice() { return voice; }
        public Duration getTimeout() { return timeout; }
    }
}
