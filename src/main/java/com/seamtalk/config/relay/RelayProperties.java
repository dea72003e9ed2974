package com.seamtalk.config.relay;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the realtime relay endpoint and its upstream recognition provider.
 *
 * <p>A missing API key does not fail startup: each client connection gets an {@code error}
 * instead, so the REST endpoints stay usable.
 */
@Validated
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    static final String DEFAULT_PATH = "/api/v1/asr/realtime";
    static final int DEFAULT_PENDING_LIMIT = 256;
    static final int DEFAULT_MAX_TEXT_MESSAGE_BYTES = 256 * 1024;

    /** WebSocket upgrade path; no other path is upgraded. */
    @NotBlank
    private final String path;

    /** Client messages queued while the upstream handshake is pending. 0 drops them. */
    @Min(0)
    @Max(10_000)
    private final int pendingMessageLimit;

    /** Largest client text message accepted, in bytes. */
    @Min(1024)
    private final int maxTextMessageBytes;

    @Valid
    private final Upstream upstream;

    @ConstructorBinding
    public RelayProperties(String path,
                           Integer pendingMessageLimit,
                           Integer maxTextMessageBytes,
                           Upstream upstream) {
        this.path = (path == null || path.isBlank()) ? DEFAULT_PATH : path;
        this.pendingMessageLimit = pendingMessageLimit == null ? DEFAULT_PENDING_LIMIT : pendingMessageLimit;
        this.maxTextMessageBytes = maxTextMessageBytes == null ? DEFAULT_MAX_TEXT_MESSAGE_BYTES : maxTextMessageBytes;
        this.upstream = upstream == null ? new Upstream(null, null, null, null) : upstream;
    }

    public String getPath() { return path; }
    public int getPendingMessageLimit() { return pendingMessageLimit; }
    public int getMaxTextMessageBytes() { return maxTextMessageBytes; }
    public Upstream getUpstream() { return upstream; }

    /**
     * Upstream recognition provider connection settings.
     */
    public static class Upstream {

        static final String DEFAULT_BASE_URL = "wss://dashscope-intl.aliyuncs.com/api-ws/v1/realtime";
        static final String DEFAULT_MODEL = "qwen3-asr-flash-realtime";
        static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

        /** Bearer credential; blank means every connection is answered with an error. */
        private final String apiKey;

        @NotBlank
        private final String baseUrl;

        @NotBlank
        private final String defaultModel;

        private final Duration connectTimeout;

        public Upstream(String apiKey, String baseUrl, String defaultModel, Duration connectTimeout) {
            this.apiKey = (apiKey == null || apiKey.isBlank()) ? null : apiKey.trim();
            this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? DEFAULT_BASE_URL : baseUrl;
            this.defaultModel = (defaultModel == null || defaultModel.isBlank()) ? DEFAULT_MODEL : defaultModel;
            this.connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
        }

        public String getApiKey() { return apiKey; }
        public boolean hasApiKey() { return apiKey != null; }
        public String getBaseUrl() { return baseUrl; }
        public String getDefaultModel() { return defaultModel; }
        public Duration getConnectTimeout() { return connectTimeout; }
    }
}
