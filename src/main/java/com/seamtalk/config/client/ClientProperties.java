package com.seamtalk.config.client;

import com.seamtalk.domain.SessionConfiguration;
import com.seamtalk.domain.SessionMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;

/**
 * Typed properties for the desktop hold-to-talk client.
 *
 * The client role is off unless {@code client.enabled=true}; a relay-only deployment never
 * touches the microphone or the keyboard hook.
 */
@Validated
@ConfigurationProperties(prefix = "client")
public class ClientProperties {

    private final boolean enabled;

    /** Realtime WebSocket endpoint of the relay. */
    @NotBlank
    private final String relayUrl;

    /** Base URL of the relay's REST endpoints (translation, speech). */
    @NotBlank
    private final String relayHttpUrl;

    /** fixed_sides (alias dual_button) or auto_detect (alias single_button). */
    @NotBlank
    private final String mode;

    @NotBlank
    private final String sideALanguage;

    @NotBlank
    private final String sideBLanguage;

    /** Recognition model; blank lets the relay pick its default. */
    private final String model;

    /** Longest wait for the final transcript after the talk key is released. */
    private final Duration finalizeTimeout;

    /** Speak each successful translation through the speech collaborator. */
    private final boolean speakTranslations;

    /** Turns kept in memory, oldest evicted first. */
    @Min(1)
    @Max(10_000)
    private final int turnHistory;

    @ConstructorBinding
    public ClientProperties(Boolean enabled,
                            String relayUrl,
                            String relayHttpUrl,
                            String mode,
                            String sideALanguage,
                            String sideBLanguage,
                            String model,
                            Duration finalizeTimeout,
                            Boolean speakTranslations,
                            Integer turnHistory) {
        this.enabled = Boolean.TRUE.equals(enabled);
        this.relayUrl = relayUrl == null ? "ws://localhost:8080/api/v1/asr/realtime" : relayUrl;
        this.relayHttpUrl = relayHttpUrl == null ? "http://localhost:8080" : relayHttpUrl;
        this.mode = mode == null ? SessionMode.FIXED_SIDES.wireName() : mode;
        this.sideALanguage = sideALanguage == null ? "zh" : sideALanguage;
        this.sideBLanguage = sideBLanguage == null ? "en" : sideBLanguage;
        this.model = model;
        this.finalizeTimeout = finalizeTimeout == null ? Duration.ofSeconds(3) : finalizeTimeout;
        this.speakTranslations = Boolean.TRUE.equals(speakTranslations);
        this.turnHistory = turnHistory == null ? 200 : turnHistory;
    }

    public boolean isEnabled() { return enabled; }
    public String getRelayUrl() { return relayUrl; }
    public String getRelayHttpUrl() { return relayHttpUrl; }
    public String getMode() { return mode; }
    public String getSideALanguage() { return sideALanguage; }
    public String getSideBLanguage() { return sideBLanguage; }
    public String getModel() { return model; }
    public Duration getFinalizeTimeout() { return finalizeTimeout; }
    public boolean isSpeakTranslations() { return speakTranslations; }
    public int getTurnHistory() { return turnHistory; }

    public URI relayUri() {
        return URI.create(relayUrl);
    }

    /**
     * @throws IllegalArgumentException for an unknown mode or blank languages
     */
    public SessionConfiguration toSessionConfiguration() {
        SessionMode sessionMode = SessionMode.fromWire(mode)
                .orElseThrow(() -> new IllegalArgumentException("Invalid client.mode: '" + mode
                        + "'. Allowed: fixed_sides, auto_detect (aliases dual_button, single_button)."));
        return new SessionConfiguration(sessionMode, sideALanguage, sideBLanguage, model);
    }
}
