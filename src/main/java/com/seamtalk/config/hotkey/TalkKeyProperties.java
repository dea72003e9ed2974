package com.seamtalk.config.hotkey;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the global talk keys.
 *
 * In fixed-sides mode each person holds their own key; in auto-detect mode any of them (or the
 * dedicated auto key) starts a turn whose side is decided by the detected language.
 * Values are validated on startup for fail-fast behavior.
 */
@Validated
@ConfigurationProperties(prefix = "talk-keys")
public class TalkKeyProperties {

    /** Key held by side A (e.g., LEFT_ALT, F13). */
    @NotBlank
    private final String sideAKey;

    /** Key held by side B. */
    @NotBlank
    private final String sideBKey;

    /** Optional side-less key for auto-detect mode; null when not bound. */
    private final String autoKey;

    @ConstructorBinding
    public TalkKeyProperties(String sideAKey, String sideBKey, String autoKey) {
        this.sideAKey = (sideAKey == null || sideAKey.isBlank()) ? "LEFT_ALT" : sideAKey;
        this.sideBKey = (sideBKey == null || sideBKey.isBlank()) ? "RIGHT_ALT" : sideBKey;
        this.autoKey = (autoKey == null || autoKey.isBlank()) ? null : autoKey;
    }

    public String getSideAKey() { return sideAKey; }
    public String getSideBKey() { return sideBKey; }
    public String getAutoKey() { return autoKey; }
}
