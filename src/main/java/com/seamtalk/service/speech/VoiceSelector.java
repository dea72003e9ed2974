package com.seamtalk.service.speech;

import java.util.Locale;
import java.util.Map;

/**
 * Maps a language tag to the speech provider's {@code language_type}.
 * Region tags are matched by their primary subtag ({@code en-US} is English); anything unknown
 * falls back to {@link #DEFAULT_LANGUAGE_TYPE}.
 */
public final class VoiceSelector {

    public static final String DEFAULT_LANGUAGE_TYPE = "English";

    private static final Map<String, String> LANGUAGE_TYPES = Map.of(
            "zh", "Chinese",
            "en", "English",
            "ja", "Japanese",
            "ko", "Korean",
            "es", "Spanish",
            "fr", "French",
            "de", "German"
    );

    private VoiceSelector() {
    }

    public static String languageType(String languageTag) {
        if (languageTag == null || languageTag.isBlank()) {
            return DEFAULT_LANGUAGE_TYPE;
        }
        String primary = languageTag.trim().toLowerCase(Locale.ROOT).split("[-_]", 2)[0];
        return LANGUAGE_TYPES.getOrDefault(primary, DEFAULT_LANGUAGE_TYPE);
    }
}
