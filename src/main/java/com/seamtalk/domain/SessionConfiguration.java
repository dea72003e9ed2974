package com.seamtalk.domain;

import java.util.Objects;

/**
 * Immutable per-connection session settings, fixed by the first {@code session.update}.
 *
 * @param mode          operating mode
 * @param sideALanguage configured language tag of side A (e.g. "zh")
 * @param sideBLanguage configured language tag of side B (e.g. "en")
 * @param model         recognition model identifier; {@code null} means the relay default
 */
public record SessionConfiguration(
        SessionMode mode,
        String sideALanguage,
        String sideBLanguage,
        String model
) {

    public SessionConfiguration {
        Objects.requireNonNull(mode, "mode must not be null");
        if (sideALanguage == null || sideALanguage.isBlank()) {
            throw new IllegalArgumentException("side A language must not be blank");
        }
        if (sideBLanguage == null || sideBLanguage.isBlank()) {
            throw new IllegalArgumentException("side B language must not be blank");
        }
        sideALanguage = sideALanguage.trim();
        sideBLanguage = sideBLanguage.trim();
        model = (model == null || model.isBlank()) ? null : model.trim();
    }

    public String languageOf(Side side) {
        return side == Side.A ? sideALanguage : sideBLanguage;
    }

    /** @return the model, or {@code defaultModel} when none was requested */
    public String modelOr(String defaultModel) {
        return model != null ? model : defaultModel;
    }
}
