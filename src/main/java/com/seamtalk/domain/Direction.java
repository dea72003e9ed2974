package com.seamtalk.domain;

import java.util.Objects;

/**
 * Routing decision for one utterance: who spoke, and which way the translation goes.
 *
 * @param side           resolved speaker side
 * @param sourceLanguage language the utterance is in
 * @param targetLanguage language to translate into
 */
public record Direction(Side side, String sourceLanguage, String targetLanguage) {

    public Direction {
        Objects.requireNonNull(side, "side must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
    }

    /** Direction for a configured side: speak that side's language, translate to the other's. */
    public static Direction forSide(Side side, SessionConfiguration config) {
        return new Direction(side, config.languageOf(side), config.languageOf(side.other()));
    }
}
