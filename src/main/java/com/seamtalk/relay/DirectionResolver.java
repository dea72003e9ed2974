package com.seamtalk.relay;

import com.seamtalk.domain.Direction;
import com.seamtalk.domain.SessionConfiguration;
import com.seamtalk.domain.Side;

/**
 * Decides which side spoke, and the translation direction, from the language the provider
 * detected.
 *
 * <p>Order matters: exact matches win over prefix matches ("en-US" against "en"), and side A
 * wins ties. An unrecognized language is attributed to side A, keeping the detected language
 * as source and side B's language as target. A missing language defaults to side A.
 */
public final class DirectionResolver {

    private DirectionResolver() {}

    public static Direction resolve(SessionConfiguration config, String detectedLanguage) {
        return resolve(config.sideALanguage(), config.sideBLanguage(), detectedLanguage);
    }

    public static Direction resolve(String sideALanguage, String sideBLanguage, String detectedLanguage) {
        Direction toB = new Direction(Side.A, sideALanguage, sideBLanguage);
        if (detectedLanguage == null || detectedLanguage.isBlank()) {
            return toB;
        }
        Direction toA = new Direction(Side.B, sideBLanguage, sideALanguage);
        if (detectedLanguage.equals(sideALanguage)) {
            return toB;
        }
        if (detectedLanguage.equals(sideBLanguage)) {
            return toA;
        }
        if (detectedLanguage.startsWith(sideALanguage)) {
            return toB;
        }
        if (detectedLanguage.startsWith(sideBLanguage)) {
            return toA;
        }
        return new Direction(Side.A, detectedLanguage, sideBLanguage);
    }
}
