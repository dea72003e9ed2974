package com.seamtalk.service.hotkey;

import java.util.Locale;

/**
 * Keyboard event as seen by the talk-key subsystem, decoupled from the native hook library so
 * tests can feed events directly.
 *
 * @param type       press or release
 * @param key        canonical upper-case key name (see {@link KeyNameMapper})
 * @param whenMillis wall-clock time of the event
 */
public record NormalizedKeyEvent(Type type, String key, long whenMillis) {

    public enum Type { PRESSED, RELEASED }

    public NormalizedKeyEvent {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        key = key.toUpperCase(Locale.ROOT);
    }

    public static NormalizedKeyEvent pressed(String key) {
        return new NormalizedKeyEvent(Type.PRESSED, key, System.currentTimeMillis());
    }

    public static NormalizedKeyEvent released(String key) {
        return new NormalizedKeyEvent(Type.RELEASED, key, System.currentTimeMillis());
    }
}
