package com.seamtalk.service.hotkey;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Canonicalizes key names and validates them against the keys a talk key may be bound to.
 */
public final class KeyNameMapper {

    /** Modifier keys the native hook reports as standalone presses. */
    public static final List<String> SIDED_MODIFIERS = List.of(
            "LEFT_SHIFT", "RIGHT_SHIFT", "LEFT_CONTROL", "RIGHT_CONTROL",
            "LEFT_ALT", "RIGHT_ALT", "LEFT_META", "RIGHT_META");

    private static final Set<String> ALLOWED_KEYS;

    static {
        Set<String> keys = new HashSet<>();
        for (char c = 'A'; c <= 'Z'; c++) {
            keys.add(String.valueOf(c));
        }
        for (char c = '0'; c <= '9'; c++) {
            keys.add(String.valueOf(c));
        }
        IntStream.rangeClosed(1, 24).forEach(i -> keys.add("F" + i));
        keys.addAll(List.of("ESCAPE", "ENTER", "TAB", "SPACE", "BACKSPACE"));
        keys.addAll(SIDED_MODIFIERS);
        ALLOWED_KEYS = Set.copyOf(keys);
    }

    private KeyNameMapper() {}

    /** Canonicalize a key name (case-insensitive, spaces to underscores, CMD/COMMAND/OPTION aliases). */
    public static String normalizeKey(String keyText) {
        if (keyText == null) {
            return "UNKNOWN";
        }
        String k = keyText.trim().toUpperCase(Locale.ROOT)
                .replace(' ', '_')
                .replace("COMMAND", "META")
                .replace("CMD", "META")
                .replace("OPTION", "ALT");
        if (k.contains("RIGHT_META")) {
            return "RIGHT_META";
        }
        if (k.contains("LEFT_META")) {
            return "LEFT_META";
        }
        return k;
    }

    public static boolean isValidKey(String key) {
        return ALLOWED_KEYS.contains(normalizeKey(key));
    }
}
