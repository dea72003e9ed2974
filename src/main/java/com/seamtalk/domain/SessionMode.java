package com.seamtalk.domain;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * How a turn's side and translation direction are determined.
 */
public enum SessionMode {
    /** Side chosen by the physical control pressed; languages come from configuration. */
    FIXED_SIDES("fixed_sides", Set.of("dual_button")),
    /** Side and direction resolved by the relay from the recognized language. */
    AUTO_DETECT("auto_detect", Set.of("single_button"));

    private final String wireName;
    private final Set<String> aliases;

    SessionMode(String wireName, Set<String> aliases) {
        this.wireName = wireName;
        this.aliases = aliases;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SessionMode> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (SessionMode mode : values()) {
            if (mode.wireName.equals(v) || mode.aliases.contains(v) || mode.name().toLowerCase(Locale.ROOT).equals(v)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
