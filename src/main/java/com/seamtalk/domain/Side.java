package com.seamtalk.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * One of the two conversation participants.
 *
 * <p>The wire names keep the relay protocol's historical {@code left}/{@code right} vocabulary:
 * side A is the left control, side B the right one.
 */
public enum Side {
    A("left"),
    B("right");

    private final String wireName;

    Side(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public Side other() {
        return this == A ? B : A;
    }

    /**
     * Parses a wire or configuration value. Accepts {@code left}/{@code right} and {@code a}/{@code b}.
     *
     * @return the side, or empty for null, blank or unknown values
     */
    public static Optional<Side> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "left", "a" -> Optional.of(A);
            case "right", "b" -> Optional.of(B);
            default -> Optional.empty();
        };
    }
}
