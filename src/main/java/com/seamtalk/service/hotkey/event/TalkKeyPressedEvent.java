package com.seamtalk.service.hotkey.event;

import com.seamtalk.domain.Side;

import java.time.Instant;
import java.util.Optional;

/**
 * Published when a talk key goes down (key-repeat excluded).
 *
 * @param side side bound to the key, {@code null} for the auto-detect key
 * @param at   when the key went down
 */
public record TalkKeyPressedEvent(Side side, Instant at) {

    public Optional<Side> requestedSide() {
        return Optional.ofNullable(side);
    }
}
