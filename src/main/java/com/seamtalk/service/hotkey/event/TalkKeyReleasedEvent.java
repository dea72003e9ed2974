package com.seamtalk.service.hotkey.event;

import com.seamtalk.domain.Side;

import java.time.Instant;

/**
 * Published when a held talk key is released.
 *
 * @param side side bound to the key, {@code null} for the auto-detect key
 * @param at   when the key went up
 */
public record TalkKeyReleasedEvent(Side side, Instant at) { }
