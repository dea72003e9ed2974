package com.seamtalk.service.speech;

import java.time.Instant;

/**
 * Published when the relay returned audio for a translation. Playback is up to listeners.
 *
 * @param text        spoken text
 * @param language    language tag of {@code text}
 * @param audioUrl    hosted audio, may be {@code null}
 * @param audioBase64 inline audio, may be {@code null}
 * @param format      {@code mp3} or {@code wav}
 * @param at          when the audio arrived
 */
public record SpeechSynthesizedEvent(String text, String language, String audioUrl, String audioBase64,
                                     String format, Instant at) {
}
