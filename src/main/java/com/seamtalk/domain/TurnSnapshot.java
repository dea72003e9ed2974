package com.seamtalk.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable view of a {@link Turn}, safe to hand to other threads (UI, tests, logs).
 *
 * @param id                 turn identity
 * @param side               owning side, {@code null} while undetermined in auto-detect mode
 * @param status             lifecycle status
 * @param partialText        latest partial transcript ("" when none)
 * @param finalText          final transcript, {@code null} until completed
 * @param translatedText     translation, {@link Turn#TRANSLATION_FAILED} on failure, {@code null} while pending
 * @param sourceLanguage     utterance language, {@code null} until known
 * @param targetLanguage     translation language, {@code null} until known
 * @param startedAt          when the press-down was accepted
 * @param endedAt            when the turn completed or was abandoned, {@code null} while open
 */
public record TurnSnapshot(
        UUID id,
        Side side,
        TurnStatus status,
        String partialText,
        String finalText,
        String translatedText,
        String sourceLanguage,
        String targetLanguage,
        Instant startedAt,
        Instant endedAt
) {

    public boolean translationFailed() {
        return Turn.TRANSLATION_FAILED.equals(translatedText);
    }
}
