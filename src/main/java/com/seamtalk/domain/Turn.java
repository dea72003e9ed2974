package com.seamtalk.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One hold-to-talk interval and the text it produced.
 *
 * <p>Mutable, but confined to the session's serial executor: only the client session state
 * machine mutates it. Other threads see it through {@link #snapshot()}.
 *
 * <p>Invariants: the partial text can change only while the turn is {@link TurnStatus#OPEN};
 * the final text and the translated text are each set at most once.
 */
public final class Turn {

    /** Marker stored as translated text when the translation collaborator failed. */
    public static final String TRANSLATION_FAILED = "[translation failed]";

    private final UUID id;
    private final Instant startedAt;
    private Side side;
    private TurnStatus status = TurnStatus.OPEN;
    private String partialText = "";
    private String finalText;
    private String translatedText;
    private String sourceLanguage;
    private String targetLanguage;
    private Instant endedAt;

    public Turn(UUID id, Side side, Instant startedAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.side = side;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    public UUID id() {
        return id;
    }

    public Side side() {
        return side;
    }

    public TurnStatus status() {
        return status;
    }

    public String partialText() {
        return partialText;
    }

    public String finalText() {
        return finalText;
    }

    public String translatedText() {
        return translatedText;
    }

    public String sourceLanguage() {
        return sourceLanguage;
    }

    public String targetLanguage() {
        return targetLanguage;
    }

    public boolean isOpen() {
        return status == TurnStatus.OPEN;
    }

    /**
     * Overwrites the partial transcript.
     *
     * @return {@code false} if the turn is no longer open (stale partial), {@code true} otherwise
     */
    public boolean updatePartial(String text) {
        if (!isOpen()) {
            return false;
        }
        this.partialText = text == null ? "" : text;
        return true;
    }

    /** Sets the language pair before the transcript is known (fixed-sides mode). */
    public void assignDirection(Direction direction) {
        this.side = direction.side();
        this.sourceLanguage = direction.sourceLanguage();
        this.targetLanguage = direction.targetLanguage();
    }

    /**
     * Records the final transcript and the routing decision, closing the turn.
     *
     * @throws IllegalStateException if the turn is not open
     */
    public void complete(String transcript, Direction direction, Instant at) {
        if (!isOpen()) {
            throw new IllegalStateException("Turn " + id + " is already " + status);
        }
        assignDirection(direction);
        this.finalText = transcript == null ? "" : transcript;
        this.partialText = "";
        this.status = TurnStatus.COMPLETED;
        this.endedAt = at;
    }

    /** Closes the turn without a transcript. No-op if already closed. */
    public void abandon(Instant at) {
        if (!isOpen()) {
            return;
        }
        this.status = TurnStatus.ABANDONED;
        this.endedAt = at;
    }

    /**
     * Stores the translation once.
     *
     * @return {@code false} if a translation (or failure marker) was already stored
     */
    public boolean applyTranslation(String translation) {
        if (translatedText != null) {
            return false;
        }
        this.translatedText = translation == null ? "" : translation;
        return true;
    }

    public boolean markTranslationFailed() {
        return applyTranslation(TRANSLATION_FAILED);
    }

    public TurnSnapshot snapshot() {
        return new TurnSnapshot(id, side, status, partialText, finalText, translatedText,
                sourceLanguage, targetLanguage, startedAt, endedAt);
    }

    @Override
    public String toString() {
        return "Turn{" + id + ", side=" + side + ", status=" + status + '}';
    }
}
