package com.seamtalk.protocol;

/**
 * Message types sent from the relay (or the upstream provider) to the client.
 */
public enum RecognitionEventType {
    /** Incremental transcript: {@code text} plus optional {@code stash}. */
    PARTIAL("conversation.item.input_audio_transcription.text"),
    /** Final transcript of the committed audio: {@code transcript} and {@code language}. */
    COMPLETED("conversation.item.input_audio_transcription.completed"),
    /** The relay's upstream connection ended. */
    SESSION_FINISHED("session.finished"),
    ERROR("error"),
    /** Any other provider event; forwarded untouched and ignored by the client. */
    OTHER("");

    private final String wireName;

    RecognitionEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RecognitionEventType fromWire(String type) {
        if (type == null || type.isEmpty()) {
            return OTHER;
        }
        for (RecognitionEventType t : values()) {
            if (t != OTHER && t.wireName.equals(type)) {
                return t;
            }
        }
        return OTHER;
    }
}
