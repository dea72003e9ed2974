package com.seamtalk.protocol;

import com.seamtalk.domain.Direction;
import com.seamtalk.domain.SessionConfiguration;
import org.json.JSONObject;

/**
 * Builders for the JSON messages of the realtime session protocol.
 */
public final class WireMessages {

    /** Input sample rate announced in {@code session.update}. */
    public static final int SAMPLE_RATE = 16000;
    public static final String AUDIO_FORMAT = "pcm";

    private WireMessages() {}

    /**
     * First message of a connection. Carries the routing settings the relay reads
     * ({@code mode}, {@code left_lang}, {@code right_lang}, {@code model}) and the provider
     * settings it forwards.
     *
     * @param recognitionLanguage language hint for the provider, or {@code null} to let it detect
     */
    public static String sessionUpdate(SessionConfiguration config, String recognitionLanguage) {
        JSONObject session = new JSONObject()
                .put("mode", config.mode().wireName())
                .put("left_lang", config.sideALanguage())
                .put("right_lang", config.sideBLanguage())
                .put("input_audio_format", AUDIO_FORMAT)
                .put("sample_rate", SAMPLE_RATE);
        if (config.model() != null) {
            session.put("model", config.model());
        }
        JSONObject transcription = new JSONObject();
        if (recognitionLanguage != null && !recognitionLanguage.isBlank()) {
            transcription.put("language", recognitionLanguage);
        }
        session.put("input_audio_transcription", transcription);
        return typed(ClientMessageType.SESSION_UPDATE.wireName()).put("session", session).toString();
    }

    public static String audioAppend(String base64Pcm) {
        return typed(ClientMessageType.AUDIO_APPEND.wireName()).put("audio", base64Pcm).toString();
    }

    public static String audioCommit() {
        return typed(ClientMessageType.AUDIO_COMMIT.wireName()).toString();
    }

    public static String sessionFinish() {
        return typed(ClientMessageType.SESSION_FINISH.wireName()).toString();
    }

    public static String error(String message) {
        return error(message, null);
    }

    public static String error(String message, String detail) {
        JSONObject error = new JSONObject().put("message", message);
        if (detail != null) {
            error.put("detail", detail);
        }
        return typed(RecognitionEventType.ERROR.wireName()).put("error", error).toString();
    }

    public static String sessionFinished(String reason) {
        return typed(RecognitionEventType.SESSION_FINISHED.wireName())
                .put("reason", reason == null ? "" : reason).toString();
    }

    /** Adds the routing annotations to a completed-transcript event in place. */
    public static JSONObject annotate(JSONObject completed, Direction direction, SessionConfiguration config) {
        return completed
                .put(RecognitionEvent.UI_SIDE, direction.side().wireName())
                .put(RecognitionEvent.UI_SOURCE_LANG, direction.sourceLanguage())
                .put(RecognitionEvent.UI_TARGET_LANG, direction.targetLanguage())
                .put(RecognitionEvent.UI_MODE, config.mode().wireName());
    }

    private static JSONObject typed(String type) {
        return new JSONObject().put("type", type);
    }
}
