package com.seamtalk.protocol;

import com.seamtalk.domain.Direction;
import com.seamtalk.domain.SessionMode;
import com.seamtalk.domain.Side;
import com.seamtalk.exception.ProtocolViolationException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * A parsed relay-to-client message.
 *
 * @param type classified message type
 * @param json parsed payload
 */
public record RecognitionEvent(RecognitionEventType type, JSONObject json) {

    public static final String UI_SIDE = "ui_side";
    public static final String UI_SOURCE_LANG = "ui_source_lang";
    public static final String UI_TARGET_LANG = "ui_target_lang";
    public static final String UI_MODE = "ui_mode";

    /**
     * @throws ProtocolViolationException if the payload is not a JSON object
     */
    public static RecognitionEvent parse(String raw) {
        if (raw == null) {
            throw new ProtocolViolationException("Recognition event is empty");
        }
        try {
            JSONObject json = new JSONObject(raw);
            return new RecognitionEvent(RecognitionEventType.fromWire(json.optString("type", "")), json);
        } catch (JSONException e) {
            throw new ProtocolViolationException("Recognition event is not JSON", e);
        }
    }

    /** Display text of a partial: {@code text} followed by the provider's unstable {@code stash}. */
    public String partialText() {
        return json.optString("text", "") + json.optString("stash", "");
    }

    public String transcript() {
        return json.optString("transcript", "");
    }

    /** @return detected language of a completed transcript, empty when the provider sent none */
    public Optional<String> language() {
        String lang = json.optString("language", "");
        return lang.isBlank() ? Optional.empty() : Optional.of(lang);
    }

    /**
     * Routing decision the relay attached to a completed transcript.
     *
     * @return empty if the annotations are missing or incomplete
     */
    public Optional<Direction> annotatedDirection() {
        Optional<Side> side = Side.fromWire(json.optString(UI_SIDE, null));
        String source = json.optString(UI_SOURCE_LANG, "");
        String target = json.optString(UI_TARGET_LANG, "");
        if (side.isEmpty() || source.isBlank() || target.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new Direction(side.get(), source, target));
    }

    public Optional<SessionMode> annotatedMode() {
        return SessionMode.fromWire(json.optString(UI_MODE, null));
    }

    /** @return {@code error.message}, falling back to a top-level {@code message} */
    public String errorMessage() {
        JSONObject error = json.optJSONObject("error");
        if (error != null) {
            return error.optString("message", "");
        }
        return json.optString("error", json.optString("message", ""));
    }

    public String errorDetail() {
        JSONObject error = json.optJSONObject("error");
        return error == null ? "" : error.optString("detail", "");
    }

    public String finishReason() {
        return json.optString("reason", "");
    }
}
