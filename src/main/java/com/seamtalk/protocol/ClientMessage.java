package com.seamtalk.protocol;

import com.seamtalk.domain.SessionConfiguration;
import com.seamtalk.domain.SessionMode;
import com.seamtalk.exception.ProtocolViolationException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * A parsed client-to-relay message. Keeps the raw text so the relay can forward it byte for byte.
 *
 * @param raw  original payload
 * @param json parsed payload
 */
public record ClientMessage(String raw, JSONObject json) {

    public static final String DEFAULT_SIDE_A_LANGUAGE = "zh";
    public static final String DEFAULT_SIDE_B_LANGUAGE = "en";

    /**
     * Parses a client payload.
     *
     * @throws ProtocolViolationException if the payload is not a JSON object
     */
    public static ClientMessage parse(String raw) {
        if (raw == null) {
            throw new ProtocolViolationException("Invalid JSON from client");
        }
        try {
            return new ClientMessage(raw, new JSONObject(raw));
        } catch (JSONException e) {
            throw new ProtocolViolationException("Invalid JSON from client", e);
        }
    }

    /** @return the {@code type} field, or "" when absent */
    public String rawType() {
        return json.optString("type", "");
    }

    public Optional<ClientMessageType> type() {
        return ClientMessageType.fromWire(rawType());
    }

    public boolean isSessionUpdate() {
        return type().filter(t -> t == ClientMessageType.SESSION_UPDATE).isPresent();
    }

    /**
     * Reads the session settings of a {@code session.update}. Absent fields fall back to
     * fixed-sides mode with zh/en; both snake_case and camelCase language keys are accepted.
     *
     * @throws ProtocolViolationException if this is not a {@code session.update}
     */
    public SessionConfiguration toSessionConfiguration() {
        if (!isSessionUpdate()) {
            throw new ProtocolViolationException("Expected session.update but got '" + rawType() + "'");
        }
        JSONObject session = json.optJSONObject("session");
        if (session == null) {
            session = new JSONObject();
        }
        SessionMode mode = SessionMode.fromWire(session.optString("mode", null)).orElse(SessionMode.FIXED_SIDES);
        String sideA = firstNonBlank(session, "left_lang", "leftLang", DEFAULT_SIDE_A_LANGUAGE);
        String sideB = firstNonBlank(session, "right_lang", "rightLang", DEFAULT_SIDE_B_LANGUAGE);
        String model = session.optString("model", null);
        return new SessionConfiguration(mode, sideA, sideB, model);
    }

    private static String firstNonBlank(JSONObject obj, String key, String altKey, String fallback) {
        String v = obj.optString(key, "");
        if (!v.isBlank()) {
            return v;
        }
        v = obj.optString(altKey, "");
        return v.isBlank() ? fallback : v;
    }
}
