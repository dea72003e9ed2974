package com.seamtalk.protocol;

import java.util.Optional;

/**
 * Message types sent by the client to the relay.
 */
public enum ClientMessageType {
    SESSION_UPDATE("session.update"),
    AUDIO_APPEND("input_audio_buffer.append"),
    AUDIO_COMMIT("input_audio_buffer.commit"),
    SESSION_FINISH("session.finish");

    private final String wireName;

    ClientMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ClientMessageType> fromWire(String type) {
        for (ClientMessageType t : values()) {
            if (t.wireName.equals(type)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
