package com.seamtalk.protocol;

import com.seamtalk.domain.SessionConfiguration;
import com.seamtalk.domain.SessionMode;
import com.seamtalk.exception.ProtocolViolationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientMessageTest {

    @Test
    void readsSessionSettings() {
        ClientMessage msg = ClientMessage.parse(
                "{\"type\":\"session.update\",\"session\":{\"mode\":\"auto_detect\",\"left_lang\":\"ja\",\"right_lang\":\"ko\",\"model\":\"m1\"}}");

        SessionConfiguration config = msg.toSessionConfiguration();

        assertThat(config).isEqualTo(new SessionConfiguration(SessionMode.AUTO_DETECT, "ja", "ko", "m1"));
    }

    @Test
    void acceptsCamelCaseAndLegacyModeNames() {
        ClientMessage msg = ClientMessage.parse(
                "{\"type\":\"session.update\",\"session\":{\"mode\":\"single_button\",\"leftLang\":\"fr\",\"rightLang\":\"de\"}}");

        SessionConfiguration config = msg.toSessionConfiguration();

        assertThat(config.mode()).isEqualTo(SessionMode.AUTO_DETECT);
        assertThat(config.sideALanguage()).isEqualTo("fr");
        assertThat(config.sideBLanguage()).isEqualTo("de");
    }

    @Test
    void missingSessionFallsBackToDefaults() {
        SessionConfiguration config = ClientMessage.parse("{\"type\":\"session.update\"}").toSessionConfiguration();

        assertThat(config.mode()).isEqualTo(SessionMode.FIXED_SIDES);
        assertThat(config.sideALanguage()).isEqualTo(ClientMessage.DEFAULT_SIDE_A_LANGUAGE);
        assertThat(config.sideBLanguage()).isEqualTo(ClientMessage.DEFAULT_SIDE_B_LANGUAGE);
        assertThat(config.model()).isNull();
    }

    @Test
    void classifiesTypes() {
        assertThat(ClientMessage.parse("{\"type\":\"input_audio_buffer.append\"}").type())
                .contains(ClientMessageType.AUDIO_APPEND);
        assertThat(ClientMessage.parse("{\"type\":\"custom.thing\"}").type()).isEmpty();
        assertThat(ClientMessage.parse("{}").rawType()).isEmpty();
    }

    @Test
    void rejectsNonJson() {
        assertThatThrownBy(() -> ClientMessage.parse("hello"))
                .isInstanceOf(ProtocolViolationException.class);
        assertThatThrownBy(() -> ClientMessage.parse(null))
                .isInstanceOf(ProtocolViolationException.class);
    }

    @Test
    void nonUpdateHasNoSessionConfiguration() {
        assertThatThrownBy(() -> ClientMessage.parse("{\"type\":\"input_audio_buffer.commit\"}").toSessionConfiguration())
                .isInstanceOf(ProtocolViolationException.class)
                .hasMessageContaining("input_audio_buffer.commit");
    }
}
