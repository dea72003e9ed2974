package com.seamtalk.service.audio;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PcmResamplerTest {

    private static javax.sound.sampled.AudioFormat pcm16(int rate, int channels) {
        return new javax.sound.sampled.AudioFormat(rate, 16, channels, true, false);
    }

    private static byte[] samples(short... values) {
        ByteBuffer buf = ByteBuffer.allocate(values.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (short v : values) {
            buf.putShort(v);
        }
        return buf.array();
    }

    private static short sampleAt(byte[] pcm, int index) {
        return ByteBuffer.wrap(pcm).order(ByteOrder.LITTLE_ENDIAN).getShort(index * 2);
    }

    @Test
    void passesThroughWireFormat() {
        PcmResampler resampler = new PcmResampler(pcm16(16_000, 1));
        byte[] in = samples((short) 1, (short) -2, (short) 300, Short.MAX_VALUE, Short.MIN_VALUE);

        assertThat(resampler.convert(in, in.length)).isEqualTo(in);
    }

    @Test
    void downmixesStereoByAveraging() {
        PcmResampler resampler = new PcmResampler(pcm16(16_000, 2));
        byte[] in = samples((short) 1000, (short) 3000, (short) -400, (short) 400);

        byte[] out = resampler.convert(in, in.length);

        assertThat(out).hasSize(4);
        assertThat(sampleAt(out, 0)).isEqualTo((short) 2000);
        assertThat(sampleAt(out, 1)).isEqualTo((short) 0);
    }

    @Test
    void consecutiveWindowsKeepPhase() {
        // 48 kHz in 1024-frame windows: 3072 input frames must yield exactly 1024 output frames
        PcmResampler resampler = new PcmResampler(pcm16(48_000, 1));
        byte[] window = new byte[1024 * 2];

        int first = resampler.convert(window, window.length).length / 2;
        int second = resampler.convert(window, window.length).length / 2;
        int third = resampler.convert(window, window.length).length / 2;

        assertThat(first).isEqualTo(342);
        assertThat(second).isEqualTo(341);
        assertThat(third).isEqualTo(341);
        assertThat(first + second + third).isEqualTo(1024);
    }

    @Test
    void resetForgetsPhase() {
        PcmResampler resampler = new PcmResampler(pcm16(48_000, 1));
        byte[] window = new byte[1024 * 2];
        resampler.convert(window, window.length);

        resampler.reset();

        assertThat(resampler.convert(window, window.length)).hasSize(342 * 2);
    }

    @Test
    void convertsUnsignedEightBit() {
        PcmResampler resampler = new PcmResampler(
                new javax.sound.sampled.AudioFormat(javax.sound.sampled.AudioFormat.Encoding.PCM_UNSIGNED,
                        16_000, 8, 1, 1, 16_000, false));

        byte[] out = resampler.convert(new byte[]{(byte) 0x80, (byte) 0xFF, 0x00}, 3);

        assertThat(sampleAt(out, 0)).isEqualTo((short) 0);
        assertThat(sampleAt(out, 1)).isEqualTo((short) (127 * 256));
        assertThat(sampleAt(out, 2)).isEqualTo((short) (-128 * 256));
    }

    @Test
    void convertsBigEndian() {
        PcmResampler resampler = new PcmResampler(new javax.sound.sampled.AudioFormat(16_000, 16, 1, true, true));

        byte[] out = resampler.convert(new byte[]{0x01, 0x02}, 2);

        assertThat(sampleAt(out, 0)).isEqualTo((short) 0x0102);
    }

    @Test
    void ignoresTrailingPartialFrame() {
        PcmResampler resampler = new PcmResampler(pcm16(16_000, 1));

        assertThat(resampler.convert(new byte[]{1}, 1)).isEmpty();
        assertThat(resampler.convert(new byte[]{1, 0, 7}, 3)).hasSize(2);
    }

    @Test
    void rejectsUnsupportedFormats() {
        assertThatThrownBy(() -> new PcmResampler(new javax.sound.sampled.AudioFormat(
                javax.sound.sampled.AudioFormat.Encoding.ULAW, 8000, 8, 1, 1, 8000, false)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("encoding");
        assertThatThrownBy(() -> new PcmResampler(new javax.sound.sampled.AudioFormat(16_000, 12, 1, true, false)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
