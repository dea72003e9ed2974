package com.seamtalk.service.audio;

import java.util.List;

/**
 * Audio format constants of the realtime session protocol.
 * Frames on the wire are 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Wire sample rate in Hz. */
    public static final int TARGET_SAMPLE_RATE = 16_000;
    /** Wire bits per sample. */
    public static final int TARGET_BITS_PER_SAMPLE = 16;
    /** Wire channel count (mono). */
    public static final int TARGET_CHANNELS = 1;
    /** Bytes per wire frame. */
    public static final int TARGET_BLOCK_ALIGN = (TARGET_BITS_PER_SAMPLE / 8) * TARGET_CHANNELS; // 2 bytes

    /** Capture rate tried first; most built-in microphones run at 48 kHz natively. */
    public static final int DEFAULT_CAPTURE_SAMPLE_RATE = 48_000;

    /** Rates tried after the preferred one, in order. */
    public static final List<Integer> FALLBACK_CAPTURE_SAMPLE_RATES = List.of(44_100, 48_000, 16_000);

    private AudioFormat() {}
}
