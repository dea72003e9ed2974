package com.seamtalk.service.audio;

import java.util.Arrays;
import java.util.Objects;

import static com.seamtalk.service.audio.AudioFormat.TARGET_BLOCK_ALIGN;
import static com.seamtalk.service.audio.AudioFormat.TARGET_SAMPLE_RATE;

/**
 * Converts native capture PCM into 16 kHz / mono / 16-bit little-endian frames.
 *
 * <p>Channels are down-mixed by averaging; the rate is converted by linear interpolation.
 * Accepts 8, 16, 24 and 32-bit signed PCM in either byte order and 8-bit unsigned PCM.
 *
 * <p>Stateful: the interpolation phase and the last input sample carry over between
 * {@link #convert(byte[], int)} calls, so consecutive windows join without clicks. Not
 * thread-safe; one instance per capture.
 */
public final class PcmResampler {

    private final int sourceRate;
    private final int channels;
    private final int bytesPerSample;
    private final int frameSize;
    private final boolean signed;
    private final boolean bigEndian;
    private final double scaleTo16Bit;
    /** Input frames advanced per output frame. */
    private final double step;

    /** Position of the next output frame, in input frames relative to the current window. */
    private double position;
    private double lastSample;
    private boolean hasLastSample;

    public PcmResampler(javax.sound.sampled.AudioFormat source) {
        Objects.requireNonNull(source, "source format must not be null");
        javax.sound.sampled.AudioFormat.Encoding encoding = source.getEncoding();
        if (!javax.sound.sampled.AudioFormat.Encoding.PCM_SIGNED.equals(encoding)
                && !javax.sound.sampled.AudioFormat.Encoding.PCM_UNSIGNED.equals(encoding)) {
            throw new IllegalArgumentException("Unsupported encoding: " + encoding);
        }
        int bits = source.getSampleSizeInBits();
        if (bits != 8 && bits != 16 && bits != 24 && bits != 32) {
            throw new IllegalArgumentException("Unsupported sample size: " + bits + " bits");
        }
        if (source.getChannels() < 1) {
            throw new IllegalArgumentException("Unsupported channel count: " + source.getChannels());
        }
        if (source.getSampleRate() <= 0) {
            throw new IllegalArgumentException("Unsupported sample rate: " + source.getSampleRate());
        }
        this.sourceRate = Math.round(source.getSampleRate());
        this.channels = source.getChannels();
        this.bytesPerSample = bits / 8;
        this.frameSize = bytesPerSample * channels;
        this.signed = javax.sound.sampled.AudioFormat.Encoding.PCM_SIGNED.equals(encoding);
        this.bigEndian = source.isBigEndian();
        this.scaleTo16Bit = Math.pow(2, 16 - bits);
        this.step = (double) sourceRate / TARGET_SAMPLE_RATE;
    }

    /** Bytes per native input frame (all channels). */
    public int frameSize() {
        return frameSize;
    }

    /** Upper bound of output frames for {@code inputFrames} native frames. */
    public int outputCapacity(int inputFrames) {
        return (int) Math.floor((double) inputFrames * TARGET_SAMPLE_RATE / sourceRate) + 1;
    }

    /**
     * Converts one window of native audio. A trailing partial frame is ignored.
     *
     * @return 16 kHz mono PCM16LE bytes; empty when the window produced no output frame
     */
    public byte[] convert(byte[] data, int length) {
        int frames = Math.min(length, data.length) / frameSize;
        if (frames == 0) {
            return new byte[0];
        }
        double[] mono = downmix(data, frames);
        int capacity = outputCapacity(frames);
        byte[] out = new byte[capacity * TARGET_BLOCK_ALIGN];
        int count = 0;
        while (count < capacity && position <= frames - 1) {
            int i = (int) Math.floor(position);
            double frac = position - i;
            double a = i < 0 ? (hasLastSample ? lastSample : mono[0]) : mono[i];
            double b = i + 1 < frames ? mono[i + 1] : a;
            writeSample(out, count, a + (b - a) * frac);
            count++;
            position += step;
        }
        position -= frames;
        lastSample = mono[frames - 1];
        hasLastSample = true;
        return count == capacity ? out : Arrays.copyOf(out, count * TARGET_BLOCK_ALIGN);
    }

    /** Forgets the carried phase and sample, e.g. before a new capture. */
    public void reset() {
        position = 0;
        lastSample = 0;
        hasLastSample = false;
    }

    private double[] downmix(byte[] data, int frames) {
        double[] mono = new double[frames];
        for (int f = 0; f < frames; f++) {
            int base = f * frameSize;
            double sum = 0;
            for (int c = 0; c < channels; c++) {
                sum += readSample(data, base + c * bytesPerSample);
            }
            mono[f] = sum / channels;
        }
        return mono;
    }

    private double readSample(byte[] data, int offset) {
        long v = 0;
        if (bigEndian) {
            for (int k = 0; k < bytesPerSample; k++) {
                v = (v << 8) | (data[offset + k] & 0xFF);
            }
        } else {
            for (int k = bytesPerSample - 1; k >= 0; k--) {
                v = (v << 8) | (data[offset + k] & 0xFF);
            }
        }
        int bits = bytesPerSample * 8;
        if (signed) {
            v = (v << (64 - bits)) >> (64 - bits);
        } else {
            v -= 1L << (bits - 1);
        }
        return v * scaleTo16Bit;
    }

    private static void writeSample(byte[] out, int index, double value) {
        long s = Math.round(value);
        if (s > Short.MAX_VALUE) {
            s = Short.MAX_VALUE;
        } else if (s < Short.MIN_VALUE) {
            s = Short.MIN_VALUE;
        }
        int off = index * TARGET_BLOCK_ALIGN;
        out[off] = (byte) (s & 0xFF);
        out[off + 1] = (byte) ((s >> 8) & 0xFF);
    }
}
