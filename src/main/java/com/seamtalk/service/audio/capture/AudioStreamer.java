package com.seamtalk.service.audio.capture;

import com.seamtalk.exception.DeviceUnavailableException;

/**
 * Streaming microphone capture.
 *
 * Contract:
 * - One active capture at a time
 * - Frames are 16 kHz, 16-bit, mono, little-endian, base64-encoded
 * - All frames are delivered before {@link #stop()} returns
 */
public interface AudioStreamer {

    /**
     * Opens the input device and starts delivering frames to {@code listener}.
     *
     * @throws DeviceUnavailableException if no usable input line could be opened
     * @throws IllegalStateException      if a capture is already running
     */
    void start(FrameListener listener);

    /** Stops capture and releases the device. Idempotent, safe after a failed start. */
    void stop();

    boolean isRunning();
}
