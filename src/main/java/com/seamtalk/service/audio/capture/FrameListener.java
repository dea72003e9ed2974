package com.seamtalk.service.audio.capture;

/**
 * Receives converted audio frames. Called on the capture thread; implementations must hand off
 * quickly and never block on I/O.
 */
@FunctionalInterface
public interface FrameListener {

    /**
     * @param base64Pcm base64 of 16 kHz mono PCM16LE audio, never empty
     */
    void onFrame(String base64Pcm);
}
