package com.seamtalk.util;

import java.time.Duration;

/**
 * Standard timeout values for thread and connection lifecycle management.
 *
 * <p>Protocol-level timeouts (finalize guard, upstream connect, collaborator calls) are
 * configurable properties; the values here cover internal cleanup only.
 *
 * @see com.seamtalk.service.audio.capture.JavaSoundAudioStreamer
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for the audio capture thread to terminate during a normal stop.
     *
     * <p>A blocked {@code TargetDataLine.read} returns once the line is stopped; 1000ms leaves
     * room for the last window to be encoded and handed off.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the capture thread during application shutdown (best-effort, daemon thread).
     */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Grace period for a closing handshake before a socket is aborted.
     */
    public static final Duration SOCKET_CLOSE_GRACE = Duration.ofMillis(500);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
