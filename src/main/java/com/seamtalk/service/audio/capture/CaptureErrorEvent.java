package com.seamtalk.service.audio.capture;

import java.time.Instant;

/**
 * Published when microphone capture fails while running (device removed, driver error).
 * Failures to open the device are reported to the caller of {@link AudioStreamer#start} instead.
 *
 * @param reason     short machine-readable reason, e.g. {@code CAPTURE_ERROR}
 * @param deviceName configured device, or "default"
 * @param at         when the failure happened
 */
public record CaptureErrorEvent(String reason, String deviceName, Instant at) {

    public static final String CAPTURE_ERROR = "CAPTURE_ERROR";
}
