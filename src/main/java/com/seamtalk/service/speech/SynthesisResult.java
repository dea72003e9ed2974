package com.seamtalk.service.speech;

import java.util.Map;

/**
 * Outcome of one provider synthesis call. Either {@code audioUrl} or {@code audioBase64} is set,
 * depending on how the provider delivers audio.
 *
 * @param audioUrl    hosted audio, may be {@code null}
 * @param audioBase64 inline audio, may be {@code null}
 * @param format      {@code mp3} or {@code wav}
 * @param raw         provider response as parsed JSON
 * @param ttfbMs      time until response headers arrived
 * @param totalMs     time until the body was parsed
 */
public record SynthesisResult(String audioUrl, String audioBase64, String format,
                              Map<String, Object> raw, long ttfbMs, long totalMs) {
}
