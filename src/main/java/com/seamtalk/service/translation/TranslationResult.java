package com.seamtalk.service.translation;

import java.util.Map;

/**
 * Outcome of one provider translation call.
 *
 * @param translation translated text, "" when the provider returned no content
 * @param raw         provider response as parsed JSON
 * @param ttfbMs      time until response headers arrived
 * @param totalMs     time until the body was parsed
 */
public record TranslationResult(String translation, Map<String, Object> raw, long ttfbMs, long totalMs) {
}
