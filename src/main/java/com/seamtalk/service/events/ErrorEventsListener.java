package com.seamtalk.service.events;

import com.seamtalk.service.audio.capture.CaptureErrorEvent;
import com.seamtalk.service.hotkey.event.TalkKeyPermissionDeniedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener() {
        this(Clock.systemUTC());
    }

    // Package-private for tests
    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onTalkKeyPermissionDenied(TalkKeyPermissionDeniedEvent e) {
        if (shouldLog("talk-key-permission")) {
            LOG.warn("Global key hook denied ({}). On macOS grant Accessibility: "
                    + "System Settings → Privacy & Security → Accessibility (then restart app)", e.detail());
        }
    }

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason() + '-' + e.deviceName();
        if (shouldLog(key)) {
            LOG.warn("Capture error: reason={}, device={}. Check microphone device & permissions.",
                    e.reason(), e.deviceName());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
