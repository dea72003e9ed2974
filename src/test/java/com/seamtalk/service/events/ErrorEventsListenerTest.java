package com.seamtalk.service.events;

import com.seamtalk.service.audio.capture.CaptureErrorEvent;
import com.seamtalk.service.hotkey.event.TalkKeyPermissionDeniedEvent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();
        // shouldLog allows first occurrence
        assertThat(l.shouldLog("talk-key-permission")).isTrue();
        // but rejects immediately repeated
        assertThat(l.shouldLog("talk-key-permission")).isFalse();
        // other keys are throttled independently
        assertThat(l.shouldLog("capture-CAPTURE_ERROR-default")).isTrue();
    }

    @Test
    void logsAgainAfterThrottleWindow() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        ErrorEventsListener l = new ErrorEventsListener(clock);
        assertThat(l.shouldLog("k")).isTrue();

        clock.advance(ErrorEventsListener.THROTTLE);
        assertThat(l.shouldLog("k")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(l.shouldLog("k")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThatCode(() -> {
            l.onTalkKeyPermissionDenied(new TalkKeyPermissionDeniedEvent("not trusted", Instant.now()));
            l.onCaptureError(new CaptureErrorEvent(CaptureErrorEvent.CAPTURE_ERROR, "default", Instant.now()));
        }).doesNotThrowAnyException();
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
