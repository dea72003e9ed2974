package com.seamtalk.service.hotkey;

import com.seamtalk.config.hotkey.TalkKeyProperties;
import com.seamtalk.domain.Side;
import com.seamtalk.service.hotkey.event.TalkKeyPermissionDeniedEvent;
import com.seamtalk.service.hotkey.event.TalkKeyPressedEvent;
import com.seamtalk.service.hotkey.event.TalkKeyReleasedEvent;
import com.seamtalk.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class TalkKeyManagerTest {

    @Test
    void publishesPressAndReleaseWithSide() {
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        FakeHook hook = new FakeHook();
        TalkKeyManager mgr = new TalkKeyManager(hook, new TalkKeyProperties("LEFT_ALT", "RIGHT_ALT", null), publisher);

        mgr.start();
        hook.emit(NormalizedKeyEvent.pressed("RIGHT_ALT"));
        hook.emit(NormalizedKeyEvent.pressed("RIGHT_ALT"));
        hook.emit(NormalizedKeyEvent.released("RIGHT_ALT"));
        mgr.stop();

        assertThat(publisher.eventsOfType(TalkKeyPressedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.requestedSide()).contains(Side.B));
        assertThat(publisher.eventsOfType(TalkKeyReleasedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.side()).isEqualTo(Side.B));
        assertThat(hook.registered.get()).isFalse();
    }

    @Test
    void autoKeyHasNoSide() {
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        FakeHook hook = new FakeHook();
        TalkKeyManager mgr = new TalkKeyManager(hook, new TalkKeyProperties(null, null, "F13"), publisher);

        mgr.start();
        hook.emit(NormalizedKeyEvent.pressed("F13"));

        assertThat(publisher.eventsOfType(TalkKeyPressedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.requestedSide()).isEmpty());
    }

    @Test
    void unboundKeysPublishNothing() {
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        FakeHook hook = new FakeHook();
        TalkKeyManager mgr = new TalkKeyManager(hook, new TalkKeyProperties(null, null, null), publisher);

        mgr.start();
        hook.emit(NormalizedKeyEvent.pressed("SPACE"));
        hook.emit(NormalizedKeyEvent.released("SPACE"));

        assertThat(publisher.eventsOfType(Object.class)).isEmpty();
    }

    @Test
    void permissionDeniedIsPublished() {
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        FakeHook hook = new FakeHook();
        hook.deny = true;
        TalkKeyManager mgr = new TalkKeyManager(hook, new TalkKeyProperties(null, null, null), publisher);

        mgr.start();

        assertThat(mgr.isRunning()).isFalse();
        assertThat(publisher.eventsOfType(TalkKeyPermissionDeniedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.detail()).contains("accessibility"));
    }

    // Simple fake hook for tests
    static class FakeHook implements GlobalKeyHook {
        final AtomicBoolean registered = new AtomicBoolean();
        boolean deny;
        private volatile Consumer<NormalizedKeyEvent> listener;

        @Override public void register() {
            if (deny) {
                throw new SecurityException("accessibility permission missing");
            }
            registered.set(true);
        }
        @Override public void unregister() { registered.set(false); }
        @Override public void setListener(Consumer<NormalizedKeyEvent> listener) { this.listener = listener; }
        void emit(NormalizedKeyEvent e) { Consumer<NormalizedKeyEvent> l = listener; if (l != null) l.accept(e); }
    }
}
