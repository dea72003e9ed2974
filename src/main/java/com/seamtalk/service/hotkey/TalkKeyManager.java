package com.seamtalk.service.hotkey;

import com.seamtalk.config.hotkey.TalkKeyProperties;
import com.seamtalk.domain.Side;
import com.seamtalk.service.hotkey.event.TalkKeyPermissionDeniedEvent;
import com.seamtalk.service.hotkey.event.TalkKeyPressedEvent;
import com.seamtalk.service.hotkey.event.TalkKeyReleasedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Registers the global key hook and turns configured talk keys into
 * {@link TalkKeyPressedEvent}/{@link TalkKeyReleasedEvent}.
 *
 * <p>One {@link SingleKeyTrigger} per binding: side A, side B and the optional auto-detect key.
 * Tests inject a fake {@link GlobalKeyHook} and emit {@link NormalizedKeyEvent}s directly.
 */
@Service
@ConditionalOnProperty(prefix = "client", name = "enabled", havingValue = "true")
public class TalkKeyManager implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(TalkKeyManager.class);

    private final GlobalKeyHook hook;
    private final ApplicationEventPublisher publisher;
    private final List<Binding> bindings;

    private volatile boolean running;

    public TalkKeyManager(GlobalKeyHook hook, TalkKeyProperties props, ApplicationEventPublisher publisher) {
        this.hook = hook;
        this.publisher = publisher;
        List<Binding> list = new ArrayList<>();
        list.add(new Binding(Side.A, new SingleKeyTrigger(props.getSideAKey())));
        list.add(new Binding(Side.B, new SingleKeyTrigger(props.getSideBKey())));
        if (props.getAutoKey() != null) {
            list.add(new Binding(null, new SingleKeyTrigger(props.getAutoKey())));
        }
        this.bindings = List.copyOf(list);
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        try {
            hook.setListener(dispatcher());
            hook.register();
            running = true;
            LOG.info("TalkKeyManager started with bindings {}", bindings);
        } catch (SecurityException se) {
            LOG.warn("Global key hook permission denied: {}", se.toString());
            publisher.publishEvent(new TalkKeyPermissionDeniedEvent(se.getMessage(), Instant.now()));
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        hook.unregister();
        running = false;
        LOG.info("TalkKeyManager stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private Consumer<NormalizedKeyEvent> dispatcher() {
        return e -> {
            for (Binding b : bindings) {
                boolean matched = switch (e.type()) {
                    case PRESSED -> b.trigger().onKeyPressed(e);
                    case RELEASED -> b.trigger().onKeyReleased(e);
                };
                if (!matched) {
                    continue;
                }
                Instant at = Instant.ofEpochMilli(e.whenMillis());
                if (e.type() == NormalizedKeyEvent.Type.PRESSED) {
                    publisher.publishEvent(new TalkKeyPressedEvent(b.side(), at));
                } else {
                    publisher.publishEvent(new TalkKeyReleasedEvent(b.side(), at));
                }
            }
        };
    }

    /** @param side bound side, {@code null} for the auto-detect key */
    private record Binding(Side side, SingleKeyTrigger trigger) {
        @Override
        public String toString() {
            return (side == null ? "auto" : side.name()) + "=" + trigger.key();
        }
    }
}
