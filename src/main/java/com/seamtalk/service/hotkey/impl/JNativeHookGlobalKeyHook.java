package com.seamtalk.service.hotkey.impl;

import com.github.kwhat.jnativehook.GlobalScreen;
import com.github.kwhat.jnativehook.NativeHookException;
import com.github.kwhat.jnativehook.NativeInputEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyListener;
import com.seamtalk.service.hotkey.GlobalKeyHook;
import com.seamtalk.service.hotkey.KeyNameMapper;
import com.seamtalk.service.hotkey.NormalizedKeyEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Production GlobalKeyHook backed by JNativeHook.
 *
 * <p>Left and right modifier keys are typical talk keys (one per person). JNativeHook on macOS
 * does not report standalone modifier presses, so their state is derived from the modifier
 * mask of every key event and a press/release is synthesized on change.
 */
@Component
@ConditionalOnProperty(prefix = "client", name = "enabled", havingValue = "true")
public class JNativeHookGlobalKeyHook implements GlobalKeyHook, NativeKeyListener {

    private static final Logger LOG = LogManager.getLogger(JNativeHookGlobalKeyHook.class);

    private static final Map<String, Integer> MODIFIER_MASKS = Map.of(
            "LEFT_SHIFT", NativeInputEvent.SHIFT_L_MASK,
            "RIGHT_SHIFT", NativeInputEvent.SHIFT_R_MASK,
            "LEFT_CONTROL", NativeInputEvent.CTRL_L_MASK,
            "RIGHT_CONTROL", NativeInputEvent.CTRL_R_MASK,
            "LEFT_ALT", NativeInputEvent.ALT_L_MASK,
            "RIGHT_ALT", NativeInputEvent.ALT_R_MASK,
            "LEFT_META", NativeInputEvent.META_L_MASK,
            "RIGHT_META", NativeInputEvent.META_R_MASK);

    /** macOS raw key codes of the Command keys. */
    private static final int RAW_RIGHT_META = 0x36;
    private static final int RAW_LEFT_META = 0x37;

    private volatile Consumer<NormalizedKeyEvent> listener;
    private final AtomicBoolean registered = new AtomicBoolean(false);
    private final Map<String, Boolean> modifierStates = new ConcurrentHashMap<>();

    @Override
    public void register() {
        if (registered.get()) {
            return;
        }
        try {
            GlobalScreen.registerNativeHook();
            GlobalScreen.addNativeKeyListener(this);
            registered.set(true);
            LOG.info("Registered JNativeHook global key listener");
        } catch (NativeHookException | UnsatisfiedLinkError e) {
            throw new SecurityException("Failed to register global key hook: " + e.getMessage(), e);
        }
    }

    @Override
    public void unregister() {
        if (!registered.get()) {
            return;
        }
        try {
            GlobalScreen.removeNativeKeyListener(this);
            GlobalScreen.unregisterNativeHook();
        } catch (NativeHookException e) {
            LOG.debug("Error unregistering native hook", e);
        } finally {
            registered.set(false);
            modifierStates.clear();
        }
    }

    @Override
    public void setListener(Consumer<NormalizedKeyEvent> listener) {
        this.listener = listener;
    }

    @Override
    public void nativeKeyPressed(NativeKeyEvent nativeEvent) {
        trackModifiers(nativeEvent);
        emit(nativeEvent, NormalizedKeyEvent.Type.PRESSED);
    }

    @Override
    public void nativeKeyReleased(NativeKeyEvent nativeEvent) {
        trackModifiers(nativeEvent);
        emit(nativeEvent, NormalizedKeyEvent.Type.RELEASED);
    }

    @Override
    public void nativeKeyTyped(NativeKeyEvent nativeEvent) {
        // press/release carry everything a talk key needs
    }

    private void emit(NativeKeyEvent ne, NormalizedKeyEvent.Type type) {
        String key = KeyNameMapper.normalizeKey(NativeKeyEvent.getKeyText(ne.getKeyCode()));
        if ("META".equals(key)) {
            int raw = ne.getRawCode();
            if (raw == RAW_RIGHT_META) {
                key = "RIGHT_META";
            } else if (raw == RAW_LEFT_META) {
                key = "LEFT_META";
            }
        }
        if (MODIFIER_MASKS.containsKey(key)) {
            // Reported through the modifier mask already
            return;
        }
        deliver(new NormalizedKeyEvent(type, key, System.currentTimeMillis()));
    }

    private void trackModifiers(NativeInputEvent ne) {
        int mask = ne.getModifiers();
        for (Map.Entry<String, Integer> entry : MODIFIER_MASKS.entrySet()) {
            boolean down = (mask & entry.getValue()) != 0;
            Boolean previous = modifierStates.put(entry.getKey(), down);
            boolean changed = previous == null ? down : previous != down;
            if (changed) {
                NormalizedKeyEvent.Type type = down ? NormalizedKeyEvent.Type.PRESSED : NormalizedKeyEvent.Type.RELEASED;
                deliver(new NormalizedKeyEvent(type, entry.getKey(), System.currentTimeMillis()));
            }
        }
    }

    private void deliver(NormalizedKeyEvent e) {
        Consumer<NormalizedKeyEvent> l = this.listener;
        if (l == null) {
            return;
        }
        try {
            l.accept(e);
        } catch (RuntimeException ex) {
            LOG.warn("Listener error for {}: {}", e, ex.toString());
        }
    }
}
