package com.seamtalk.service.hotkey;

import java.util.function.Consumer;

/**
 * Abstraction over a global keyboard hook (e.g., JNativeHook).
 *
 * Test seam: unit tests inject a fake and emit {@link NormalizedKeyEvent}s without OS hooks.
 */
public interface GlobalKeyHook {

    /**
     * Register the global hook. Idempotent.
     *
     * @throws SecurityException if the OS refuses the hook (missing accessibility permission)
     */
    void register();

    /** Unregister the global hook. Idempotent. */
    void unregister();

    /** Sets the single consumer of normalized key events; called on the hook's dispatch thread. */
    void setListener(Consumer<NormalizedKeyEvent> listener);
}
