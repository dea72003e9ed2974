package com.seamtalk.service.hotkey;

/**
 * Matches press and release of one key, ignoring key-repeat while held.
 * Not thread-safe; fed from the hook's single dispatch thread.
 */
public final class SingleKeyTrigger {

    private final String key;
    private boolean held;

    public SingleKeyTrigger(String key) {
        this.key = KeyNameMapper.normalizeKey(key);
    }

    public String key() {
        return key;
    }

    /** @return true on the first press of the key; repeats while held return false */
    public boolean onKeyPressed(NormalizedKeyEvent e) {
        if (held || !e.key().equals(key)) {
            return false;
        }
        held = true;
        return true;
    }

    /** @return true when the held key is released */
    public boolean onKeyReleased(NormalizedKeyEvent e) {
        if (held && e.key().equals(key)) {
            held = false;
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "single-key:" + key;
    }
}
