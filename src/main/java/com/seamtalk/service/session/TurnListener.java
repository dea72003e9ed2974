package com.seamtalk.service.session;

import com.seamtalk.domain.TurnSnapshot;

/**
 * Observes a {@link TalkSession}. Called on the session thread; implementations must return
 * quickly.
 */
public interface TurnListener {

    default void onStateChanged(SessionState from, SessionState to) {
    }

    /** A turn was created or changed (partial, final, abandoned, translated). */
    default void onTurnUpdated(TurnSnapshot turn) {
    }
}
