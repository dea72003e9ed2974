package com.seamtalk.service.session;

/**
 * States of the hold-to-talk session state machine.
 *
 * <pre>
 * IDLE --press--> CONNECTING --open--> RECORDING --release--> FINALIZING --final|timeout--> IDLE
 * </pre>
 * Errors, disconnects and connect failures from any non-idle state lead back to {@link #IDLE}.
 */
public enum SessionState {
    /** No turn in progress; the next press starts one. */
    IDLE,
    /** Relay socket opening; audio not flowing yet. */
    CONNECTING,
    /** Audio streaming while the talk key is held. */
    RECORDING,
    /** Audio committed; waiting for the final transcript or the finalize timeout. */
    FINALIZING
}
