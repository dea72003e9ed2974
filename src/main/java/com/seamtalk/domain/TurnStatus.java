package com.seamtalk.domain;

/**
 * Lifecycle of a {@link Turn}.
 */
public enum TurnStatus {
    /** Recording or waiting for the final transcript. */
    OPEN,
    /** Final transcript received. */
    COMPLETED,
    /** Ended by timeout, error or disconnect without a transcript. */
    ABANDONED
}
