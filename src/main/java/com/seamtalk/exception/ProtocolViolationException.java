package com.seamtalk.exception;

/**
 * Thrown when a wire message is malformed or arrives out of order
 * (e.g., audio before {@code session.update}).
 *
 * <p>The message is client-safe: the relay sends it back verbatim inside an {@code error} event.
 */
public class ProtocolViolationException extends SeamTalkException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
