package com.seamtalk.exception;

/**
 * Thrown when an established or in-progress socket connection fails at the transport level.
 * Never retried; the connection that produced it ends.
 */
public class UpstreamTransportException extends SeamTalkException {

    public UpstreamTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
