package com.seamtalk.exception;

/**
 * Thrown when a REST request lacks required fields. Mapped to HTTP 400.
 */
public class InvalidRequestException extends SeamTalkException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
