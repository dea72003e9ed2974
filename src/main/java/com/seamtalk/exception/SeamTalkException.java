package com.seamtalk.exception;

/**
 * Base exception for all SeamTalk application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SeamTalkException extends RuntimeException {

    public SeamTalkException(String message) {
        super(message);
    }

    public SeamTalkException(String message, Throwable cause) {
        super(message, cause);
    }

    public SeamTalkException(Throwable cause) {
        super(cause);
    }
}
