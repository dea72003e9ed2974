package com.seamtalk.exception;

/**
 * Thrown when a text translation cannot be obtained: non-2xx response, malformed body,
 * timeout or missing credentials.
 *
 * @see CollaboratorExceptionBuilder#translation(String)
 */
public class TranslationException extends CollaboratorException {

    public TranslationException(String reason, String detailedMessage, String provider, int httpStatus,
                                String responseBody, Throwable cause) {
        super(reason, detailedMessage, provider, httpStatus, responseBody, cause);
    }
}
