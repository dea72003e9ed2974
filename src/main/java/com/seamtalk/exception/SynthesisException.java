package com.seamtalk.exception;

/**
 * Thrown when speech synthesis fails. Synthesis is best-effort, so callers on the client
 * side only log it.
 *
 * @see CollaboratorExceptionBuilder#synthesis(String)
 */
public class SynthesisException extends CollaboratorException {

    public SynthesisException(String reason, String detailedMessage, String provider, int httpStatus,
                              String responseBody, Throwable cause) {
        super(reason, detailedMessage, provider, httpStatus, responseBody, cause);
    }
}
