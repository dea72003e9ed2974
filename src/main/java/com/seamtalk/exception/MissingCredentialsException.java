package com.seamtalk.exception;

/**
 * Thrown when a provider call is requested but its API key is not configured.
 * The REST boundary maps it to HTTP 500; it is a deployment error, not a client one.
 */
public class MissingCredentialsException extends SeamTalkException {

    private final String variable;

    public MissingCredentialsException(String variable) {
        super("Missing env " + variable);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
