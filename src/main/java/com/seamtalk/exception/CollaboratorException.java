package com.seamtalk.exception;

/**
 * Base class for failures of the request/response collaborators (translation, speech synthesis).
 *
 * <p>These failures are scoped to a single turn: the conversation carries on and the turn
 * keeps a visible failure marker instead of the collaborator output.
 */
public abstract class CollaboratorException extends SeamTalkException {

    /** Status value used when the failure happened before any HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final String reason;
    private final String provider;
    private final int httpStatus;
    private final String responseBody;

    protected CollaboratorException(String reason, String detailedMessage, String provider, int httpStatus,
                                    String responseBody, Throwable cause) {
        super(detailedMessage + " (provider: " + provider + ")", cause);
        this.reason = reason;
        this.provider = provider;
        this.httpStatus = httpStatus;
        this.responseBody = responseBody;
    }

    /** @return short, client-safe description such as {@code "Doubao error: 401"} */
    public String getReason() {
        return reason;
    }

    public String getProvider() {
        return provider;
    }

    /** @return HTTP status returned by the provider, or {@link #NO_STATUS} */
    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean hasHttpStatus() {
        return httpStatus != NO_STATUS;
    }

    /** @return provider response body, or {@code null} when none was received */
    public String getResponseBody() {
        return responseBody;
    }
}
