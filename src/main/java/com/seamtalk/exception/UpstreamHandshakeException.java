package com.seamtalk.exception;

/**
 * Thrown when the WebSocket upgrade towards a remote endpoint is answered with a
 * non-101 HTTP response. Carries the status code and whatever body the server returned.
 */
public class UpstreamHandshakeException extends SeamTalkException {

    private final int statusCode;
    private final String body;

    public UpstreamHandshakeException(int statusCode, String body, Throwable cause) {
        super("Upstream handshake failed: " + statusCode, cause);
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }
}
