package com.seamtalk.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for collaborator failures with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw CollaboratorExceptionBuilder.translation("Provider rejected request")
 *         .provider("doubao")
 *         .status(502)
 *         .durationMs(812)
 *         .metadata("detail", LogSanitizer.truncate(body, 200))
 *         .build();
 * </pre>
 */
public final class CollaboratorExceptionBuilder {

    private enum Kind { TRANSLATION, SYNTHESIS }

    private final Kind kind;
    private final String message;
    private String provider;
    private int status = CollaboratorException.NO_STATUS;
    private Throwable cause;
    private Long durationMs;
    private String responseBody;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private CollaboratorExceptionBuilder(Kind kind, String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        this.kind = kind;
        this.message = message;
    }

    public static CollaboratorExceptionBuilder translation(String message) {
        return new CollaboratorExceptionBuilder(Kind.TRANSLATION, message);
    }

    public static CollaboratorExceptionBuilder synthesis(String message) {
        return new CollaboratorExceptionBuilder(Kind.SYNTHESIS, message);
    }

    public CollaboratorExceptionBuilder provider(String provider) {
        this.provider = provider;
        return this;
    }

    public CollaboratorExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public CollaboratorExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /** Provider response body, kept verbatim for the REST error detail. */
    public CollaboratorExceptionBuilder responseBody(String responseBody) {
        this.responseBody = responseBody;
        return this;
    }

    public CollaboratorExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the exception message. Null keys or values are skipped.
     */
    public CollaboratorExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (status={status}, durationMs={ms}, {key}={value}, ...) (provider: {provider})
     * </pre>
     */
    public CollaboratorException build() {
        String detailed = buildDetailedMessage();
        String p = provider != null ? provider : "unknown";
        return switch (kind) {
            case TRANSLATION -> new TranslationException(message, detailed, p, status, responseBody, cause);
            case SYNTHESIS -> new SynthesisException(message, detailed, p, status, responseBody, cause);
        };
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (status != CollaboratorException.NO_STATUS) {
            details.put("status", String.valueOf(status));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
