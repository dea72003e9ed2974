package com.seamtalk.util;

/** Utility for privacy-safe logging of transcript and payload previews. */
public final class LogSanitizer {

    /** Default preview length for transcripts in INFO logs. */
    public static final int DEFAULT_PREVIEW = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: line breaks flattened, truncated to {@link #DEFAULT_PREVIEW}
     * characters with an ellipsis marker and the original length when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        if (flat.length() <= DEFAULT_PREVIEW) {
            return flat;
        }
        return truncate(flat, DEFAULT_PREVIEW) + "...(" + flat.length() + " chars)";
    }
}
