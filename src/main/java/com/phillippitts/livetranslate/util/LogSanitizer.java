package com.phillippitts.livetranslate.util;

/** Utility for privacy-safe logging of transcript and translation previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview for log statements: line breaks collapsed to spaces,
     * truncated to max characters with a trailing ellipsis when cut.
     */
    public static String preview(String s, int max) {
        String flat = s == null ? "" : s.replaceAll("[\\r\\n]+", " ");
        String cut = truncate(flat, max);
        return cut.length() < flat.length() ? cut + "..." : cut;
    }
}
