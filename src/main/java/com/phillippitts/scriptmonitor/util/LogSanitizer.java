package com.phillippitts.scriptmonitor.util;

/** Utility for privacy-safe logging of transcript and script previews. */
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
     * Single-line preview: line breaks become spaces, and a truncated value is suffixed with its
     * full length, e.g. {@code "오늘 날씨가…(42 chars)"}.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        if (flat.length() <= max) {
            return flat;
        }
        return truncate(flat, max) + "…(" + flat.length() + " chars)";
    }
}
