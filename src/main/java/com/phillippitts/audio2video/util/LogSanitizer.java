package com.phillippitts.audio2video.util;

/** Utility for bounded, single-line previews of text in logs and status messages. */
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
     * Collapses line breaks to single spaces and truncates, appending "..." when cut.
     */
    public static String singleLine(String s, int max) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\s*\\R\\s*", " ").strip();
        if (flat.length() <= max) {
            return flat;
        }
        return truncate(flat, Math.max(0, max - 3)) + "...";
    }
}
