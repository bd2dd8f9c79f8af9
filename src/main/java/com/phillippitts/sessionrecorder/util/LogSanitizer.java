package com.phillippitts.sessionrecorder.util;

/** Utility for privacy-safe logging of text previews and recording paths. */
public final class LogSanitizer {
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
     * Returns the last path segment of a recording path so that logs and user-facing messages
     * do not expose the full directory layout. Returns {@code null} for null or blank input.
     */
    public static String fileName(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        return name.isBlank() ? null : name;
    }
}
