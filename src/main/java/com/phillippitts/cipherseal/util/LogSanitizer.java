package com.phillippitts.cipherseal.util;

/** Utility for privacy-safe logging of watermark text previews. */
public final class LogSanitizer {

    /** Default preview length for watermark payloads in log lines. */
    public static final int DEFAULT_PREVIEW_CHARS = 50;

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
     * Preview of at most {@link #DEFAULT_PREVIEW_CHARS} characters, with "..." appended when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= DEFAULT_PREVIEW_CHARS ? s : truncate(s, DEFAULT_PREVIEW_CHARS) + "...";
    }

    /**
     * Strips CR/LF so user-supplied values such as file names cannot forge log lines.
     */
    public static String singleLine(String s) {
        if (s == null) {
            return "";
        }
        return s.replace('\r', '_').replace('\n', '_');
    }
}
