package com.phillippitts.livescribe.util;

/** Utility for privacy-safe logging of transcript text and client input. */
public final class LogSanitizer {

    /** Characters of transcript text shown in log previews. */
    public static final int PREVIEW_LENGTH = 40;

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
     * Short single-line preview for debug logs: control characters replaced, cut at
     * {@link #PREVIEW_LENGTH} with a trailing ellipsis and the full length.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\p{Cntrl}", " ");
        if (flat.length() <= PREVIEW_LENGTH) {
            return flat;
        }
        return flat.substring(0, PREVIEW_LENGTH) + "...(" + flat.length() + " chars)";
    }
}
