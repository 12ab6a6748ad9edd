package com.phillippitts.greekeval.util;

/** Utility for privacy-safe, single-line previews of transcript text in logs. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Collapses line breaks and whitespace runs to single spaces, then cuts the result to at
     * most {@code max} characters, appending "..." when text was dropped. Returns "" for null
     * or non-positive {@code max}.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.strip().replaceAll("\\s+", " ");
        if (flat.length() <= max) {
            return flat;
        }
        int cut = max;
        // do not split a surrogate pair
        if (Character.isHighSurrogate(flat.charAt(cut - 1))) {
            cut--;
        }
        return flat.substring(0, cut) + ELLIPSIS;
    }
}
