package com.phillippitts.sessioncore.util;

import java.util.Locale;
import java.util.UUID;

/** Utility for compact, privacy-safe log values. */
public final class LogSanitizer {
    private LogSanitizer() {}

    private static final int SHORT_ID_LENGTH = 8;

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
     * First eight characters of the lowercase UUID; "nil" for null.
     */
    public static String shortId(UUID id) {
        if (id == null) {
            return "nil";
        }
        return truncate(id.toString().toLowerCase(Locale.ROOT), SHORT_ID_LENGTH);
    }
}
