package com.phillippitts.leaderkey.util;

import java.nio.file.Path;

/**
 * Keeps log lines short and free of personal details. Action values can hold URLs with
 * tokens or long shell commands, and config paths usually start with the user's home.
 */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /** First {@code max} characters of {@code s}; "" for null or a non-positive limit. */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /** Like {@link #truncate} but marks a cut value with a trailing ellipsis. */
    public static String preview(String s, int max) {
        String cut = truncate(s, max);
        return cut.length() < lengthOf(s) && max > 0 ? cut + ELLIPSIS : cut;
    }

    /** Renders {@code path} with the user's home directory replaced by "~". */
    public static String displayPath(Path path) {
        return displayPath(path, System.getProperty("user.home"));
    }

    static String displayPath(Path path, String home) {
        if (path == null) {
            return "";
        }
        String text = path.toString();
        if (home == null || home.isBlank()) {
            return text;
        }
        Path homePath = Path.of(home);
        return path.startsWith(homePath) ? "~" + text.substring(homePath.toString().length()) : text;
    }

    private static int lengthOf(String s) {
        return s == null ? 0 : s.length();
    }
}
