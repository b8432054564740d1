package com.yijian.common.util;

import java.util.regex.Pattern;

public final class TextUtils {

    public static final String ELLIPSIS = "...";

    private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t\\x0B\\f]+(?=\\n|$)");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private TextUtils() {}

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    /**
     * Cuts {@code text} to at most {@code maxCodePoints} code points, appending {@link #ELLIPSIS}
     * when something was removed. Surrogate pairs are never split.
     */
    public static String truncateCodePoints(String text, int maxCodePoints) {
        if (text == null) {
            return null;
        }
        if (maxCodePoints < 0) {
            throw new IllegalArgumentException("maxCodePoints must be >= 0");
        }
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        int end = text.offsetByCodePoints(0, maxCodePoints);
        return text.substring(0, end) + ELLIPSIS;
    }

    /**
     * Line endings to LF, no trailing spaces, at most one blank line in a row, trimmed.
     */
    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return "";
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        normalized = TRAILING_SPACES.matcher(normalized).replaceAll("");
        normalized = EXCESS_BLANK_LINES.matcher(normalized).replaceAll("\n\n");
        return normalized.strip();
    }

    /**
     * Short, single-line preview for log messages.
     */
    public static String preview(String text, int maxCodePoints) {
        if (text == null) {
            return "null";
        }
        return truncateCodePoints(text.replaceAll("\\s+", " ").strip(), maxCodePoints);
    }
}
