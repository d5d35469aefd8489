package com.jreinhal.askdocs.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    // strips control characters that enable log injection/forging
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private LogSanitizer() {
    }

    /**
     * Length and hash of user text, so queries can be correlated across log lines without
     * writing their content.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        int len = query.length();
        String id = Integer.toHexString(query.hashCode());
        return "[len=" + len + ",id=" + id + "]";
    }

    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
    }

    /**
     * Cuts {@code text} to {@code maxChars}, marking the cut. Used for prompt previews.
     */
    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "\n...[truncated]";
    }
}
