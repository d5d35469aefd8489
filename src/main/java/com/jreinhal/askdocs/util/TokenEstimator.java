package com.jreinhal.askdocs.util;

/**
 * Whitespace token estimate shared by chunking, context budgeting and usage accounting.
 * Backend-reported counts take precedence where a backend reports them.
 */
public final class TokenEstimator {

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
