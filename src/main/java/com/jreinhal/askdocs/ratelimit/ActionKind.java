package com.jreinhal.askdocs.ratelimit;

import java.util.Locale;

/**
 * Rate limited action kinds. Each kind has its own limit and bucket.
 */
public enum ActionKind {
    QUERY,
    UPLOAD;

    public String tag() {
        return this.name().toLowerCase(Locale.ROOT);
    }
}
