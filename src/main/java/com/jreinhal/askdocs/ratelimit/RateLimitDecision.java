package com.jreinhal.askdocs.ratelimit;

import java.time.Duration;

public record RateLimitDecision(boolean allowed, ActionKind kind, int limit, long remaining, Duration retryAfter) {

    public static RateLimitDecision allowed(ActionKind kind, int limit, long remaining) {
        return new RateLimitDecision(true, kind, limit, remaining, Duration.ZERO);
    }

    public static RateLimitDecision denied(ActionKind kind, int limit, Duration retryAfter) {
        return new RateLimitDecision(false, kind, limit, 0L, retryAfter);
    }

    /**
     * Whole seconds for the {@code Retry-After} header, rounded up and never below one.
     */
    public long retryAfterSeconds() {
        long millis = this.retryAfter == null ? 0L : this.retryAfter.toMillis();
        return Math.max(1L, (millis + 999L) / 1000L);
    }
}
