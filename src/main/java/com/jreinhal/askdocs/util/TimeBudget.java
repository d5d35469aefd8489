package com.jreinhal.askdocs.util;

import java.time.Duration;

/**
 * Overall request deadline. Stage timeouts are clipped to whatever is left of it.
 */
public final class TimeBudget {
    private final long deadlineNanos;
    private final boolean bounded;

    private TimeBudget(long deadlineNanos, boolean bounded) {
        this.deadlineNanos = deadlineNanos;
        this.bounded = bounded;
    }

    public static TimeBudget of(Duration total) {
        return new TimeBudget(System.nanoTime() + total.toNanos(), true);
    }

    public static TimeBudget unbounded() {
        return new TimeBudget(0L, false);
    }

    public Duration remaining() {
        if (!this.bounded) {
            return Duration.ofDays(1L);
        }
        return Duration.ofNanos(Math.max(0L, this.deadlineNanos - System.nanoTime()));
    }

    public boolean isExhausted() {
        return this.bounded && this.deadlineNanos - System.nanoTime() <= 0L;
    }

    /**
     * @return {@code stageTimeout}, or the remaining budget when that is shorter
     */
    public Duration bound(Duration stageTimeout) {
        Duration remaining = this.remaining();
        return remaining.compareTo(stageTimeout) < 0 ? remaining : stageTimeout;
    }
}
