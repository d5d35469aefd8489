package com.jreinhal.askdocs.ratelimit;

import java.time.Duration;

/**
 * Backing store for fixed window buckets. Implementations must check and increment in a single
 * atomic step per key, and must not count a request they reject.
 */
public interface RateLimitStore {

    WindowState tryAcquire(String key, int limit, Duration window);

    String name();
}
