package com.jreinhal.askdocs.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.TimeMeter;
import java.time.Duration;

/**
 * Process-local buckets. Each key gets a Bucket4j bucket that refills to full capacity once per
 * window, which is a fixed window anchored at the first request. Rejected probes consume nothing.
 */
public class InMemoryRateLimitStore implements RateLimitStore {
    private final Cache<String, Bucket> bucketCache;
    private final TimeMeter timeMeter;

    public InMemoryRateLimitStore(Duration maxWindow) {
        this(maxWindow, TimeMeter.SYSTEM_MILLISECONDS);
    }

    public InMemoryRateLimitStore(Duration maxWindow, TimeMeter timeMeter) {
        this.timeMeter = timeMeter;
        // idle entries outlive their window, so eviction never resets a live window early
        this.bucketCache = Caffeine.newBuilder()
                .maximumSize(10000L)
                .expireAfterAccess(maxWindow.plusMinutes(1L))
                .build();
    }

    @Override
    public WindowState tryAcquire(String key, int limit, Duration window) {
        Bucket bucket = this.bucketCache.get(key + "|" + limit + "|" + window.toMillis(), k -> this.createBucket(limit, window));
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1L);
        long count = limit - probe.getRemainingTokens();
        if (probe.isConsumed()) {
            return new WindowState(true, count, Duration.ZERO);
        }
        return new WindowState(false, count, Duration.ofNanos(probe.getNanosToWaitForRefill()));
    }

    @Override
    public String name() {
        return "memory";
    }

    private Bucket createBucket(int limit, Duration window) {
        Bandwidth bandwidth = Bandwidth.builder().capacity(limit).refillIntervally(limit, window).build();
        return Bucket.builder().addLimit(bandwidth).withCustomTimePrecision(this.timeMeter).build();
    }
}
