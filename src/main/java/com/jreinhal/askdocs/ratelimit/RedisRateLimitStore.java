package com.jreinhal.askdocs.ratelimit;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Shared buckets in Redis so limits hold across processes. The check, increment and expiry run
 * as one Lua script. While Redis is unreachable requests are judged by the in-process fallback.
 */
public class RedisRateLimitStore implements RateLimitStore {
    private static final Logger log = LoggerFactory.getLogger(RedisRateLimitStore.class);
    static final String KEY_PREFIX = "ratelimit:";
    // returns {count, ttlMillis, admitted}
    private static final String SCRIPT = """
            local current = tonumber(redis.call('GET', KEYS[1]) or '0')
            local limit = tonumber(ARGV[1])
            local window = tonumber(ARGV[2])
            if current >= limit then
              local ttl = redis.call('PTTL', KEYS[1])
              if ttl < 0 then
                redis.call('PEXPIRE', KEYS[1], window)
                ttl = window
              end
              return {current, ttl, 0}
            end
            current = redis.call('INCR', KEYS[1])
            local ttl = redis.call('PTTL', KEYS[1])
            if ttl < 0 then
              redis.call('PEXPIRE', KEYS[1], window)
              ttl = window
            end
            return {current, ttl, 1}
            """;
    static final RedisScript<List<Long>> ACQUIRE_SCRIPT = acquireScript();

    private final StringRedisTemplate redisTemplate;
    private final RateLimitStore fallback;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public RedisRateLimitStore(StringRedisTemplate redisTemplate, RateLimitStore fallback) {
        this.redisTemplate = redisTemplate;
        this.fallback = fallback;
    }

    @Override
    public WindowState tryAcquire(String key, int limit, Duration window) {
        try {
            List<Long> result = this.redisTemplate.execute(ACQUIRE_SCRIPT, List.of(KEY_PREFIX + key),
                    String.valueOf(limit), String.valueOf(window.toMillis()));
            if (result == null || result.size() < 3) {
                throw new IllegalStateException("Unexpected rate limit script result: " + result);
            }
            if (this.degraded.compareAndSet(true, false)) {
                log.info("Redis rate limit store reachable again, leaving per-process fallback");
            }
            long count = toLong(result.get(0));
            long ttlMillis = Math.max(0L, toLong(result.get(1)));
            boolean admitted = toLong(result.get(2)) == 1L;
            return new WindowState(admitted, count, admitted ? Duration.ZERO : Duration.ofMillis(ttlMillis));
        } catch (DataAccessException | IllegalStateException e) {
            if (this.degraded.compareAndSet(false, true)) {
                log.warn("Redis rate limit store unavailable, limits are now per-process: {}", e.getMessage());
            }
            return this.fallback.tryAcquire(key, limit, window);
        }
    }

    @Override
    public String name() {
        return this.degraded.get() ? "redis(fallback:" + this.fallback.name() + ")" : "redis";
    }

    @SuppressWarnings("unchecked")
    private static RedisScript<List<Long>> acquireScript() {
        DefaultRedisScript<List<Long>> script = new DefaultRedisScript<>();
        script.setScriptText(SCRIPT);
        // Lua integer replies arrive as Long
        script.setResultType((Class<List<Long>>)(Class<?>)List.class);
        return script;
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
