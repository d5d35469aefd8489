package com.jreinhal.askdocs.config;

import com.jreinhal.askdocs.ratelimit.InMemoryRateLimitStore;
import com.jreinhal.askdocs.ratelimit.RateLimitStore;
import com.jreinhal.askdocs.ratelimit.RedisRateLimitStore;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RateLimitConfig {
    private static final Logger log = LoggerFactory.getLogger(RateLimitConfig.class);
    @Value("${app.rate-limit.store:memory}")
    private String storeType;
    @Value("${app.rate-limit.window-seconds:3600}")
    private long windowSeconds;

    @Bean
    public RateLimitStore rateLimitStore(ObjectProvider<StringRedisTemplate> redisTemplate) {
        InMemoryRateLimitStore memoryStore = new InMemoryRateLimitStore(Duration.ofSeconds(this.windowSeconds));
        if (!"redis".equalsIgnoreCase(this.storeType)) {
            return memoryStore;
        }
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template == null) {
            log.warn("app.rate-limit.store=redis but no Redis connection is configured; using in-memory buckets");
            return memoryStore;
        }
        return new RedisRateLimitStore(template, memoryStore);
    }
}
