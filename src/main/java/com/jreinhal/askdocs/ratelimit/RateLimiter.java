package com.jreinhal.askdocs.ratelimit;

import com.jreinhal.askdocs.metrics.PipelineMetrics;
import com.jreinhal.askdocs.security.ClientIdentity;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Fixed window admission per (identity, action kind). A request is denied when the window's
 * count has already reached the kind's limit; denied requests are not counted.
 */
@Service
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    private final RateLimitStore store;
    private final PipelineMetrics metrics;
    @Value("${app.rate-limit.query-limit:10}")
    private int queryLimit = 10;
    @Value("${app.rate-limit.upload-limit:1}")
    private int uploadLimit = 1;
    @Value("${app.rate-limit.window-seconds:3600}")
    private long windowSeconds = 3600L;

    public RateLimiter(RateLimitStore store, PipelineMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    @PostConstruct
    public void init() {
        log.info("Rate limiter: store={}, queries={}/{}s, uploads={}/{}s",
                this.store.name(), this.queryLimit, this.windowSeconds, this.uploadLimit, this.windowSeconds);
    }

    public RateLimitDecision admit(ClientIdentity identity, ActionKind kind) {
        int limit = this.limitFor(kind);
        Duration window = Duration.ofSeconds(this.windowSeconds);
        WindowState state = this.store.tryAcquire(kind.tag() + ":" + identity.key(), limit, window);
        this.metrics.recordRateLimitDecision(kind.tag(), state.admitted());
        if (state.admitted()) {
            return RateLimitDecision.allowed(kind, limit, Math.max(0L, limit - state.count()));
        }
        log.warn("Rate limit exceeded for {} identity ({}), kind={}, retry in {}s",
                identity.source(), Integer.toHexString(identity.value().hashCode()), kind.tag(), state.resetIn().toSeconds());
        return RateLimitDecision.denied(kind, limit, state.resetIn());
    }

    public int limitFor(ActionKind kind) {
        return switch (kind) {
            case QUERY -> this.queryLimit;
            case UPLOAD -> this.uploadLimit;
        };
    }
}
