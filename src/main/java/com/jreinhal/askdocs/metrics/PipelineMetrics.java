package com.jreinhal.askdocs.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Counters, timers and distributions for the query pipeline, exported through the actuator
 * Prometheus endpoint. Tags are kept low-cardinality (endpoint, stage, kind, outcome).
 */
@Component
public class PipelineMetrics {
    public static final String REQUESTS = "askdocs.requests";
    public static final String ERRORS = "askdocs.errors";
    public static final String DEGRADED = "askdocs.degraded";
    public static final String STAGE_LATENCY = "askdocs.stage.latency";
    public static final String TOKENS = "askdocs.tokens";
    public static final String RATE_LIMIT_DECISIONS = "askdocs.ratelimit.decisions";
    public static final String QUERY_LENGTH = "askdocs.query.length";
    public static final String CONTEXT_TOKENS = "askdocs.context.tokens";
    public static final String CANDIDATES = "askdocs.candidates";

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> summaries = new ConcurrentHashMap<>();

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRequest(String endpoint) {
        this.counter(REQUESTS, "endpoint", endpoint).increment();
    }

    public void recordError(String stage) {
        this.counter(ERRORS, "stage", stage).increment();
    }

    public void recordDegraded(String stage) {
        this.counter(DEGRADED, "stage", stage).increment();
    }

    public void recordStageLatency(String stage, Duration duration) {
        String tag = safeTag(stage);
        this.timers.computeIfAbsent(tag, k -> Timer.builder(STAGE_LATENCY)
                .description("Pipeline stage latency")
                .tag("stage", k)
                .publishPercentileHistogram()
                .register(this.registry)).record(duration);
    }

    public void recordTokens(String type, long count) {
        if (count > 0L) {
            this.counter(TOKENS, "type", type).increment((double)count);
        }
    }

    public void recordRateLimitDecision(String kind, boolean allowed) {
        String kindTag = safeTag(kind);
        String outcome = allowed ? "allowed" : "denied";
        this.counters.computeIfAbsent(RATE_LIMIT_DECISIONS + "|" + kindTag + "|" + outcome,
                k -> Counter.builder(RATE_LIMIT_DECISIONS)
                        .description("Rate limit admission decisions")
                        .tag("kind", kindTag)
                        .tag("outcome", outcome)
                        .register(this.registry)).increment();
    }

    public void recordQueryLength(int chars) {
        this.summary(QUERY_LENGTH, "chars", null).record(chars);
    }

    public void recordContextTokens(int tokens) {
        this.summary(CONTEXT_TOKENS, "tokens", null).record(tokens);
    }

    /**
     * @param phase one of {@code retrieved}, {@code reranked}, {@code used}
     */
    public void recordCandidates(String phase, int count) {
        this.summary(CANDIDATES, null, phase).record(count);
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        String value = safeTag(tagValue);
        return this.counters.computeIfAbsent(name + "|" + value,
                k -> Counter.builder(name).tag(tagKey, value).register(this.registry));
    }

    private DistributionSummary summary(String name, String unit, String phase) {
        String key = name + "|" + (phase == null ? "" : phase);
        return this.summaries.computeIfAbsent(key, k -> {
            DistributionSummary.Builder builder = DistributionSummary.builder(name).baseUnit(unit);
            if (phase != null) {
                builder.tag("phase", safeTag(phase));
            }
            return builder.register(this.registry);
        });
    }

    private static String safeTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return "none";
        }
        String s = raw.trim();
        if (s.length() > 64) {
            s = s.substring(0, 64);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
