package com.jreinhal.askdocs.trace;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates query traces and, once finished, keeps them for lookup and hands them to the
 * exporters. Export failures never affect the query.
 */
@Component
public class QueryTracer {
    private static final Logger log = LoggerFactory.getLogger(QueryTracer.class);
    private final List<TraceExporter> exporters;
    private final Cache<String, TraceSnapshot> traceCache;
    private final boolean enabled;

    public QueryTracer(List<TraceExporter> exporters,
            @Value("${askdocs.tracing.enabled:true}") boolean enabled,
            @Value("${askdocs.tracing.cache-size:1000}") long cacheSize,
            @Value("${askdocs.tracing.cache-ttl-minutes:60}") long cacheTtlMinutes) {
        this.exporters = List.copyOf(exporters);
        this.enabled = enabled;
        this.traceCache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .expireAfterWrite(Duration.ofMinutes(cacheTtlMinutes))
                .build();
    }

    public QueryTrace start(String query, String identity) {
        QueryTrace trace = new QueryTrace(query, identity);
        if (log.isDebugEnabled()) {
            log.debug("Started trace {}", trace.getTraceId());
        }
        return trace;
    }

    public TraceSnapshot flush(QueryTrace trace, TraceStatus status, String error) {
        trace.finish(status, error);
        TraceSnapshot snapshot = trace.snapshot();
        if (!this.enabled) {
            return snapshot;
        }
        this.traceCache.put(snapshot.traceId(), snapshot);
        for (TraceExporter exporter : this.exporters) {
            try {
                exporter.export(snapshot);
            } catch (RuntimeException e) {
                log.warn("Trace exporter {} failed for {}: {}", exporter.getClass().getSimpleName(), snapshot.traceId(), e.getMessage());
            }
        }
        return snapshot;
    }

    public Optional<TraceSnapshot> find(String traceId) {
        return Optional.ofNullable(this.traceCache.getIfPresent(traceId));
    }

    public boolean isEnabled() {
        return this.enabled;
    }
}
