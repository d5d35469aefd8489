package com.jreinhal.askdocs.trace;

import com.jreinhal.askdocs.util.LogSanitizer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Spans and metadata of one query. Written concurrently by the pipeline stages until
 * {@link #finish}, read-only afterwards: every mutation after finishing throws.
 */
public class QueryTrace {
    private final String traceId;
    private final String querySummary;
    private final String identity;
    private final Instant startedAt;
    private final long startNanos;
    private final List<TraceSpan> spans = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Set<ActiveSpan> openSpans = ConcurrentHashMap.newKeySet();
    private TraceStatus status = TraceStatus.RUNNING;
    private String error;
    private long durationMs;

    public QueryTrace(String query, String identity) {
        this.traceId = UUID.randomUUID().toString();
        this.querySummary = LogSanitizer.querySummary(query);
        this.identity = identity;
        this.startedAt = Instant.now();
        this.startNanos = System.nanoTime();
    }

    public ActiveSpan startSpan(String name) {
        ActiveSpan span = new ActiveSpan(this, name);
        synchronized (this) {
            this.checkOpen();
            this.openSpans.add(span);
        }
        return span;
    }

    synchronized void record(ActiveSpan active, TraceSpan span) {
        this.checkOpen();
        this.openSpans.remove(active);
        this.spans.add(span);
    }

    public synchronized void putMetadata(String key, Object value) {
        this.checkOpen();
        if (value != null) {
            this.metadata.put(key, value);
        }
    }

    /**
     * Finalizes the trace. Spans still open are closed as failed, so an abandoned stage never
     * appears successful.
     */
    public void finish(TraceStatus finalStatus, String errorMessage) {
        List<ActiveSpan> abandoned;
        synchronized (this) {
            this.checkOpen();
            abandoned = new ArrayList<>(this.openSpans);
        }
        for (ActiveSpan span : abandoned) {
            span.fail("abandoned: " + (errorMessage != null ? errorMessage : "request finished")).end();
        }
        synchronized (this) {
            this.status = finalStatus;
            this.error = errorMessage;
            this.durationMs = Duration.ofNanos(System.nanoTime() - this.startNanos).toMillis();
            this.openSpans.clear();
        }
    }

    private void checkOpen() {
        if (this.status != TraceStatus.RUNNING) {
            throw new IllegalStateException("Trace " + this.traceId + " is already finished");
        }
    }

    public String getTraceId() {
        return this.traceId;
    }

    public synchronized TraceStatus getStatus() {
        return this.status;
    }

    public synchronized boolean isFinished() {
        return this.status != TraceStatus.RUNNING;
    }

    public synchronized List<TraceSpan> getSpans() {
        return List.copyOf(this.spans);
    }

    public synchronized Map<String, Object> getMetadata() {
        return Map.copyOf(this.metadata);
    }

    public synchronized TraceSnapshot snapshot() {
        return new TraceSnapshot(this.traceId, this.querySummary, this.identity, this.status, this.error, this.startedAt,
                this.durationMs, List.copyOf(this.spans), new LinkedHashMap<>(this.metadata));
    }
}
