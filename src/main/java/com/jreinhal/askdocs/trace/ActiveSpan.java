package com.jreinhal.askdocs.trace;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A span being recorded. {@link #end()} publishes it to its trace once; later calls are no-ops.
 */
public class ActiveSpan {
    private final QueryTrace trace;
    private final String name;
    private final Instant startedAt;
    private final long startNanos;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private boolean error;
    private String errorMessage;
    private boolean degraded;
    private TraceSpan finished;

    ActiveSpan(QueryTrace trace, String name) {
        this.trace = trace;
        this.name = name;
        this.startedAt = Instant.now();
        this.startNanos = System.nanoTime();
    }

    public synchronized ActiveSpan attribute(String key, Object value) {
        if (this.finished == null && value != null) {
            this.attributes.put(key, value);
        }
        return this;
    }

    public synchronized ActiveSpan degraded(String reason) {
        this.degraded = true;
        return this.attribute("degraded_reason", reason);
    }

    public synchronized ActiveSpan fail(String message) {
        this.error = true;
        this.errorMessage = message;
        return this;
    }

    public ActiveSpan fail(Throwable cause) {
        return this.fail(cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    public TraceSpan end() {
        TraceSpan span;
        synchronized (this) {
            if (this.finished != null) {
                return this.finished;
            }
            Instant endedAt = Instant.now();
            long durationMs = Duration.ofNanos(System.nanoTime() - this.startNanos).toMillis();
            this.finished = new TraceSpan(this.name, this.startedAt, endedAt, durationMs, Map.copyOf(this.attributes),
                    this.error, this.errorMessage, this.degraded);
            span = this.finished;
        }
        this.trace.record(this, span);
        return span;
    }

    public String getName() {
        return this.name;
    }

    public synchronized boolean isEnded() {
        return this.finished != null;
    }
}
