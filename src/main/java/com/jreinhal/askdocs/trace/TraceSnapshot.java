package com.jreinhal.askdocs.trace;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Serializable view of a trace, as exported and as served by the trace endpoint. The query is
 * kept only as its {@code [len=..,id=..]} summary.
 */
public record TraceSnapshot(
        @JsonProperty("trace_id") String traceId,
        @JsonProperty("query_summary") String querySummary,
        String identity,
        TraceStatus status,
        String error,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("duration_ms") long durationMs,
        List<TraceSpan> spans,
        Map<String, Object> metadata) {
}
