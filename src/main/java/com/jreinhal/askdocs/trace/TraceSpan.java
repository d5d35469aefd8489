package com.jreinhal.askdocs.trace;

import java.time.Instant;
import java.util.Map;

/**
 * A finished span.
 *
 * @param degraded the stage fell back to a reduced result instead of failing
 */
public record TraceSpan(String name, Instant startedAt, Instant endedAt, long durationMs, Map<String, Object> attributes,
        boolean error, String errorMessage, boolean degraded) {
}
