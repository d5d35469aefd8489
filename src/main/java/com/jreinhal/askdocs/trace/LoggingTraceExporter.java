package com.jreinhal.askdocs.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingTraceExporter implements TraceExporter {
    private static final Logger log = LoggerFactory.getLogger(LoggingTraceExporter.class);

    @Override
    public void export(TraceSnapshot trace) {
        log.info("Trace {} status={} duration={}ms spans={}", trace.traceId(), trace.status(), trace.durationMs(), trace.spans().size());
        if (log.isDebugEnabled()) {
            for (TraceSpan span : trace.spans()) {
                log.debug("  span {} {}ms error={} degraded={} {}", span.name(), span.durationMs(), span.error(), span.degraded(), span.attributes());
            }
        }
    }
}
