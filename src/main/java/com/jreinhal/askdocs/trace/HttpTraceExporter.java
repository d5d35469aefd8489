package com.jreinhal.askdocs.trace;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * POSTs finished traces as JSON to {@code askdocs.tracing.endpoint}, off the request thread.
 * Does nothing when no endpoint is configured.
 */
@Component
public class HttpTraceExporter implements TraceExporter {
    private static final Logger log = LoggerFactory.getLogger(HttpTraceExporter.class);
    private final RestClient restClient;
    private final ExecutorService executor;
    private final String endpoint;

    public HttpTraceExporter(RestClient.Builder restClientBuilder, @Qualifier("traceExportExecutor") ExecutorService executor,
            @Value("${askdocs.tracing.endpoint:}") String endpoint) {
        this.restClient = restClientBuilder.build();
        this.executor = executor;
        this.endpoint = endpoint;
    }

    @Override
    public void export(TraceSnapshot trace) {
        if (this.endpoint == null || this.endpoint.isBlank()) {
            return;
        }
        try {
            this.executor.execute(() -> this.post(trace));
        } catch (RejectedExecutionException e) {
            log.warn("Trace export queue full, dropping trace {}", trace.traceId());
        }
    }

    private void post(TraceSnapshot trace) {
        try {
            this.restClient.post()
                    .uri(this.endpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(trace)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            log.warn("Trace export to {} failed for {}: {}", this.endpoint, trace.traceId(), e.getMessage());
        }
    }
}
