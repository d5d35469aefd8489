package com.jreinhal.askdocs.controller;

import com.jreinhal.askdocs.security.IdentityResolver;
import com.jreinhal.askdocs.trace.QueryTracer;
import com.jreinhal.askdocs.trace.TraceSnapshot;
import jakarta.servlet.http.HttpServletRequest;
import java.util.NoSuchElementException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves finished traces to the identity that issued the query. Traces of other identities
 * are reported as unknown.
 */
@RestController
@RequestMapping(value={"/api/traces"})
public class TraceController {
    private final QueryTracer tracer;
    private final IdentityResolver identityResolver;

    public TraceController(QueryTracer tracer, IdentityResolver identityResolver) {
        this.tracer = tracer;
        this.identityResolver = identityResolver;
    }

    @GetMapping(value={"/{traceId}"})
    public ResponseEntity<TraceSnapshot> getTrace(@PathVariable String traceId, HttpServletRequest request) {
        String identity = this.identityResolver.resolve(request).key();
        TraceSnapshot snapshot = this.tracer.find(traceId)
                .filter(found -> identity.equals(found.identity()))
                .orElseThrow(() -> new NoSuchElementException("Unknown trace " + traceId));
        return ResponseEntity.ok(snapshot);
    }
}
