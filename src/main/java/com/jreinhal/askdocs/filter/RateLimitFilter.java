package com.jreinhal.askdocs.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.askdocs.ratelimit.ActionKind;
import com.jreinhal.askdocs.ratelimit.RateLimitDecision;
import com.jreinhal.askdocs.ratelimit.RateLimiter;
import com.jreinhal.askdocs.security.ClientIdentity;
import com.jreinhal.askdocs.security.IdentityResolver;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Admits query and upload requests through the {@link RateLimiter} before any pipeline work
 * starts. Denials are answered here with 429 and never reach the controllers.
 */
@Component
@Order(value=4)
public class RateLimitFilter
implements Filter {
    private final RateLimiter rateLimiter;
    private final IdentityResolver identityResolver;
    private final ObjectMapper objectMapper;
    @Value("${app.rate-limit.enabled:true}")
    private boolean enabled = true;

    public RateLimitFilter(RateLimiter rateLimiter, IdentityResolver identityResolver, ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.identityResolver = identityResolver;
        this.objectMapper = objectMapper;
    }

    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain) throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest)request;
        HttpServletResponse httpResponse = (HttpServletResponse)response;
        ActionKind kind = resolveActionKind(httpRequest);
        if (!this.enabled || kind == null) {
            chain.doFilter(request, response);
            return;
        }
        ClientIdentity identity = this.identityResolver.resolve(httpRequest);
        RateLimitDecision decision = this.rateLimiter.admit(identity, kind);
        httpResponse.setHeader("X-RateLimit-Limit", String.valueOf(decision.limit()));
        httpResponse.setHeader("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
        if (decision.allowed()) {
            chain.doFilter(request, response);
            return;
        }
        long retryAfter = decision.retryAfterSeconds();
        httpResponse.setStatus(429);
        httpResponse.setContentType(MediaType.APPLICATION_JSON_VALUE);
        httpResponse.setHeader("Retry-After", String.valueOf(retryAfter));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Rate limit exceeded for " + kind.tag() + " requests. Please wait before trying again.");
        body.put("errorCode", "ERR-429");
        body.put("retryAfter", retryAfter);
        body.put("timestamp", Instant.now().toString());
        this.objectMapper.writeValue(httpResponse.getWriter(), body);
    }

    static ActionKind resolveActionKind(HttpServletRequest request) {
        if (!"POST".equalsIgnoreCase(request.getMethod())) {
            return null;
        }
        String path = request.getRequestURI();
        if ("/api/query".equals(path)) {
            return ActionKind.QUERY;
        }
        if ("/api/ingest/file".equals(path)) {
            return ActionKind.UPLOAD;
        }
        return null;
    }
}
