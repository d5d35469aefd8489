package com.jreinhal.askdocs.security;

import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves the client address used as fallback rate-limit identity. Forwarding headers are
 * honoured only when the direct peer is a configured trusted proxy.
 */
@Component
public class ClientIpResolver {
    private static final Logger log = LoggerFactory.getLogger(ClientIpResolver.class);
    static final String UNKNOWN = "unknown";
    private static final String FORWARDED_FOR = "X-Forwarded-For";
    @Value("${app.security.trusted-proxies:}")
    private String trustedProxyList;
    private Set<String> trustedProxies = Set.of();

    @PostConstruct
    public void init() {
        if (this.trustedProxyList == null || this.trustedProxyList.isBlank()) {
            this.trustedProxies = Set.of();
            return;
        }
        HashSet<String> parsed = new HashSet<>();
        Arrays.stream(this.trustedProxyList.split(","))
                .map(String::trim)
                .filter(value -> !value.isBlank())
                .forEach(parsed::add);
        this.trustedProxies = Set.copyOf(parsed);
        log.info("Trusted proxies configured: {}", this.trustedProxies);
    }

    /**
     * Walks {@code X-Forwarded-For} from the nearest hop outwards and returns the first address
     * that is not itself a trusted proxy. Spoofed entries further left are never reached.
     */
    public String resolveClientIp(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        String peer = request.getRemoteAddr();
        if (peer == null) {
            return UNKNOWN;
        }
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded == null || forwarded.isBlank()) {
            return peer;
        }
        if (!this.trustedProxies.contains(peer)) {
            if (log.isDebugEnabled()) {
                log.debug("Ignoring {} from untrusted peer {}", FORWARDED_FOR, peer);
            }
            return peer;
        }
        List<String> hops = Arrays.stream(forwarded.split(","))
                .map(String::trim)
                .filter(hop -> !hop.isEmpty())
                .toList();
        for (int i = hops.size() - 1; i >= 0; i--) {
            if (!this.trustedProxies.contains(hops.get(i))) {
                return hops.get(i);
            }
        }
        return hops.isEmpty() ? peer : hops.get(0);
    }
}
