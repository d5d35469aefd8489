package com.jreinhal.askdocs.security;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves the session identity of a request: browser cookie, then session header, then the
 * client address.
 */
@Component
public class IdentityResolver {
    public static final String BROWSER_COOKIE = "browser_id";
    private static final Pattern SAFE_SESSION_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]{1,128}$");
    private final ClientIpResolver clientIpResolver;
    @Value("${app.session.header:X-Session-Id}")
    private String sessionHeader = "X-Session-Id";

    public IdentityResolver(ClientIpResolver clientIpResolver) {
        this.clientIpResolver = clientIpResolver;
    }

    public ClientIdentity resolve(HttpServletRequest request) {
        String cookie = this.cookieValue(request, BROWSER_COOKIE);
        if (isUsable(cookie)) {
            return new ClientIdentity(cookie, ClientIdentity.Source.SESSION_COOKIE);
        }
        String header = request.getHeader(this.sessionHeader);
        if (isUsable(header)) {
            return new ClientIdentity(header.trim(), ClientIdentity.Source.SESSION_HEADER);
        }
        return new ClientIdentity(this.clientIpResolver.resolveClientIp(request), ClientIdentity.Source.CLIENT_IP);
    }

    private String cookieValue(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName())) {
                return cookie.getValue();
            }
        }
        return null;
    }

    private static boolean isUsable(String value) {
        return value != null && !value.isBlank() && SAFE_SESSION_ID.matcher(value.trim()).matches();
    }
}
