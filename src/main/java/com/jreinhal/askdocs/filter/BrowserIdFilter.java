package com.jreinhal.askdocs.filter;

import com.jreinhal.askdocs.security.IdentityResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Issues a {@code browser_id} cookie to browsers that do not carry one yet, so later requests
 * are rate limited per browser rather than per address.
 */
@Component
@Order(value=2)
public class BrowserIdFilter extends OncePerRequestFilter {
    @Value("${app.session.cookie-max-age-days:365}")
    private long cookieMaxAgeDays = 365L;
    @Value("${app.session.cookie-secure:false}")
    private boolean cookieSecure;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
        if (!hasBrowserCookie(request)) {
            ResponseCookie cookie = ResponseCookie.from(IdentityResolver.BROWSER_COOKIE, UUID.randomUUID().toString())
                    .httpOnly(true)
                    .secure(this.cookieSecure)
                    .sameSite("Lax")
                    .path("/")
                    .maxAge(Duration.ofDays(this.cookieMaxAgeDays))
                    .build();
            response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
        }
        filterChain.doFilter(request, response);
    }

    private static boolean hasBrowserCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        return cookies != null && Arrays.stream(cookies)
                .anyMatch(c -> IdentityResolver.BROWSER_COOKIE.equals(c.getName()) && c.getValue() != null && !c.getValue().isBlank());
    }
}
