package com.jreinhal.askdocs.filter;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    @Test
    void echoesSafeRequestIdAndExposesItInMdc() throws Exception {
        RequestIdFilter filter = new RequestIdFilter();
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/query");
        req.addHeader(RequestIdFilter.HEADER_NAME, "abc-123");
        MockHttpServletResponse res = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(req, res, (request, response) -> seen.set(MDC.get(RequestIdFilter.MDC_KEY)));

        assertEquals("abc-123", seen.get());
        assertEquals("abc-123", res.getHeader(RequestIdFilter.HEADER_NAME));
        assertNull(MDC.get(RequestIdFilter.MDC_KEY));
    }

    @Test
    void replacesUnsafeRequestId() throws Exception {
        RequestIdFilter filter = new RequestIdFilter();
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/session");
        req.addHeader(RequestIdFilter.HEADER_NAME, "<script>alert(1)</script>");
        MockHttpServletResponse res = new MockHttpServletResponse();

        filter.doFilter(req, res, (request, response) -> { });

        String issued = res.getHeader(RequestIdFilter.HEADER_NAME);
        assertNotNull(issued);
        assertNotEquals("<script>alert(1)</script>", issued);
    }
}
