package com.iplicense.search.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestContextFilterTest {
    private final RequestContextFilter filter = new RequestContextFilter();

    @Test
    void resolvesCallerFromHeadersAndClearsAfterwards() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/search");
        request.addHeader("x-request-id", "req_abc");
        request.addHeader("x-user-id", " u-1 ");
        request.addHeader("x-user-role", "Brand");
        request.addHeader("x-brand-id", "br-1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<RequestContext> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(RequestContextHolder.get()));

        RequestContext context = seen.get();
        assertEquals("req_abc", context.getRequestId());
        assertEquals("u-1", context.getPermissions().userId());
        assertEquals(CallerRole.BRAND, context.getPermissions().role());
        assertTrue(context.getPermissions().isBrand());
        assertEquals("req_abc", response.getHeader("x-request-id"));
        assertTrue(response.getHeader("x-trace-id").startsWith("trace_"));
        assertNull(RequestContextHolder.get());
    }

    @Test
    void missingHeadersMeanAnonymousCaller() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<PermissionContext> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(RequestContextHolder.permissions()));

        assertEquals(CallerRole.ANONYMOUS, seen.get().role());
        assertNull(seen.get().userId());
        assertTrue(response.getHeader("x-request-id").startsWith("req_"));
    }

    @Test
    void unknownRoleFallsBackToViewer() {
        assertEquals(CallerRole.VIEWER, CallerRole.from("superuser"));
        assertEquals(CallerRole.ADMIN, CallerRole.from(" admin "));
    }
}
