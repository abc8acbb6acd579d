package com.iplicense.search.common;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestContextFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestContextFilter.class);

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        String requestId = IdGenerator.resolveRequestId(request.getHeader("x-request-id"));
        String traceId = IdGenerator.resolveTraceId(request.getHeader("x-trace-id"));
        PermissionContext permissions = new PermissionContext(
            trimToNull(request.getHeader("x-user-id")),
            trimToNull(request.getHeader("x-session-id")),
            CallerRole.from(request.getHeader("x-user-role")),
            trimToNull(request.getHeader("x-creator-id")),
            trimToNull(request.getHeader("x-brand-id"))
        );
        long startedAt = System.nanoTime();

        RequestContextHolder.set(new RequestContext(requestId, traceId, permissions, startedAt));
        response.setHeader("x-request-id", requestId);
        response.setHeader("x-trace-id", traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            long latencyMs = (System.nanoTime() - startedAt) / 1_000_000L;
            logger.info(
                "request_id={} trace_id={} user_id={} role={} method={} path={} status={} latency_ms={}",
                requestId,
                traceId,
                permissions.userId(),
                permissions.role(),
                request.getMethod(),
                request.getRequestURI(),
                response.getStatus(),
                latencyMs
            );
            RequestContextHolder.clear();
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
