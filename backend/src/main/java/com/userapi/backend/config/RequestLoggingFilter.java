package com.userapi.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Access log plus MDC request context. Ordered ahead of the security chain so
 * rejected requests are logged too.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    static final String MDC_REQUEST_ID = "request_id";
    static final String MDC_METHOD = "http_method";
    static final String MDC_PATH = "http_path";
    static final String MDC_CLIENT_IP = "client_ip";
    static final String MDC_USER_ID = "user_id";

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        String requestId = resolveRequestId(req);

        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_METHOD, req.getMethod());
        MDC.put(MDC_PATH, req.getRequestURI());
        MDC.put(MDC_CLIENT_IP, resolveClientIp(req));
        res.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            chain.doFilter(req, res);
        } finally {
            long latencyMs = (System.nanoTime() - start) / 1_000_000;
            log.info("{} {} {} {}ms", req.getMethod(), req.getRequestURI(), res.getStatus(), latencyMs);
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_METHOD);
            MDC.remove(MDC_PATH);
            MDC.remove(MDC_CLIENT_IP);
            MDC.remove(MDC_USER_ID);
        }
    }

    private String resolveRequestId(HttpServletRequest req) {
        String requestId = req.getHeader(REQUEST_ID_HEADER);
        if (requestId != null && !requestId.isBlank()) {
            return requestId;
        }
        return UUID.randomUUID().toString();
    }

    private String resolveClientIp(HttpServletRequest req) {
        String forwarded = req.getHeader("X-Forwarded-For");
        if (forwarded == null || forwarded.isBlank()) {
            return req.getRemoteAddr();
        }
        int comma = forwarded.indexOf(',');
        return comma < 0 ? forwarded.trim() : forwarded.substring(0, comma).trim();
    }
}
