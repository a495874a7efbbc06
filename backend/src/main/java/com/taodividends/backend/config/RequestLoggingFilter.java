package com.taodividends.backend.config;

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

/**
 * One access-log line per API call, tagged with the request id set by {@link RequestCorrelationFilter}.
 * Server errors are logged at WARN; liveness probes are not logged at all.
 */
@Component
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        return "/health".equals(path) || path.startsWith("/actuator/health");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            String target = request.getQueryString() == null
                    ? request.getRequestURI()
                    : request.getRequestURI() + "?" + request.getQueryString();
            int status = response.getStatus();
            if (status >= 500) {
                log.warn("HTTP {} {} -> {} ({} ms) requestId={}", request.getMethod(), target, status, durationMs,
                        MDC.get("requestId"));
            } else {
                log.info("HTTP {} {} -> {} ({} ms) requestId={}", request.getMethod(), target, status, durationMs,
                        MDC.get("requestId"));
            }
        }
    }
}
