package com.nikoh.matchmaking.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Correlates log lines of one request through the {@code traceId} MDC key
 */
@Slf4j
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    static final String TRACE_ID = "traceId";
    private static final String START_TIME_ATTRIBUTE = RequestLoggingInterceptor.class.getName() + ".startTime";
    private static final long SLOW_REQUEST_MILLIS = 5000;

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        MDC.put(TRACE_ID, correlationId);
        request.setAttribute(START_TIME_ATTRIBUTE, System.currentTimeMillis());
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        // Query strings are not logged; they may carry user identifiers
        log.info("Incoming request: {} {}", request.getMethod(), request.getRequestURI());
        return true;
    }

    @Override
    public void afterCompletion(@NonNull HttpServletRequest request,
                                @NonNull HttpServletResponse response,
                                @NonNull Object handler,
                                Exception ex) {
        Object startTime = request.getAttribute(START_TIME_ATTRIBUTE);
        if (startTime != null) {
            long duration = System.currentTimeMillis() - (Long) startTime;
            int status = response.getStatus();

            if (status >= 500) {
                log.error("Request completed: {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), status, duration);
            } else if (status >= 400) {
                log.warn("Request completed: {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), status, duration);
            } else {
                log.info("Request completed: {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), status, duration);
            }

            if (duration > SLOW_REQUEST_MILLIS) {
                log.warn("SLOW REQUEST DETECTED: {} {} took {}ms",
                        request.getMethod(), request.getRequestURI(), duration);
            }
        }

        MDC.remove(TRACE_ID);
    }
}
