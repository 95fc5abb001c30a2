package com.example.careplan.observability.filter;

import com.example.careplan.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;

/**
 * WebFilter that tags every API request with a correlation ID and logs its outcome with timing.
 * The correlation ID is taken from X-Correlation-Id when the caller sends one.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";

    private static final int MAX_CORRELATION_ID_LENGTH = 64;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        // Skip actuator endpoints for less noise
        if (path.startsWith("/actuator")) {
            return chain.filter(exchange);
        }

        String correlationId = correlationId(exchange);
        String method = exchange.getRequest().getMethod().name();
        String sanitizedPath = StringSanitizer.forLog(path);
        exchange.getResponse().getHeaders().add(CORRELATION_ID_HEADER, correlationId);
        long start = System.nanoTime();

        return chain.filter(exchange)
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    log.debug("Request started: {} {}", method, sanitizedPath);
                })
                .doFinally(signalType -> {
                    long durationMs = (System.nanoTime() - start) / 1_000_000;
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    int statusCode = status != null ? status.value() : 200;

                    if (statusCode >= 500) {
                        log.error("Request completed: {} {} - {} in {}ms", method, sanitizedPath, statusCode, durationMs);
                    } else if (statusCode >= 400) {
                        log.warn("Request completed: {} {} - {} in {}ms", method, sanitizedPath, statusCode, durationMs);
                    } else {
                        log.info("Request completed: {} {} - {} in {}ms", method, sanitizedPath, statusCode, durationMs);
                    }
                    MDC.remove(CORRELATION_ID_KEY);
                });
    }

    private String correlationId(ServerWebExchange exchange) {
        String header = exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER);
        if (header != null && !header.isBlank()) {
            return StringSanitizer.forLog(header.trim(), MAX_CORRELATION_ID_LENGTH);
        }
        return UUID.randomUUID().toString();
    }
}
