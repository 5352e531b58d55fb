package com.example.jsonapi.observability.filter;

import com.example.jsonapi.common.util.StringSanitizer;
import com.example.jsonapi.config.properties.JsonApiProperties;
import com.example.jsonapi.resource.ResourceEndpoint;
import com.example.jsonapi.resource.ResourceName;
import com.example.jsonapi.resource.ResourceRegistrar;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * WebFilter that assigns a correlation id, logs each request with timing and records the
 * {@code jsonapi.requests} timer.
 *
 * <p>The correlation id is taken from {@code X-Correlation-Id}, then {@code X-Request-Id},
 * or generated, and echoed on the response.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class RequestLoggingFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String METRIC_NAME = "jsonapi.requests";
    public static final String UNKNOWN_RESOURCE = "unknown";

    private final MeterRegistry meterRegistry;
    private final JsonApiProperties properties;
    private final ResourceRegistrar registrar;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        // Skip actuator endpoints for less noise
        String path = exchange.getRequest().getPath().value();
        if (path.startsWith("/actuator")) {
            return chain.filter(exchange);
        }

        String correlationId = extractOrGenerateCorrelationId(exchange.getRequest());
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        Instant startTime = Instant.now();
        String method = exchange.getRequest().getMethod().name();

        return chain.filter(exchange)
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    log.info("Incoming request: {} {}", method, StringSanitizer.forLog(path, 200));
                })
                .doFinally(signalType -> {
                    Duration duration = Duration.between(startTime, Instant.now());
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    int statusCode = status != null ? status.value() : 200;

                    recordRequestMetrics(method, resourceOf(path), statusCode, duration);

                    String sanitizedPath = StringSanitizer.forLog(path, 200);
                    if (statusCode >= 500) {
                        log.error("Request completed: {} {} - {} in {}ms",
                                method, sanitizedPath, statusCode, duration.toMillis());
                    } else if (statusCode >= 400) {
                        log.warn("Request completed: {} {} - {} in {}ms",
                                method, sanitizedPath, statusCode, duration.toMillis());
                    } else {
                        log.info("Request completed: {} {} - {} in {}ms",
                                method, sanitizedPath, statusCode, duration.toMillis());
                    }
                    MDC.remove(CORRELATION_ID_KEY);
                });
    }

    private void recordRequestMetrics(String method, String resource, int statusCode, Duration duration) {
        Timer.builder(METRIC_NAME)
                .tag("method", method)
                .tag("resource", resource)
                .tag("status", String.valueOf(statusCode))
                .tag("outcome", getOutcome(statusCode))
                .register(meterRegistry)
                .record(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Declared resource named by the first path segment below the mount point, else
     * {@value #UNKNOWN_RESOURCE}. Only declared names become tag values.
     */
    String resourceOf(String path) {
        String base = properties.basePath();
        String relative = !base.isEmpty() && path.startsWith(base) ? path.substring(base.length()) : path;
        for (String segment : relative.split("/")) {
            if (!segment.isEmpty()) {
                ResourceEndpoint<?> endpoint = registrar.endpoint(new ResourceName(segment));
                return endpoint != null ? endpoint.name().value() : UNKNOWN_RESOURCE;
            }
        }
        return UNKNOWN_RESOURCE;
    }

    private String getOutcome(int statusCode) {
        if (statusCode < 200) return "INFORMATIONAL";
        if (statusCode < 300) return "SUCCESS";
        if (statusCode < 400) return "REDIRECTION";
        if (statusCode < 500) return "CLIENT_ERROR";
        return "SERVER_ERROR";
    }

    private String extractOrGenerateCorrelationId(ServerHttpRequest request) {
        String correlationId = StringSanitizer.headerValue(request.getHeaders().getFirst(CORRELATION_ID_HEADER), 128);
        if (correlationId != null) {
            return correlationId;
        }
        String requestId = StringSanitizer.headerValue(request.getHeaders().getFirst(REQUEST_ID_HEADER), 128);
        if (requestId != null) {
            return requestId;
        }
        return UUID.randomUUID().toString();
    }
}
