package com.example.jsonapi.observability.filter;

import com.example.jsonapi.config.properties.JsonApiProperties;
import com.example.jsonapi.document.HandlerResult;
import com.example.jsonapi.document.ResourceObject;
import com.example.jsonapi.resource.ResourceRegistrar;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.example.jsonapi.util.JsonApiTestStack.aStack;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RequestLoggingFilter")
class RequestLoggingFilterTest {

    private SimpleMeterRegistry meterRegistry;
    private RequestLoggingFilter filter;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ResourceRegistrar registrar = aStack().registrar();
        for (String name : new String[] {"post", "comment"}) {
            registrar.<Object>declare(name, r -> r
                    .serializer((type, value) -> ResourceObject.builder(type.value(), "1").build())
                    .index(ctx -> HandlerResult.ok(List.of())));
        }
        filter = new RequestLoggingFilter(meterRegistry, new JsonApiProperties("/api", null, null, null, null), registrar);
    }

    @Nested
    @DisplayName("correlation id")
    class CorrelationId {

        @Test
        @DisplayName("should echo the incoming correlation id")
        void shouldEchoCorrelationId() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/posts").header(RequestLoggingFilter.CORRELATION_ID_HEADER, "abc-123").build());

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

            assertThat(exchange.getResponse().getHeaders().getFirst(RequestLoggingFilter.CORRELATION_ID_HEADER))
                    .isEqualTo("abc-123");
        }

        @Test
        @DisplayName("should fall back to the request id header")
        void shouldFallBackToRequestId() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/posts").header(RequestLoggingFilter.REQUEST_ID_HEADER, "req-9").build());

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

            assertThat(exchange.getResponse().getHeaders().getFirst(RequestLoggingFilter.CORRELATION_ID_HEADER))
                    .isEqualTo("req-9");
        }

        @Test
        @DisplayName("should generate an id and expose it through the MDC while the chain runs")
        void shouldGenerateAndExposeId() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/posts").build());
            AtomicReference<String> seen = new AtomicReference<>();
            WebFilterChain chain = ex -> Mono.fromRunnable(() -> seen.set(MDC.get(RequestLoggingFilter.CORRELATION_ID_KEY)));

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            String generated = exchange.getResponse().getHeaders().getFirst(RequestLoggingFilter.CORRELATION_ID_HEADER);
            assertThat(generated).isNotBlank();
            assertThat(seen.get()).isEqualTo(generated);
            assertThat(MDC.get(RequestLoggingFilter.CORRELATION_ID_KEY)).isNull();
        }
    }

    @Nested
    @DisplayName("metrics")
    class Metrics {

        @Test
        @DisplayName("should record the request timer tagged by resource and status")
        void shouldRecordTimer() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/posts/42/author").build());
            WebFilterChain chain = ex -> Mono.fromRunnable(() -> ex.getResponse().setStatusCode(HttpStatus.NOT_FOUND));

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            Timer timer = meterRegistry.find(RequestLoggingFilter.METRIC_NAME)
                    .tags("method", "GET", "resource", "posts", "status", "404", "outcome", "CLIENT_ERROR")
                    .timer();
            assertThat(timer).isNotNull();
            assertThat(timer.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should skip actuator endpoints")
        void shouldSkipActuator() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/actuator/health").build());

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

            assertThat(meterRegistry.find(RequestLoggingFilter.METRIC_NAME).timer()).isNull();
            assertThat(exchange.getResponse().getHeaders().containsKey(RequestLoggingFilter.CORRELATION_ID_HEADER)).isFalse();
        }

        @Test
        @DisplayName("should derive the resource tag below the base path")
        void shouldDeriveResourceTag() {
            assertThat(filter.resourceOf("/api/comments/7")).isEqualTo("comments");
            assertThat(filter.resourceOf("/api")).isEqualTo(RequestLoggingFilter.UNKNOWN_RESOURCE);
        }

        @Test
        @DisplayName("should tag undeclared paths with a single fixed value")
        void shouldBoundResourceTagForUndeclaredPaths() {
            for (int i = 0; i < 50; i++) {
                MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/junk" + i).build());
                StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();
            }

            assertThat(meterRegistry.find(RequestLoggingFilter.METRIC_NAME).timers()).hasSize(1);
            assertThat(meterRegistry.find(RequestLoggingFilter.METRIC_NAME)
                    .tag("resource", RequestLoggingFilter.UNKNOWN_RESOURCE)
                    .timer().count()).isEqualTo(50);
        }
    }
}
