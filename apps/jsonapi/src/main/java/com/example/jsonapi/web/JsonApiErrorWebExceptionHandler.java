package com.example.jsonapi.web;

import com.example.jsonapi.context.JsonApiResponse;
import com.example.jsonapi.lifecycle.RequestLifecycle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

/**
 * Renders faults raised outside the JSON:API router (unmatched paths, filter failures) as
 * JSON:API error documents, so every error the service emits has the same shape.
 */
@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class JsonApiErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    private final RequestLifecycle lifecycle;

    public JsonApiErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer,
            RequestLifecycle lifecycle) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
        this.lifecycle = lifecycle;
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        log.debug("Rendering error outside dispatcher: path={}, error={}", request.path(), error.getClass().getSimpleName());
        JsonApiResponse response = lifecycle.error(error);
        return ServerResponse.status(response.status())
                .headers(headers -> headers.addAll(response.headers()))
                .bodyValue(response.body() != null ? response.body() : "");
    }
}
