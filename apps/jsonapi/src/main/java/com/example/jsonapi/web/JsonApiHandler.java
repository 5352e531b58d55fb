package com.example.jsonapi.web;

import com.example.jsonapi.config.properties.JsonApiProperties;
import com.example.jsonapi.context.JsonApiRequest;
import com.example.jsonapi.context.JsonApiResponse;
import com.example.jsonapi.dispatch.JsonApiDispatcher;
import com.example.jsonapi.lifecycle.RequestLifecycle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * WebFlux adapter for the dispatcher.
 *
 * <p>The body is read reactively, then the synchronous dispatcher runs on the
 * boundedElastic scheduler since finders, handlers and transaction hooks may block.
 */
@Slf4j
public class JsonApiHandler {

    private final JsonApiDispatcher dispatcher;
    private final RequestLifecycle lifecycle;
    private final String basePath;

    public JsonApiHandler(JsonApiDispatcher dispatcher, RequestLifecycle lifecycle, JsonApiProperties properties) {
        this.dispatcher = dispatcher;
        this.lifecycle = lifecycle;
        this.basePath = properties.basePath();
    }

    public Mono<ServerResponse> handle(ServerRequest request) {
        return request.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> toJsonApiRequest(request, body))
                .flatMap(jsonApiRequest -> Mono.fromCallable(() -> dispatcher.handle(jsonApiRequest))
                        .subscribeOn(Schedulers.boundedElastic()))
                .onErrorResume(error -> {
                    // Faults before dispatch, e.g. an unreadable body
                    log.warn("Request failed before dispatch: path={}, error={}", request.path(), error.getMessage());
                    return Mono.just(lifecycle.error(error));
                })
                .flatMap(this::toServerResponse);
    }

    private JsonApiRequest toJsonApiRequest(ServerRequest request, String body) {
        String path = request.requestPath().pathWithinApplication().value();
        if (!basePath.isEmpty() && path.startsWith(basePath)) {
            path = path.substring(basePath.length());
        }
        HttpHeaders headers = new HttpHeaders();
        headers.addAll(request.headers().asHttpHeaders());
        return new JsonApiRequest(
                request.method(),
                path,
                headers,
                new LinkedMultiValueMap<>(request.queryParams()),
                body.isEmpty() ? null : body);
    }

    private Mono<ServerResponse> toServerResponse(JsonApiResponse response) {
        ServerResponse.BodyBuilder builder = ServerResponse.status(response.status())
                .headers(headers -> headers.addAll(response.headers()));
        return response.hasBody()
                ? builder.bodyValue(response.body())
                : builder.build();
    }
}
