package com.example.jsonapi.web;

import com.example.jsonapi.config.properties.JsonApiProperties;
import com.example.jsonapi.dispatch.JsonApiDispatcher;
import com.example.jsonapi.lifecycle.RequestLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

@Configuration
public class JsonApiRouterConfig {

    @Bean
    public JsonApiHandler jsonApiHandler(
            JsonApiDispatcher jsonApiDispatcher,
            RequestLifecycle requestLifecycle,
            JsonApiProperties properties) {
        return new JsonApiHandler(jsonApiDispatcher, requestLifecycle, properties);
    }

    @Bean
    public RouterFunction<ServerResponse> jsonApiRoutes(JsonApiHandler jsonApiHandler, JsonApiProperties properties) {
        String base = properties.basePath();
        return RouterFunctions.route(
                RequestPredicates.path(base + "/**")
                        .and(RequestPredicates.path("/actuator/**").negate()),
                jsonApiHandler::handle);
    }
}
