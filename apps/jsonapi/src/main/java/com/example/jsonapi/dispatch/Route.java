package com.example.jsonapi.dispatch;

import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.ActionHandler;
import org.springframework.http.HttpMethod;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * One entry of a route table: method and path shape, guards, and the action it performs.
 *
 * @param handler fixed handler, or {@code null} to use the handler registered for the action
 */
public record Route(
        HttpMethod method,
        PathTemplate template,
        List<Guard> guards,
        Action action,
        Rendering rendering,
        @Nullable ActionHandler handler
) {
    public Route {
        guards = List.copyOf(guards);
    }
}
