package com.example.jsonapi.resource;

import org.springframework.lang.Nullable;

/**
 * Registered-handler-set lookup used by the {@code actions} guard.
 */
@FunctionalInterface
public interface HandlerLookup {

    boolean hasHandler(Action action, @Nullable String relationship);
}
