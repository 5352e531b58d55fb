package com.example.jsonapi.authz;

import com.example.jsonapi.context.JsonApiRequest;
import org.springframework.lang.Nullable;

/**
 * Determines the caller's role for a request. Called at most once per request.
 * Returning {@code null} means an anonymous caller.
 */
@FunctionalInterface
public interface RoleResolver {

    RoleResolver ANONYMOUS = request -> null;

    @Nullable
    String resolve(JsonApiRequest request);
}
