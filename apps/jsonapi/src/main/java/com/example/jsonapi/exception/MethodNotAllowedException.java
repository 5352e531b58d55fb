package com.example.jsonapi.exception;

import java.util.Set;
import java.util.TreeSet;

/**
 * Caller is authorized but no handler is registered for the action, or no route exists for
 * the HTTP method (405). Carries the methods that are served at the path, if known.
 */
public class MethodNotAllowedException extends JsonApiException {

    public static final String DEFAULT_DETAIL = "Action or method not implemented or supported";

    private final Set<String> allowedMethods;

    public MethodNotAllowedException() {
        this(DEFAULT_DETAIL, Set.of());
    }

    public MethodNotAllowedException(String detail) {
        this(detail, Set.of());
    }

    public MethodNotAllowedException(String detail, Set<String> allowedMethods) {
        super(405, detail);
        this.allowedMethods = new TreeSet<>(allowedMethods);
    }

    public Set<String> getAllowedMethods() {
        return allowedMethods;
    }
}
