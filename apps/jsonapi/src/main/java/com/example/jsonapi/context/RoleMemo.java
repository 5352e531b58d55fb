package com.example.jsonapi.context;

import org.springframework.lang.Nullable;

import java.util.function.Supplier;

/**
 * Caller role, resolved at most once per request. A {@code null} role is a valid, memoized result.
 * Nested sideload requests share the memo of the request that spawned them.
 */
public final class RoleMemo {

    private final Supplier<String> resolver;
    private boolean resolved;
    private String role;

    public RoleMemo(Supplier<String> resolver) {
        this.resolver = resolver;
    }

    public static RoleMemo of(@Nullable String role) {
        RoleMemo memo = new RoleMemo(() -> role);
        memo.get();
        return memo;
    }

    @Nullable
    public String get() {
        if (!resolved) {
            role = resolver.get();
            resolved = true;
        }
        return role;
    }
}
