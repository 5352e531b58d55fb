package com.example.jsonapi.registry;

import com.example.jsonapi.common.JsonApiConstants;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of roles allowed to perform an action.
 *
 * <p>An empty set means the action is unrestricted. The wildcard {@code "*"} matches any
 * identified caller, i.e. any non-null role.
 *
 * @param values allowed role names
 */
public record Roles(Set<String> values) {

    public static final Roles UNRESTRICTED = new Roles(Set.of());

    public Roles {
        values = values == null ? Set.of() : Set.copyOf(values);
    }

    public static Roles of(String... roles) {
        return roles == null || roles.length == 0
                ? UNRESTRICTED
                : new Roles(Arrays.stream(roles).map(String::trim).collect(Collectors.toSet()));
    }

    public static Roles of(@Nullable Collection<String> roles) {
        return roles == null || roles.isEmpty()
                ? UNRESTRICTED
                : new Roles(roles.stream().map(String::trim).collect(Collectors.toSet()));
    }

    public boolean isUnrestricted() {
        return values.isEmpty();
    }

    /**
     * Check whether the given caller role is a member of this set.
     * Does not consider the unrestricted case; callers check {@link #isUnrestricted()} first.
     */
    public boolean matches(@Nullable String role) {
        if (role == null) {
            return false;
        }
        return values.contains(role) || values.contains(JsonApiConstants.ANY_ROLE);
    }
}
