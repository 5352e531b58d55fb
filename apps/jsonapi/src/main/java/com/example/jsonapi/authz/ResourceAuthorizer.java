package com.example.jsonapi.authz;

import com.example.jsonapi.context.RoleMemo;
import com.example.jsonapi.context.SideloadPassthrough;
import com.example.jsonapi.registry.ResourceConfig;
import com.example.jsonapi.registry.Roles;
import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.RelationType;
import com.example.jsonapi.resource.ResourceName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Role-based authorization over the role and sideload tables.
 *
 * <h3>Evaluation:</h3>
 * <ol>
 *   <li>Relationship entry if type and name are given and one exists, else the resource entry</li>
 *   <li>Empty role set: allowed</li>
 *   <li>Otherwise the caller's memoized role must be in the set ({@code *} matches any role)</li>
 * </ol>
 *
 * <p>Pure lookups over frozen tables; never throws and performs no I/O beyond the one-time
 * role resolution.
 */
@Slf4j
@RequiredArgsConstructor
public class ResourceAuthorizer {

    private final ResourceConfig config;

    public boolean can(
            @NonNull RoleMemo role,
            @NonNull ResourceName resourceName,
            @NonNull Action action,
            @Nullable RelationType type,
            @Nullable String relationship) {
        Roles roles = config.roles(resourceName).lookup(action, type, relationship);
        if (roles.isUnrestricted()) {
            return true;
        }
        boolean allowed = roles.matches(role.get());
        if (!allowed) {
            log.debug("Role denied: resource={}, action={}, relationship={}, required={}",
                    resourceName, action.key(), relationship, roles.values());
        }
        return allowed;
    }

    public boolean can(@NonNull RoleMemo role, @NonNull ResourceName resourceName, @NonNull Action action) {
        return can(role, resourceName, action, null, null);
    }

    /**
     * Whether {@code child} on {@code resourceName} may run on behalf of the parent named in
     * the passthrough. Requires the sideload table to list the parent for the child action,
     * and the caller to be allowed the parent's own action.
     */
    public boolean sideload(
            @NonNull RoleMemo role,
            @Nullable SideloadPassthrough passthrough,
            @NonNull ResourceName resourceName,
            @NonNull Action child) {
        if (passthrough == null) {
            return false;
        }
        if (!config.sideloads(resourceName).permits(child, passthrough.parentName())) {
            log.debug("Sideload not permitted: resource={}, action={}, parent={}",
                    resourceName, child.key(), passthrough.parentName());
            return false;
        }
        return can(role, passthrough.parentName(), passthrough.parentAction());
    }
}
