package com.example.jsonapi.registry;

import com.example.jsonapi.resource.ResourceName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

/**
 * Process-wide holder of the role and sideload tables.
 *
 * <p>Populated during startup (from {@code app.jsonapi.resources} and resource
 * declarations), then frozen. There is no way back: after {@link #freeze()} every
 * declaration and table mutation fails with {@link ConfigFrozenException}, and reads are
 * served from immutable maps.
 */
@Slf4j
public class ResourceConfig {

    private final RoleTable roleTable = new RoleTable();
    private final SideloadTable sideloadTable = new SideloadTable();

    private volatile boolean frozen;

    @NonNull
    public RoleTable roleTable() {
        return roleTable;
    }

    @NonNull
    public SideloadTable sideloadTable() {
        return sideloadTable;
    }

    /**
     * Role entry for a resource, created on first reference.
     */
    @NonNull
    public ResourceRoles roles(@NonNull ResourceName resourceName) {
        return roleTable.get(resourceName);
    }

    /**
     * Sideload entry for a resource, created on first reference.
     */
    @NonNull
    public ResourceSideloads sideloads(@NonNull ResourceName resourceName) {
        return sideloadTable.get(resourceName);
    }

    public synchronized void freeze() {
        if (frozen) {
            return;
        }
        roleTable.freeze();
        sideloadTable.freeze();
        frozen = true;
        log.info("Resource config frozen: {} resource role entries", roleTable.size());
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Fail loudly if the config no longer accepts changes.
     */
    public void ensureMutable(@NonNull String operation) {
        if (frozen) {
            throw new ConfigFrozenException("Resource config is frozen; cannot " + operation);
        }
    }
}
