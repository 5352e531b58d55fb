package com.example.jsonapi.registry;

import com.example.jsonapi.resource.ResourceName;
import org.springframework.lang.NonNull;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Role entries of every resource, keyed by canonical name.
 *
 * <p>Entries are created on first reference while the table is mutable. Once frozen, a
 * reference to an unknown resource yields an unrestricted entry without storing it.
 */
public final class RoleTable {

    private volatile Map<ResourceName, ResourceRoles> entries = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    @NonNull
    public ResourceRoles get(@NonNull ResourceName resourceName) {
        if (frozen) {
            ResourceRoles roles = entries.get(resourceName);
            return roles != null ? roles : ResourceRoles.unrestricted(resourceName);
        }
        return entries.computeIfAbsent(resourceName, ResourceRoles::new);
    }

    public boolean contains(@NonNull ResourceName resourceName) {
        return entries.containsKey(resourceName);
    }

    public int size() {
        return entries.size();
    }

    synchronized void freeze() {
        if (frozen) {
            return;
        }
        entries.values().forEach(ResourceRoles::freeze);
        entries = Map.copyOf(entries);
        frozen = true;
    }
}
