package com.example.jsonapi.registry;

import com.example.jsonapi.resource.ResourceName;
import org.springframework.lang.NonNull;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sideload entries of every resource, keyed by canonical name. Same lifecycle as {@link RoleTable}.
 */
public final class SideloadTable {

    private volatile Map<ResourceName, ResourceSideloads> entries = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    @NonNull
    public ResourceSideloads get(@NonNull ResourceName resourceName) {
        if (frozen) {
            ResourceSideloads sideloads = entries.get(resourceName);
            return sideloads != null ? sideloads : ResourceSideloads.empty(resourceName);
        }
        return entries.computeIfAbsent(resourceName, ResourceSideloads::new);
    }

    public boolean contains(@NonNull ResourceName resourceName) {
        return entries.containsKey(resourceName);
    }

    synchronized void freeze() {
        if (frozen) {
            return;
        }
        entries.values().forEach(ResourceSideloads::freeze);
        entries = Map.copyOf(entries);
        frozen = true;
    }
}
