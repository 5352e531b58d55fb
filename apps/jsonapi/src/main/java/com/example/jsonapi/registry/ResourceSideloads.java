package com.example.jsonapi.registry;

import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.ResourceName;
import org.springframework.lang.NonNull;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Sideload entries of a single resource: which parent resources may embed each of its actions.
 */
public final class ResourceSideloads {

    private final ResourceName resourceName;

    private volatile boolean frozen;
    private volatile Map<Action, Set<ResourceName>> parents = new EnumMap<>(Action.class);

    ResourceSideloads(ResourceName resourceName) {
        this.resourceName = resourceName;
    }

    static ResourceSideloads empty(ResourceName resourceName) {
        ResourceSideloads sideloads = new ResourceSideloads(resourceName);
        sideloads.freeze();
        return sideloads;
    }

    public ResourceName resourceName() {
        return resourceName;
    }

    /**
     * Allow {@code child} to be performed on behalf of each given parent resource.
     */
    public synchronized ResourceSideloads allow(@NonNull Action child, @NonNull ResourceName... parentNames) {
        if (frozen) {
            throw new ConfigFrozenException("Sideload table for '" + resourceName + "' is frozen");
        }
        parents.computeIfAbsent(child, a -> new HashSet<>()).addAll(Arrays.asList(parentNames));
        return this;
    }

    public ResourceSideloads allow(@NonNull Action child, @NonNull String... rawParentNames) {
        return allow(child, Arrays.stream(rawParentNames).map(ResourceName::of).toArray(ResourceName[]::new));
    }

    @NonNull
    public Set<ResourceName> parentsOf(@NonNull Action child) {
        return parents.getOrDefault(child, Set.of());
    }

    public boolean permits(@NonNull Action child, @NonNull ResourceName parent) {
        return parentsOf(child).contains(parent);
    }

    public boolean isFrozen() {
        return frozen;
    }

    synchronized void freeze() {
        if (frozen) {
            return;
        }
        Map<Action, Set<ResourceName>> copy = new EnumMap<>(Action.class);
        parents.forEach((action, names) -> copy.put(action, Set.copyOf(names)));
        parents = copy.isEmpty() ? Map.of() : Map.copyOf(copy);
        frozen = true;
    }

    @Override
    public String toString() {
        return "ResourceSideloads{parents=" + parents + '}';
    }
}
