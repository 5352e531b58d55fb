package com.example.jsonapi.registry;

import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.RelationType;
import com.example.jsonapi.resource.ResourceName;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Role entries of a single resource.
 *
 * <p>Two levels: a resource table ({@code Action -> Roles}) and a relationship table
 * ({@code RelationType -> relationship name -> Action -> Roles}). Absent entries are
 * unrestricted. Mutable until frozen; frozen instances are backed by immutable maps and may
 * be read concurrently without locking.
 */
public final class ResourceRoles {

    private final ResourceName resourceName;

    private volatile boolean frozen;
    private volatile Map<Action, Roles> resource = new EnumMap<>(Action.class);
    private volatile Map<RelationType, Map<String, Map<Action, Roles>>> relationships = new EnumMap<>(RelationType.class);

    ResourceRoles(ResourceName resourceName) {
        this.resourceName = resourceName;
    }

    static ResourceRoles unrestricted(ResourceName resourceName) {
        ResourceRoles roles = new ResourceRoles(resourceName);
        roles.freeze();
        return roles;
    }

    public ResourceName resourceName() {
        return resourceName;
    }

    /**
     * Restrict a resource action to the given roles. An empty list lifts the restriction.
     */
    public synchronized ResourceRoles permit(@NonNull Action action, @NonNull Roles roles) {
        ensureMutable();
        resource.put(action, roles);
        return this;
    }

    public ResourceRoles permit(@NonNull Action action, String... roles) {
        return permit(action, Roles.of(roles));
    }

    /**
     * Restrict an action on one relationship of this resource.
     */
    public synchronized ResourceRoles permit(
            @NonNull RelationType type,
            @NonNull String relationship,
            @NonNull Action action,
            @NonNull Roles roles) {
        ensureMutable();
        relationships.computeIfAbsent(type, t -> new HashMap<>())
                .computeIfAbsent(relationship, r -> new EnumMap<>(Action.class))
                .put(action, roles);
        return this;
    }

    @NonNull
    public Roles resource(@NonNull Action action) {
        return resource.getOrDefault(action, Roles.UNRESTRICTED);
    }

    /**
     * Relationship entry when both type and name are given and an entry exists,
     * otherwise the resource-level entry for the same action.
     */
    @NonNull
    public Roles lookup(@NonNull Action action, @Nullable RelationType type, @Nullable String relationship) {
        if (type != null && relationship != null) {
            Roles roles = relationships.getOrDefault(type, Map.of())
                    .getOrDefault(relationship, Map.of())
                    .get(action);
            if (roles != null) {
                return roles;
            }
        }
        return resource(action);
    }

    public boolean isFrozen() {
        return frozen;
    }

    synchronized void freeze() {
        if (frozen) {
            return;
        }
        resource = resource.isEmpty() ? Map.of() : Map.copyOf(resource);
        Map<RelationType, Map<String, Map<Action, Roles>>> copy = new EnumMap<>(RelationType.class);
        relationships.forEach((type, byName) -> {
            Map<String, Map<Action, Roles>> names = new HashMap<>();
            byName.forEach((name, byAction) -> names.put(name, Map.copyOf(byAction)));
            copy.put(type, Map.copyOf(names));
        });
        relationships = copy.isEmpty() ? Map.of() : Map.copyOf(copy);
        frozen = true;
    }

    private void ensureMutable() {
        if (frozen) {
            throw new ConfigFrozenException("Role table for '" + resourceName + "' is frozen");
        }
    }

    @Override
    public String toString() {
        return "ResourceRoles{" +
                "resource=" + resource +
                ", relationships=" + relationships +
                '}';
    }
}
