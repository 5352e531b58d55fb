package com.example.jsonapi.resource;

import com.example.jsonapi.document.ResourceSerializer;
import com.example.jsonapi.registry.ResourceConfig;
import com.example.jsonapi.registry.ResourceRoles;
import com.example.jsonapi.registry.ResourceSideloads;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Receiver of a resource's declaration body: handlers, filtered index variants,
 * relationships, finder, serializer and role/sideload entries.
 *
 * @param <T> domain type of the resource
 */
public final class ResourceDeclaration<T> {

    private final ResourceName name;
    private final ResourceConfig config;

    private Finder<T> finder;
    private ResourceSerializer<T> serializer;
    private final Map<Action, ActionHandler> handlers = new EnumMap<>(Action.class);
    private final List<FilteredIndex> filteredIndexes = new ArrayList<>();
    private final Map<String, RelationshipDeclaration> relationships = new LinkedHashMap<>();

    ResourceDeclaration(ResourceName name, ResourceConfig config) {
        this.name = name;
        this.config = config;
    }

    public ResourceName name() {
        return name;
    }

    public ResourceDeclaration<T> finder(Finder<T> finder) {
        this.finder = finder;
        return this;
    }

    public ResourceDeclaration<T> serializer(ResourceSerializer<T> serializer) {
        this.serializer = serializer;
        return this;
    }

    public ResourceDeclaration<T> index(ActionHandler handler) {
        return on(Action.INDEX, handler);
    }

    /**
     * Index variant selected when every given {@code filter[key]} is present. Variants are
     * tried in declaration order before the plain index.
     */
    public ResourceDeclaration<T> index(ActionHandler handler, String... filterKeys) {
        if (filterKeys.length == 0) {
            return index(handler);
        }
        filteredIndexes.add(new FilteredIndex(new LinkedHashSet<>(Arrays.asList(filterKeys)), handler));
        return this;
    }

    public ResourceDeclaration<T> show(ActionHandler handler) {
        return on(Action.SHOW, handler);
    }

    public ResourceDeclaration<T> create(ActionHandler handler) {
        return on(Action.CREATE, handler);
    }

    public ResourceDeclaration<T> update(ActionHandler handler) {
        return on(Action.UPDATE, handler);
    }

    public ResourceDeclaration<T> destroy(ActionHandler handler) {
        return on(Action.DESTROY, handler);
    }

    public ResourceDeclaration<T> hasOne(String relationship, String target, Consumer<RelationshipDeclaration> body) {
        return relationship(relationship, RelationType.HAS_ONE, target, body);
    }

    public ResourceDeclaration<T> hasMany(String relationship, String target, Consumer<RelationshipDeclaration> body) {
        return relationship(relationship, RelationType.HAS_MANY, target, body);
    }

    /**
     * Role entry of this resource, for restricting actions in code.
     */
    public ResourceRoles roles() {
        return config.roles(name);
    }

    public ResourceSideloads sideloads() {
        return config.sideloads(name);
    }

    @Nullable
    Finder<T> getFinder() {
        return finder;
    }

    @Nullable
    ResourceSerializer<T> getSerializer() {
        return serializer;
    }

    Map<Action, ActionHandler> getHandlers() {
        return Collections.unmodifiableMap(handlers);
    }

    List<FilteredIndex> getFilteredIndexes() {
        return List.copyOf(filteredIndexes);
    }

    Map<String, RelationshipDeclaration> getRelationships() {
        return Collections.unmodifiableMap(relationships);
    }

    private ResourceDeclaration<T> on(Action action, ActionHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler for '" + action.key() + "' on '" + name + "' must not be null");
        }
        handlers.put(action, handler);
        return this;
    }

    private ResourceDeclaration<T> relationship(
            String relationship, RelationType type, String target, Consumer<RelationshipDeclaration> body) {
        if (relationships.containsKey(relationship)) {
            throw new IllegalArgumentException("Relationship '" + relationship + "' already declared on '" + name + "'");
        }
        RelationshipDeclaration declaration = new RelationshipDeclaration(relationship, type, ResourceName.of(target));
        body.accept(declaration);
        relationships.put(relationship, declaration);
        return this;
    }

    /**
     * Index handler bound to a set of required filter keys.
     */
    public record FilteredIndex(Set<String> filterKeys, ActionHandler handler) {
        public FilteredIndex {
            filterKeys = Set.copyOf(filterKeys);
        }
    }
}
