package com.example.jsonapi.resource;

import com.example.jsonapi.common.util.StringSanitizer;
import com.example.jsonapi.context.RequestContext;
import com.example.jsonapi.document.ResourceObject;
import com.example.jsonapi.document.ResourceSerializer;
import com.example.jsonapi.exception.NotFoundException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A registered resource: its handlers, relationships, finder and serializer, plus the
 * capabilities bound to its name. Immutable once registered.
 *
 * @param <T> domain type of the resource
 */
public final class ResourceEndpoint<T> implements HandlerLookup {

    private final ResourceName name;
    private final ResourceCapabilities capabilities;
    @Nullable
    private final Finder<T> finder;
    @Nullable
    private final ResourceSerializer<T> serializer;
    private final Map<Action, ActionHandler> handlers;
    private final List<ResourceDeclaration.FilteredIndex> filteredIndexes;
    private final Map<String, RelationshipDeclaration> relationships;

    ResourceEndpoint(ResourceDeclaration<T> declaration, ResourceCapabilities capabilities) {
        this.name = declaration.name();
        this.capabilities = capabilities;
        this.finder = declaration.getFinder();
        this.serializer = declaration.getSerializer();
        Map<Action, ActionHandler> copy = new EnumMap<>(Action.class);
        copy.putAll(declaration.getHandlers());
        this.handlers = Collections.unmodifiableMap(copy);
        this.filteredIndexes = declaration.getFilteredIndexes();
        this.relationships = Collections.unmodifiableMap(new LinkedHashMap<>(declaration.getRelationships()));
    }

    public ResourceName name() {
        return name;
    }

    public ResourceCapabilities capabilities() {
        return capabilities;
    }

    public List<ResourceDeclaration.FilteredIndex> filteredIndexes() {
        return filteredIndexes;
    }

    public Map<String, RelationshipDeclaration> relationships() {
        return relationships;
    }

    @Nullable
    public RelationshipDeclaration relationship(@Nullable String relationship) {
        return relationship == null ? null : relationships.get(relationship);
    }

    @Override
    public boolean hasHandler(Action action, @Nullable String relationship) {
        return handler(action, relationship) != null;
    }

    @Nullable
    public ActionHandler handler(Action action, @Nullable String relationship) {
        if (!action.isRelationshipAction()) {
            return handlers.get(action);
        }
        RelationshipDeclaration declaration = relationship(relationship);
        return declaration != null && declaration.type() == action.relationType()
                ? declaration.handler(action)
                : null;
    }

    /**
     * Lookup hook for {@code /{id}(/...)}: the sideloaded resource if one was passed through,
     * otherwise the finder's result.
     *
     * @throws NotFoundException when neither yields a resource
     */
    public void lookup(@NonNull RequestContext ctx) {
        String id = ctx.getId();
        Object resource;
        if (ctx.getPassthrough() != null) {
            resource = ctx.getPassthrough().resource();
        } else if (finder != null && id != null) {
            resource = finder.find(id).orElse(null);
        } else {
            resource = null;
        }
        if (resource == null) {
            throw new NotFoundException("Resource '" + StringSanitizer.forLog(id) + "' not found");
        }
        ctx.setResource(resource);
    }

    /**
     * Resource object for a domain object of this resource. Objects that are already
     * resource objects pass through.
     */
    @SuppressWarnings("unchecked")
    @NonNull
    public ResourceObject serialize(@NonNull Object resource) {
        if (resource instanceof ResourceObject resourceObject) {
            return resourceObject;
        }
        if (serializer == null) {
            throw new IllegalStateException("No serializer declared for resource '" + name + "'");
        }
        return serializer.serialize(name, (T) resource);
    }

    @Override
    public String toString() {
        return "ResourceEndpoint{" + name + ", actions=" + handlers.keySet() + ", relationships=" + relationships.keySet() + '}';
    }
}
