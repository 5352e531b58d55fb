package com.example.jsonapi.resource;

import com.example.jsonapi.authz.ResourceAuthorizer;
import com.example.jsonapi.dispatch.RouteTable;
import com.example.jsonapi.lifecycle.SanityChecker;
import com.example.jsonapi.registry.ConfigFrozenException;
import com.example.jsonapi.registry.ResourceConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Declares resources against a {@link ResourceConfig}.
 *
 * <p>Declaring a resource canonicalizes its name, forces its role and sideload entries,
 * binds the {@code can}/{@code sanityCheck}/{@code sideload} capabilities to the name,
 * evaluates the body and builds the resource's route table. Declarations are only accepted
 * before the config is frozen.
 */
@Slf4j
public class ResourceRegistrar {

    private final ResourceConfig config;
    private final ResourceAuthorizer authorizer;
    private final SanityChecker sanityChecker;

    private final Map<ResourceName, ResourceEndpoint<?>> endpoints = new ConcurrentHashMap<>();
    private final Map<ResourceName, RouteTable> routeTables = new ConcurrentHashMap<>();

    public ResourceRegistrar(ResourceConfig config, ResourceAuthorizer authorizer, SanityChecker sanityChecker) {
        this.config = config;
        this.authorizer = authorizer;
        this.sanityChecker = sanityChecker;
    }

    public synchronized <T> ResourceEndpoint<T> declare(String rawName, Consumer<ResourceDeclaration<T>> body) {
        if (body == null) {
            throw new IllegalArgumentException("Must supply a declaration body for resource '" + rawName + "'");
        }
        config.ensureMutable("declare resource '" + rawName + "'");
        ResourceName name = ResourceName.of(rawName);
        if (endpoints.containsKey(name)) {
            throw new ConfigFrozenException("Resource '" + name + "' is already declared");
        }

        config.roles(name);
        config.sideloads(name);
        ResourceCapabilities capabilities = new ResourceCapabilities(name, authorizer, sanityChecker);

        ResourceDeclaration<T> declaration = new ResourceDeclaration<>(name, config);
        body.accept(declaration);

        ResourceEndpoint<T> endpoint = new ResourceEndpoint<>(declaration, capabilities);
        endpoints.put(name, endpoint);
        routeTables.put(name, RouteTable.forEndpoint(endpoint));
        log.info("Declared resource: name={}, endpoint={}", name, endpoint);
        return endpoint;
    }

    public <T> ResourceEndpoint<T> declare(ResourceDefinition<T> definition) {
        if (definition == null) {
            throw new IllegalArgumentException("Must supply a resource definition");
        }
        return declare(definition.name(), definition::declare);
    }

    @Nullable
    public ResourceEndpoint<?> endpoint(@NonNull ResourceName name) {
        return endpoints.get(name);
    }

    @Nullable
    public RouteTable routes(@NonNull ResourceName name) {
        return routeTables.get(name);
    }

    public List<ResourceEndpoint<?>> endpoints() {
        return endpoints.values().stream()
                .sorted(Comparator.<ResourceEndpoint<?>, ResourceName>comparing(ResourceEndpoint::name))
                .toList();
    }

    /**
     * Freeze the config. Relationships pointing at undeclared resources are reported, since
     * they cannot be rendered or included.
     */
    public synchronized void freeze() {
        endpoints.values().forEach(endpoint -> endpoint.relationships().values().forEach(rel -> {
            if (!endpoints.containsKey(rel.target())) {
                log.warn("Relationship {}.{} targets undeclared resource '{}'", endpoint.name(), rel.name(), rel.target());
            }
        }));
        config.freeze();
    }
}
