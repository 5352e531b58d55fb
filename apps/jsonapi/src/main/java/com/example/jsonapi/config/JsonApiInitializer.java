package com.example.jsonapi.config;

import com.example.jsonapi.config.properties.JsonApiProperties;
import com.example.jsonapi.resource.ResourceDefinition;
import com.example.jsonapi.resource.ResourceRegistrar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.List;

/**
 * Startup sequence: configured table entries, then every {@link ResourceDefinition} bean,
 * then freeze. Runs once all singletons exist and before the server accepts requests.
 */
@Slf4j
public class JsonApiInitializer implements SmartInitializingSingleton {

    private final JsonApiProperties properties;
    private final ResourceTableLoader tableLoader;
    private final ResourceRegistrar registrar;
    private final List<ResourceDefinition<?>> definitions;

    public JsonApiInitializer(
            JsonApiProperties properties,
            ResourceTableLoader tableLoader,
            ResourceRegistrar registrar,
            List<ResourceDefinition<?>> definitions) {
        this.properties = properties;
        this.tableLoader = tableLoader;
        this.registrar = registrar;
        this.definitions = definitions;
    }

    @Override
    public void afterSingletonsInstantiated() {
        tableLoader.load(properties.resources());
        definitions.forEach(registrar::declare);
        log.info("Registered {} JSON:API resources: {}", definitions.size(),
                registrar.endpoints().stream().map(e -> e.name().value()).toList());
        if (properties.freezeOnStartup()) {
            registrar.freeze();
        }
    }
}
