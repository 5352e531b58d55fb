package com.example.jsonapi.resource;

/**
 * A resource declared as a Spring bean. All definitions are registered at startup, before
 * the resource config is frozen.
 *
 * @param <T> domain type of the resource
 */
public interface ResourceDefinition<T> {

    /**
     * Raw resource name; canonicalized on registration ("BlogPost" serves {@code /blog-posts}).
     */
    String name();

    void declare(ResourceDeclaration<T> resource);
}
