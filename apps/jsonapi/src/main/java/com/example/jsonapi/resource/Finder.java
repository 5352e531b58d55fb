package com.example.jsonapi.resource;

import java.util.Optional;

/**
 * Loads a resource by id for {@code /{id}} paths.
 *
 * @param <T> domain type of the resource
 */
@FunctionalInterface
public interface Finder<T> {

    Optional<T> find(String id);
}
