package com.example.jsonapi.document;

import com.example.jsonapi.resource.ResourceName;

/**
 * Turns a domain object of one resource into its resource object.
 *
 * @param <T> domain type of the resource
 */
@FunctionalInterface
public interface ResourceSerializer<T> {

    ResourceObject serialize(ResourceName type, T resource);
}
