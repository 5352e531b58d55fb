package com.example.jsonapi.document;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Relationship member of a resource object.
 *
 * @param data a {@link ResourceIdentifier}, a list of them, or {@code null} for an empty to-one
 */
public record Relationship(@JsonInclude(JsonInclude.Include.ALWAYS) Object data) {

    public static Relationship toOne(String type, String id) {
        return new Relationship(id == null ? null : new ResourceIdentifier(type, id));
    }

    public static Relationship toMany(String type, List<String> ids) {
        return new Relationship(ids.stream().map(id -> new ResourceIdentifier(type, id)).toList());
    }
}
