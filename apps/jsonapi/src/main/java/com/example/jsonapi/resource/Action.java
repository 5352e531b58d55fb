package com.example.jsonapi.resource;

import java.util.Locale;

/**
 * Handler responsibilities, distinguished from raw HTTP verbs.
 *
 * <p>The first five apply to the resource itself, the rest to one of its relationships.
 */
public enum Action {

    /** List the collection ({@code GET /posts}). */
    INDEX(false, null),

    /** Read one resource ({@code GET /posts/1}). */
    SHOW(false, null),

    CREATE(true, null),

    UPDATE(true, null),

    DESTROY(true, null),

    /** Read a to-one relationship. */
    PLUCK(false, RelationType.HAS_ONE),

    /** Clear a to-one relationship ({@code PATCH} with {@code "data": null}). */
    PRUNE(true, RelationType.HAS_ONE),

    /** Set a to-one relationship. */
    GRAFT(true, RelationType.HAS_ONE),

    /** Read a to-many relationship. */
    FETCH(false, RelationType.HAS_MANY),

    /** Empty a to-many relationship ({@code PATCH} with {@code "data": []}). */
    CLEAR(true, RelationType.HAS_MANY),

    REPLACE(true, RelationType.HAS_MANY),

    MERGE(true, RelationType.HAS_MANY),

    SUBTRACT(true, RelationType.HAS_MANY);

    private final boolean mutating;
    private final RelationType relationType;

    Action(boolean mutating, RelationType relationType) {
        this.mutating = mutating;
        this.relationType = relationType;
    }

    public boolean isMutating() {
        return mutating;
    }

    public boolean isRelationshipAction() {
        return relationType != null;
    }

    /**
     * Relationship cardinality this action belongs to, or {@code null} for resource actions.
     */
    public RelationType relationType() {
        return relationType;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Action fromKey(String key) {
        return Action.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
