package com.example.jsonapi.resource;

import java.util.Locale;

/**
 * Cardinality of a relationship between two resources.
 */
public enum RelationType {

    HAS_ONE,

    HAS_MANY;

    /**
     * Parses "has-one", "has_one" or "hasOne".
     */
    public static RelationType fromKey(String key) {
        String normalized = key.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        return RelationType.valueOf(normalized);
    }
}
