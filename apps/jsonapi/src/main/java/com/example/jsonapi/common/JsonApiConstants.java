package com.example.jsonapi.common;

import java.util.List;

/**
 * Shared constants for the JSON:API layer.
 * Centralizes the wire-level strings so the lifecycle, dispatcher and web adapter agree.
 */
public final class JsonApiConstants {

    private JsonApiConstants() {}

    // Document media type required on Accept and Content-Type
    public static final String MEDIA_TYPE = "application/vnd.api+json";

    public static final String JSONAPI_VERSION = "1.1";

    // Standard query parameter groups
    public static final String FIELDS = "fields";
    public static final String INCLUDE = "include";
    public static final String FILTER = "filter";
    public static final String PAGE = "page";
    public static final String SORT = "sort";

    public static final List<String> QUERY_GROUPS = List.of(FIELDS, INCLUDE, FILTER, PAGE, SORT);

    // Path segment that introduces relationship linkage endpoints
    public static final String RELATIONSHIPS_SEGMENT = "relationships";

    // Role matching every identified caller
    public static final String ANY_ROLE = "*";
}
