package com.example.jsonapi.dispatch;

/**
 * How a route's logical result becomes primary data.
 */
public enum Rendering {

    /** Resource objects of the addressed resource. */
    RESOURCE,

    /** Resource identifiers of the relationship's target. */
    LINKAGE,

    /** Full resource objects of the relationship's target. */
    RELATED
}
