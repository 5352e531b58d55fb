package com.example.jsonapi.resource;

import com.example.jsonapi.context.RequestContext;
import com.example.jsonapi.document.HandlerResult;

/**
 * Handler for one action of a resource or relationship.
 */
@FunctionalInterface
public interface ActionHandler {

    HandlerResult handle(RequestContext ctx);
}
