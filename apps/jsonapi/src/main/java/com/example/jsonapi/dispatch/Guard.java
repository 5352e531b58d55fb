package com.example.jsonapi.dispatch;

import com.example.jsonapi.context.RequestContext;

/**
 * Route precondition. Evaluation reports failure through {@link GuardResult} rather than
 * by throwing.
 */
@FunctionalInterface
public interface Guard {

    GuardResult evaluate(RequestContext ctx);
}
