package com.example.jsonapi.dispatch;

import com.example.jsonapi.context.RequestContext;
import com.example.jsonapi.exception.ForbiddenException;
import com.example.jsonapi.exception.JsonApiException;
import com.example.jsonapi.exception.MethodNotAllowedException;
import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.HandlerLookup;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.function.Predicate;

/**
 * Guard constructors for route tables.
 */
public final class Guards {

    private Guards() {}

    /**
     * For each action: the caller must be allowed it, directly or through a sideload, and a
     * handler must be registered. Authorization is checked first, so an unauthorized caller
     * gets 403 even where no handler exists.
     */
    public static Guard actions(HandlerLookup handlers, Action... actions) {
        List<Action> required = List.of(actions);
        return ctx -> {
            for (Action action : required) {
                boolean allowed = ctx.can(action, action.relationType(), ctx.getRelationship())
                        || ctx.sideload(action);
                if (!allowed) {
                    return GuardResult.fail(new ForbiddenException());
                }
                if (!handlers.hasHandler(action, ctx.getRelationship())) {
                    return GuardResult.fail(new MethodNotAllowedException());
                }
            }
            return GuardResult.PASS;
        };
    }

    /**
     * Every key must be present in the {@code filter} query group.
     */
    public static Guard pfilters(String... keys) {
        List<String> required = List.of(keys);
        return ctx -> required.stream().allMatch(ctx.getParams()::hasFilter)
                ? GuardResult.PASS
                : GuardResult.fail();
    }

    /**
     * Predicate over the payload's {@code data} member. A payload that cannot be read fails
     * the guard with the read error.
     */
    public static Guard nullif(Predicate<JsonNode> predicate) {
        return ctx -> {
            JsonNode data;
            try {
                data = ctx.data();
            } catch (JsonApiException e) {
                return GuardResult.fail(e);
            }
            return predicate.test(data) ? GuardResult.PASS : GuardResult.fail();
        };
    }

    /**
     * Evaluate guards in order, stopping at the first failure.
     */
    static GuardResult all(List<Guard> guards, RequestContext ctx) {
        for (Guard guard : guards) {
            GuardResult result = guard.evaluate(ctx);
            if (!result.passed()) {
                return result;
            }
        }
        return GuardResult.PASS;
    }
}
