package com.example.jsonapi.resource;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Handlers of one relationship. To-one relationships take {@code pluck}, {@code prune} and
 * {@code graft}; to-many take {@code fetch}, {@code clear}, {@code replace}, {@code merge}
 * and {@code subtract}.
 */
public final class RelationshipDeclaration {

    private final String name;
    private final RelationType type;
    private final ResourceName target;
    private final Map<Action, ActionHandler> handlers = new EnumMap<>(Action.class);

    RelationshipDeclaration(String name, RelationType type, ResourceName target) {
        this.name = name;
        this.type = type;
        this.target = target;
    }

    public String name() {
        return name;
    }

    public RelationType type() {
        return type;
    }

    public ResourceName target() {
        return target;
    }

    public RelationshipDeclaration pluck(ActionHandler handler) {
        return on(Action.PLUCK, handler);
    }

    public RelationshipDeclaration prune(ActionHandler handler) {
        return on(Action.PRUNE, handler);
    }

    public RelationshipDeclaration graft(ActionHandler handler) {
        return on(Action.GRAFT, handler);
    }

    public RelationshipDeclaration fetch(ActionHandler handler) {
        return on(Action.FETCH, handler);
    }

    public RelationshipDeclaration clear(ActionHandler handler) {
        return on(Action.CLEAR, handler);
    }

    public RelationshipDeclaration replace(ActionHandler handler) {
        return on(Action.REPLACE, handler);
    }

    public RelationshipDeclaration merge(ActionHandler handler) {
        return on(Action.MERGE, handler);
    }

    public RelationshipDeclaration subtract(ActionHandler handler) {
        return on(Action.SUBTRACT, handler);
    }

    /**
     * The read action of this relationship: {@code pluck} or {@code fetch}.
     */
    public Action readAction() {
        return type == RelationType.HAS_ONE ? Action.PLUCK : Action.FETCH;
    }

    @Nullable
    public ActionHandler handler(Action action) {
        return handlers.get(action);
    }

    public boolean hasHandler(Action action) {
        return handlers.containsKey(action);
    }

    public Map<Action, ActionHandler> handlers() {
        return Collections.unmodifiableMap(handlers);
    }

    private RelationshipDeclaration on(Action action, ActionHandler handler) {
        if (action.relationType() != type) {
            throw new IllegalArgumentException(
                    "Action '" + action.key() + "' does not apply to " + type + " relationship '" + name + "'");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler for '" + action.key() + "' on '" + name + "' must not be null");
        }
        handlers.put(action, handler);
        return this;
    }
}
