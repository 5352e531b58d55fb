package com.example.jsonapi.config;

import com.example.jsonapi.config.properties.JsonApiProperties;
import com.example.jsonapi.registry.ResourceConfig;
import com.example.jsonapi.registry.ResourceRoles;
import com.example.jsonapi.registry.Roles;
import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.RelationType;
import com.example.jsonapi.resource.ResourceName;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Populates the role and sideload tables from {@code app.jsonapi.resources}.
 *
 * <pre>
 * app.jsonapi.resources:
 *   posts:
 *     roles:
 *       destroy: [admin]
 *     has-one:
 *       author:
 *         graft: [admin]
 *   people:
 *     sideload:
 *       show: [posts]
 * </pre>
 */
@Slf4j
public class ResourceTableLoader {

    private final ResourceConfig config;

    public ResourceTableLoader(ResourceConfig config) {
        this.config = config;
    }

    public void load(Map<String, JsonApiProperties.ResourceProperties> resources) {
        resources.forEach((rawName, properties) -> {
            ResourceName name = ResourceName.of(rawName);
            ResourceRoles roles = config.roles(name);
            properties.roles().forEach((action, allowed) ->
                    roles.permit(action(name, action), Roles.of(allowed)));
            loadRelationships(roles, RelationType.HAS_ONE, properties.hasOne());
            loadRelationships(roles, RelationType.HAS_MANY, properties.hasMany());
            properties.sideload().forEach((action, parents) ->
                    config.sideloads(name).allow(action(name, action), parents.toArray(String[]::new)));
            log.debug("Loaded table entries: resource={}, roles={}, sideloads={}",
                    name, roles, config.sideloads(name));
        });
        log.info("Loaded role and sideload entries for {} resources from configuration", resources.size());
    }

    private void loadRelationships(
            ResourceRoles roles, RelationType type, Map<String, Map<String, List<String>>> relationships) {
        relationships.forEach((relationship, byAction) -> byAction.forEach((action, allowed) -> {
            Action parsed = action(roles.resourceName(), action);
            if (parsed.relationType() != type) {
                throw new IllegalArgumentException("Action '" + action + "' does not apply to " + type
                        + " relationship " + roles.resourceName() + "." + relationship);
            }
            roles.permit(type, relationship, parsed, Roles.of(allowed));
        }));
    }

    private static Action action(ResourceName name, String key) {
        try {
            return Action.fromKey(key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action '" + key + "' configured for resource '" + name + "'", e);
        }
    }
}
