package com.example.jsonapi.dispatch;

import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.RelationType;
import com.example.jsonapi.resource.ResourceDeclaration;
import com.example.jsonapi.resource.ResourceEndpoint;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered route chain of one resource. Within a path shape and method, earlier routes win.
 */
public final class RouteTable {

    private final List<Route> routes;

    private RouteTable(List<Route> routes) {
        this.routes = List.copyOf(routes);
    }

    public static RouteTable forEndpoint(ResourceEndpoint<?> endpoint) {
        List<Route> routes = new ArrayList<>();

        for (ResourceDeclaration.FilteredIndex variant : endpoint.filteredIndexes()) {
            routes.add(new Route(HttpMethod.GET, PathTemplate.COLLECTION,
                    List.of(Guards.pfilters(variant.filterKeys().toArray(String[]::new)),
                            Guards.actions((action, rel) -> true, Action.INDEX)),
                    Action.INDEX, Rendering.RESOURCE, variant.handler()));
        }
        routes.add(route(endpoint, HttpMethod.GET, PathTemplate.COLLECTION, Action.INDEX, Rendering.RESOURCE));
        routes.add(route(endpoint, HttpMethod.POST, PathTemplate.COLLECTION, Action.CREATE, Rendering.RESOURCE));

        routes.add(route(endpoint, HttpMethod.GET, PathTemplate.MEMBER, Action.SHOW, Rendering.RESOURCE));
        routes.add(route(endpoint, HttpMethod.PATCH, PathTemplate.MEMBER, Action.UPDATE, Rendering.RESOURCE));
        routes.add(route(endpoint, HttpMethod.DELETE, PathTemplate.MEMBER, Action.DESTROY, Rendering.RESOURCE));

        routes.add(route(endpoint, HttpMethod.GET, PathTemplate.RELATIONSHIP, Action.PLUCK, Rendering.LINKAGE));
        routes.add(route(endpoint, HttpMethod.PATCH, PathTemplate.RELATIONSHIP, Action.PRUNE, Rendering.LINKAGE,
                Guards.nullif(JsonNode::isNull)));
        routes.add(route(endpoint, HttpMethod.PATCH, PathTemplate.RELATIONSHIP, Action.GRAFT, Rendering.LINKAGE,
                Guards.nullif(data -> !data.isNull())));

        routes.add(route(endpoint, HttpMethod.GET, PathTemplate.RELATIONSHIP, Action.FETCH, Rendering.LINKAGE));
        routes.add(route(endpoint, HttpMethod.PATCH, PathTemplate.RELATIONSHIP, Action.CLEAR, Rendering.LINKAGE,
                Guards.nullif(data -> data.isArray() && data.isEmpty())));
        routes.add(route(endpoint, HttpMethod.PATCH, PathTemplate.RELATIONSHIP, Action.REPLACE, Rendering.LINKAGE));
        routes.add(route(endpoint, HttpMethod.POST, PathTemplate.RELATIONSHIP, Action.MERGE, Rendering.LINKAGE));
        routes.add(route(endpoint, HttpMethod.DELETE, PathTemplate.RELATIONSHIP, Action.SUBTRACT, Rendering.LINKAGE));

        routes.add(route(endpoint, HttpMethod.GET, PathTemplate.RELATED, Action.PLUCK, Rendering.RELATED));
        routes.add(route(endpoint, HttpMethod.GET, PathTemplate.RELATED, Action.FETCH, Rendering.RELATED));

        return new RouteTable(routes);
    }

    /**
     * Routes for a path shape. For relationship paths only routes whose action applies to
     * the relationship's cardinality are kept.
     */
    public List<Route> candidates(PathTemplate template, RelationType relationType) {
        return routes.stream()
                .filter(route -> route.template() == template)
                .filter(route -> !template.hasRelationship()
                        || Objects.equals(route.action().relationType(), relationType))
                .toList();
    }

    private static Route route(
            ResourceEndpoint<?> endpoint,
            HttpMethod method,
            PathTemplate template,
            Action action,
            Rendering rendering,
            Guard... filters) {
        List<Guard> guards = new ArrayList<>(List.of(filters));
        guards.add(Guards.actions(endpoint, action));
        return new Route(method, template, guards, action, rendering, null);
    }
}
