package com.example.jsonapi.dispatch;

import com.example.jsonapi.authz.RoleResolver;
import com.example.jsonapi.common.util.StringSanitizer;
import com.example.jsonapi.context.JsonApiRequest;
import com.example.jsonapi.context.JsonApiResponse;
import com.example.jsonapi.context.QueryParameters;
import com.example.jsonapi.context.RequestContext;
import com.example.jsonapi.context.RoleMemo;
import com.example.jsonapi.context.SideloadPassthrough;
import com.example.jsonapi.document.HandlerResult;
import com.example.jsonapi.document.ResourceIdentifier;
import com.example.jsonapi.document.ResourceObject;
import com.example.jsonapi.document.SuccessDocument;
import com.example.jsonapi.exception.BadRequestException;
import com.example.jsonapi.exception.JsonApiException;
import com.example.jsonapi.exception.MethodNotAllowedException;
import com.example.jsonapi.exception.NotFoundException;
import com.example.jsonapi.lifecycle.PayloadReader;
import com.example.jsonapi.lifecycle.RequestLifecycle;
import com.example.jsonapi.lifecycle.TransactionHook;
import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.ActionHandler;
import com.example.jsonapi.resource.RelationType;
import com.example.jsonapi.resource.RelationshipDeclaration;
import com.example.jsonapi.resource.ResourceEndpoint;
import com.example.jsonapi.resource.ResourceName;
import com.example.jsonapi.resource.ResourceRegistrar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Runs one JSON:API request through the lifecycle and the resource's route chain.
 *
 * <h3>Flow:</h3>
 * <ol>
 *   <li>Before hook: negotiation (client requests only) and query normalization</li>
 *   <li>Resource lookup for paths with an id segment</li>
 *   <li>Route chain: the first route for the method whose guards all pass runs; if none
 *       passes, the error carried by the last failing route is raised, else 404</li>
 *   <li>Mutating actions run inside the transaction hook</li>
 *   <li>After hook: success document, including resources requested through {@code include}</li>
 * </ol>
 *
 * <p>{@link #handle} is the catch-all: every fault becomes an error document. Nested
 * sideload executions let faults propagate to the request that spawned them.
 */
@Slf4j
public class JsonApiDispatcher {

    private final ResourceRegistrar registrar;
    private final RequestLifecycle lifecycle;
    private final RoleResolver roleResolver;
    private final PayloadReader payloadReader;
    private final TransactionHook transactionHook;

    public JsonApiDispatcher(
            ResourceRegistrar registrar,
            RequestLifecycle lifecycle,
            RoleResolver roleResolver,
            PayloadReader payloadReader,
            TransactionHook transactionHook) {
        this.registrar = registrar;
        this.lifecycle = lifecycle;
        this.roleResolver = roleResolver;
        this.payloadReader = payloadReader;
        this.transactionHook = transactionHook;
    }

    @NonNull
    public JsonApiResponse handle(@NonNull JsonApiRequest request) {
        try {
            RoleMemo role = new RoleMemo(() -> roleResolver.resolve(request));
            Execution execution = execute(request, role, null);
            return lifecycle.after(execution.ctx(), execution.result(), result -> render(execution));
        } catch (RuntimeException e) {
            return lifecycle.error(e);
        }
    }

    /**
     * Execute without the catch-all. Used directly for nested sideload requests, which share
     * the caller's role memo.
     */
    @NonNull
    Execution execute(@NonNull JsonApiRequest request, @NonNull RoleMemo role, @Nullable SideloadPassthrough passthrough) {
        List<String> segments = request.segments();
        if (segments.isEmpty()) {
            throw new NotFoundException();
        }
        ResourceName name = new ResourceName(segments.get(0));
        ResourceEndpoint<?> endpoint = registrar.endpoint(name);
        RouteTable routeTable = registrar.routes(name);
        if (endpoint == null || routeTable == null) {
            throw new NotFoundException();
        }

        QueryParameters params = lifecycle.before(request, passthrough != null);
        RequestContext ctx = RequestContext.builder()
                .request(request)
                .resourceName(name)
                .capabilities(endpoint.capabilities())
                .params(params)
                .roleMemo(role)
                .passthrough(passthrough)
                .payloadReader(payloadReader)
                .transactionHook(transactionHook)
                .build();

        PathTemplate.Match match = PathTemplate.match(segments.subList(1, segments.size()))
                .orElseThrow(NotFoundException::new);
        ctx.bindPath(match.id(), match.relationship());
        if (match.id() != null) {
            endpoint.lookup(ctx);
        }

        RelationType relationType = null;
        if (match.template().hasRelationship()) {
            RelationshipDeclaration relationship = endpoint.relationship(match.relationship());
            if (relationship == null) {
                throw new NotFoundException("Relationship '" + StringSanitizer.forLog(match.relationship()) + "' not found");
            }
            relationType = relationship.type();
        }

        List<Route> candidates = routeTable.candidates(match.template(), relationType);
        List<Route> forMethod = candidates.stream()
                .filter(route -> route.method().equals(request.method()))
                .toList();
        if (forMethod.isEmpty()) {
            throw new MethodNotAllowedException(MethodNotAllowedException.DEFAULT_DETAIL, allowedMethods(candidates, endpoint, ctx));
        }

        JsonApiException carried = null;
        for (Route route : forMethod) {
            GuardResult guards = Guards.all(route.guards(), ctx);
            if (guards.passed()) {
                log.debug("Dispatching: resource={}, action={}, sideload={}", name, route.action().key(), ctx.isSideload());
                return new Execution(ctx, endpoint, route, run(route, endpoint, ctx));
            }
            if (guards.error() != null) {
                carried = guards.error();
            }
        }
        if (carried instanceof MethodNotAllowedException) {
            throw new MethodNotAllowedException(carried.getMessage(), allowedMethods(candidates, endpoint, ctx));
        }
        throw carried != null ? carried : new NotFoundException();
    }

    private HandlerResult run(Route route, ResourceEndpoint<?> endpoint, RequestContext ctx) {
        ActionHandler handler = route.handler() != null
                ? route.handler()
                : endpoint.handler(route.action(), ctx.getRelationship());
        if (handler == null) {
            throw new MethodNotAllowedException();
        }
        HandlerResult result = route.action().isMutating()
                ? ctx.transaction(() -> handler.handle(ctx))
                : handler.handle(ctx);
        if (result == null) {
            throw new IllegalStateException("Handler for " + ctx.getResourceName() + "." + route.action().key() + " returned no result");
        }
        return result;
    }

    private Set<String> allowedMethods(List<Route> candidates, ResourceEndpoint<?> endpoint, RequestContext ctx) {
        Set<String> allowed = new TreeSet<>();
        for (Route route : candidates) {
            if (route.handler() != null || endpoint.hasHandler(route.action(), ctx.getRelationship())) {
                allowed.add(route.method().name());
            }
        }
        return allowed;
    }

    // ----- rendering -----

    private SuccessDocument render(Execution execution) {
        Object data = primaryData(execution);
        List<ResourceObject> included = List.of();
        List<String> include = execution.ctx().getParams().include();
        if (!include.isEmpty()
                && execution.route().rendering() == Rendering.RESOURCE
                && HttpMethod.GET.equals(execution.ctx().getRequest().method())) {
            included = include(execution, include);
        }
        return new SuccessDocument(data, included, execution.result().meta());
    }

    @Nullable
    private Object primaryData(Execution execution) {
        Object data = execution.result().data();
        if (data == null) {
            return null;
        }
        RequestContext ctx = execution.ctx();
        ResourceEndpoint<?> endpoint = switch (execution.route().rendering()) {
            case RESOURCE -> execution.endpoint();
            case LINKAGE, RELATED -> targetOf(execution.endpoint(), ctx.getRelationship());
        };
        if (data instanceof Collection<?> collection) {
            return collection.stream().map(item -> renderOne(item, endpoint, execution.route().rendering(), ctx)).toList();
        }
        return renderOne(data, endpoint, execution.route().rendering(), ctx);
    }

    private Object renderOne(Object item, ResourceEndpoint<?> endpoint, Rendering rendering, RequestContext ctx) {
        if (item instanceof ResourceIdentifier) {
            return item;
        }
        ResourceObject object = endpoint.serialize(item);
        return rendering == Rendering.LINKAGE
                ? object.identifier()
                : object.withFields(ctx.getParams().fieldsFor(object.type()));
    }

    private ResourceEndpoint<?> targetOf(ResourceEndpoint<?> endpoint, @Nullable String relationship) {
        RelationshipDeclaration declaration = endpoint.relationship(relationship);
        if (declaration == null) {
            throw new NotFoundException("Relationship '" + StringSanitizer.forLog(relationship) + "' not found");
        }
        ResourceEndpoint<?> target = registrar.endpoint(declaration.target());
        if (target == null) {
            throw new IllegalStateException("Relationship " + endpoint.name() + "." + relationship
                    + " targets undeclared resource '" + declaration.target() + "'");
        }
        return target;
    }

    /**
     * Resolve each included relationship through its read handler, then fetch every related
     * record through the target's own {@code show} route as a sideload of this request.
     * Dotted paths repeat this from the fetched records. A target without a {@code show}
     * handler is serialized as returned by the relationship. Primary data is never repeated.
     */
    private List<ResourceObject> include(Execution execution, List<String> include) {
        IncludeTree tree = IncludeTree.parse(include);
        checkIncludable(execution.endpoint(), tree, "");

        RequestContext ctx = execution.ctx();
        Object data = execution.result().data();
        if (data == null) {
            return List.of();
        }
        Collection<?> primaries = data instanceof Collection<?> collection ? collection : List.of(data);
        List<Member> members = primaries.stream()
                .map(primary -> new Member(ctx, execution.endpoint(), execution.route().action(), primary))
                .toList();

        Set<ResourceIdentifier> primaryIds = members.stream()
                .map(member -> member.endpoint().serialize(member.resource()).identifier())
                .collect(Collectors.toSet());
        Map<ResourceIdentifier, ResourceObject> included = new LinkedHashMap<>();
        collect(members, tree, ctx.getParams(), primaryIds, included);
        return new ArrayList<>(included.values());
    }

    private void checkIncludable(ResourceEndpoint<?> endpoint, IncludeTree tree, String prefix) {
        for (Map.Entry<String, IncludeTree> child : tree.children().entrySet()) {
            String path = prefix + child.getKey();
            if (endpoint.relationship(child.getKey()) == null) {
                throw new BadRequestException("Unknown relationship '" + StringSanitizer.forLog(path) + "' in include");
            }
            if (!child.getValue().isEmpty()) {
                checkIncludable(targetOf(endpoint, child.getKey()), child.getValue(), path + ".");
            }
        }
    }

    private void collect(List<Member> members, IncludeTree tree, QueryParameters params,
                         Set<ResourceIdentifier> primary, Map<ResourceIdentifier, ResourceObject> included) {
        for (Map.Entry<String, IncludeTree> child : tree.children().entrySet()) {
            List<Member> next = new ArrayList<>();
            for (Member member : members) {
                RelationshipDeclaration relationship = member.endpoint().relationship(child.getKey());
                ResourceEndpoint<?> target = targetOf(member.endpoint(), child.getKey());
                for (Object related : related(member, relationship)) {
                    Member loaded = sideload(member, target, related);
                    ResourceObject object = loaded.endpoint().serialize(loaded.resource());
                    if (!primary.contains(object.identifier())) {
                        included.putIfAbsent(object.identifier(), object.withFields(params.fieldsFor(object.type())));
                    }
                    next.add(loaded);
                }
            }
            if (!child.getValue().isEmpty() && !next.isEmpty()) {
                collect(next, child.getValue(), params, primary, included);
            }
        }
    }

    private Collection<?> related(Member member, RelationshipDeclaration relationship) {
        ResourceEndpoint<?> endpoint = member.endpoint();
        RequestContext relationshipCtx = memberContext(member.ctx(), endpoint, member.resource(), member.ctx().getPassthrough());
        relationshipCtx.bindPath(relationshipCtx.getId(), relationship.name());

        Action action = relationship.readAction();
        GuardResult allowed = Guards.actions(endpoint, action).evaluate(relationshipCtx);
        if (!allowed.passed()) {
            throw allowed.error() != null ? allowed.error() : new NotFoundException();
        }
        Object result = endpoint.handler(action, relationship.name()).handle(relationshipCtx).data();
        if (result == null) {
            return List.of();
        }
        return result instanceof Collection<?> collection ? collection : List.of(result);
    }

    private Member sideload(Member parent, ResourceEndpoint<?> target, Object related) {
        SideloadPassthrough passthrough = new SideloadPassthrough(related, parent.endpoint().name(), parent.action());
        if (!target.hasHandler(Action.SHOW, null)) {
            return new Member(memberContext(parent.ctx(), target, related, passthrough), target, Action.SHOW, related);
        }
        String id = target.serialize(related).id();
        JsonApiRequest nested = JsonApiRequest.nestedGet(
                "/" + target.name() + "/" + UriUtils.encodePathSegment(id, StandardCharsets.UTF_8),
                parent.ctx().getRequest().headers());
        Execution execution = execute(nested, parent.ctx().getRoleMemo(), passthrough);
        Object data = execution.result().data();
        if (data == null) {
            throw new NotFoundException("Resource '" + StringSanitizer.forLog(id) + "' not found");
        }
        return new Member(execution.ctx(), execution.endpoint(), Action.SHOW, data);
    }

    /**
     * Context for reading relationships of one already-loaded record.
     */
    private RequestContext memberContext(
            RequestContext base, ResourceEndpoint<?> endpoint, Object resource, @Nullable SideloadPassthrough passthrough) {
        RequestContext ctx = RequestContext.builder()
                .request(base.getRequest())
                .resourceName(endpoint.name())
                .capabilities(endpoint.capabilities())
                .params(base.getParams())
                .roleMemo(base.getRoleMemo())
                .passthrough(passthrough)
                .payloadReader(payloadReader)
                .transactionHook(transactionHook)
                .build();
        ctx.bindPath(endpoint.serialize(resource).id(), null);
        ctx.setResource(resource);
        return ctx;
    }

    /**
     * A loaded record together with the context and action it was loaded under.
     */
    private record Member(RequestContext ctx, ResourceEndpoint<?> endpoint, Action action, Object resource) {
    }

    record Execution(RequestContext ctx, ResourceEndpoint<?> endpoint, Route route, HandlerResult result) {
    }
}
