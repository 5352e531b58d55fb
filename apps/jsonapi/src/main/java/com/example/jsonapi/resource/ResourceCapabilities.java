package com.example.jsonapi.resource;

import com.example.jsonapi.authz.ResourceAuthorizer;
import com.example.jsonapi.context.RequestContext;
import com.example.jsonapi.lifecycle.SanityChecker;
import org.springframework.lang.Nullable;

/**
 * Authorization and payload checks bound to one resource name, so handlers of that resource
 * never pass the name themselves.
 */
public final class ResourceCapabilities {

    private final ResourceName resourceName;
    private final ResourceAuthorizer authorizer;
    private final SanityChecker sanityChecker;

    public ResourceCapabilities(ResourceName resourceName, ResourceAuthorizer authorizer, SanityChecker sanityChecker) {
        this.resourceName = resourceName;
        this.authorizer = authorizer;
        this.sanityChecker = sanityChecker;
    }

    public ResourceName resourceName() {
        return resourceName;
    }

    public boolean can(RequestContext ctx, Action action, @Nullable RelationType type, @Nullable String rel) {
        return authorizer.can(ctx.getRoleMemo(), resourceName, action, type, rel);
    }

    public boolean sideload(RequestContext ctx, Action action) {
        return authorizer.sideload(ctx.getRoleMemo(), ctx.getPassthrough(), resourceName, action);
    }

    public void sanityCheck(RequestContext ctx, @Nullable String id) {
        sanityChecker.check(ctx.data(), resourceName, id);
    }
}
