package com.example.jsonapi.context;

import com.example.jsonapi.exception.JsonApiErrors;
import com.example.jsonapi.lifecycle.PayloadReader;
import com.example.jsonapi.lifecycle.TransactionHook;
import com.example.jsonapi.registry.Roles;
import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.RelationType;
import com.example.jsonapi.resource.ResourceCapabilities;
import com.example.jsonapi.resource.ResourceName;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Request-local state of one JSON:API request and the helpers handlers call on it.
 *
 * <p>Holds the resolved resource, the memoized caller role, the parsed payload (memoized per
 * request path), normalized query parameters and, for nested requests, the sideload
 * passthrough. Authorization helpers are bound to the resource this request addresses.
 * Not thread-safe; one instance serves one logical execution.
 */
@Getter
public class RequestContext {

    private final JsonApiRequest request;
    private final ResourceName resourceName;
    private final ResourceCapabilities capabilities;
    private final QueryParameters params;
    private final RoleMemo roleMemo;
    @Nullable
    private final SideloadPassthrough passthrough;
    private final PayloadReader payloadReader;
    private final TransactionHook transactionHook;
    private final HttpHeaders responseHeaders = new HttpHeaders();

    private final Map<String, JsonNode> payloads = new HashMap<>();

    @Nullable
    private String id;
    @Nullable
    private String relationship;
    @Nullable
    private Object resource;

    @Builder
    private RequestContext(
            JsonApiRequest request,
            ResourceName resourceName,
            ResourceCapabilities capabilities,
            @Nullable QueryParameters params,
            RoleMemo roleMemo,
            @Nullable SideloadPassthrough passthrough,
            PayloadReader payloadReader,
            @Nullable TransactionHook transactionHook) {
        this.request = request;
        this.resourceName = resourceName;
        this.capabilities = capabilities;
        this.params = params != null ? params : QueryParameters.EMPTY;
        this.roleMemo = roleMemo;
        this.passthrough = passthrough;
        this.payloadReader = payloadReader;
        this.transactionHook = transactionHook != null ? transactionHook : TransactionHook.NONE;
    }

    public void bindPath(@Nullable String id, @Nullable String relationship) {
        this.id = id;
        this.relationship = relationship;
    }

    public void setResource(@Nullable Object resource) {
        this.resource = resource;
    }

    /**
     * The resource resolved for {@code /{id}}, cast to the handler's expected type.
     */
    @SuppressWarnings("unchecked")
    public <T> T resource() {
        return (T) resource;
    }

    @Nullable
    public String role() {
        return roleMemo.get();
    }

    public boolean hasRole(String... roles) {
        return Roles.of(roles).matches(role());
    }

    public boolean isSideload() {
        return passthrough != null;
    }

    public boolean can(@NonNull Action action) {
        return capabilities.can(this, action, null, null);
    }

    public boolean can(@NonNull Action action, @Nullable RelationType type, @Nullable String rel) {
        return capabilities.can(this, action, type, rel);
    }

    public boolean sideload(@NonNull Action action) {
        return capabilities.sideload(this, action);
    }

    /**
     * The payload's top-level {@code data} member, parsed on first use.
     */
    @NonNull
    public JsonNode data() {
        JsonNode document = payloads.get(request.path());
        if (document == null) {
            document = payloadReader.read(request);
            payloads.put(request.path(), document);
        }
        return payloadReader.dataMember(document);
    }

    /**
     * Payload attributes keyed by camelCase name.
     */
    @NonNull
    public Map<String, Object> attributes() {
        return payloadReader.attributes(data());
    }

    /**
     * Verify payload type against this resource, and payload id against the path id.
     */
    public void sanityCheck() {
        capabilities.sanityCheck(this, id);
    }

    public void sanityCheck(@Nullable String expectedId) {
        capabilities.sanityCheck(this, expectedId);
    }

    public RuntimeException halt(int status, @Nullable String body) {
        return JsonApiErrors.halt(status, body);
    }

    public <T> T transaction(Supplier<T> work) {
        return transactionHook.inTransaction(resourceName, work);
    }
}
