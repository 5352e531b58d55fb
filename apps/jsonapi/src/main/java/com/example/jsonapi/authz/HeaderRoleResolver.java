package com.example.jsonapi.authz;

import com.example.jsonapi.common.util.StringSanitizer;
import com.example.jsonapi.context.JsonApiRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

/**
 * Reads the role from a request header, e.g. {@code X-Role: admin}.
 * Expects an upstream gateway to have authenticated the caller and set the header.
 */
@Slf4j
public class HeaderRoleResolver implements RoleResolver {

    private final String headerName;

    public HeaderRoleResolver(String headerName) {
        this.headerName = headerName;
    }

    @Override
    @Nullable
    public String resolve(JsonApiRequest request) {
        String role = StringSanitizer.headerValue(request.headers().getFirst(headerName));
        log.debug("Resolved role from header {}: {}", headerName, role != null ? StringSanitizer.forLog(role) : "<none>");
        return role;
    }
}
