package com.example.jsonapi.lifecycle;

import com.example.jsonapi.exception.BadRequestException;
import com.example.jsonapi.exception.ConflictException;
import com.example.jsonapi.resource.ResourceName;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Payload identity checks for create and update:
 * {@code type} must name the endpoint's resource and {@code id}, when the path has one, must match.
 */
public class SanityChecker {

    public void check(@NonNull JsonNode data, @NonNull ResourceName resourceName, @Nullable String id) {
        JsonNode type = data.get("type");
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw new BadRequestException("Resource type missing from payload");
        }
        if (!resourceName.value().equals(type.asText())) {
            throw new ConflictException("Resource type in payload does not match endpoint");
        }
        if (id != null) {
            JsonNode payloadId = data.get("id");
            String actual = payloadId == null || payloadId.isNull() ? "" : payloadId.asText();
            if (!id.equals(actual)) {
                throw new ConflictException("Resource ID in payload does not match endpoint");
            }
        }
    }
}
