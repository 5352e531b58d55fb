package com.example.jsonapi.blog.resource;

import com.example.jsonapi.exception.BadRequestException;
import com.example.jsonapi.exception.ConflictException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads resource linkage and attributes out of request payloads.
 */
final class Linkage {

    private Linkage() {}

    /**
     * Id of a single resource identifier object of the given type.
     */
    static String identifier(JsonNode data, String type) {
        if (data == null || !data.isObject()) {
            throw new BadRequestException("Expected a resource identifier object");
        }
        JsonNode actualType = data.path("type");
        JsonNode id = data.path("id");
        if (!actualType.isTextual() || !id.isValueNode() || id.isNull()) {
            throw new BadRequestException("Resource identifier requires 'type' and 'id'");
        }
        if (!type.equals(actualType.asText())) {
            throw new ConflictException("Resource type '" + actualType.asText() + "' does not match relationship type '" + type + "'");
        }
        return id.asText();
    }

    static List<String> identifiers(JsonNode data, String type) {
        if (data == null || !data.isArray()) {
            throw new BadRequestException("Expected an array of resource identifier objects");
        }
        List<String> ids = new ArrayList<>();
        data.forEach(item -> ids.add(identifier(item, type)));
        return ids;
    }

    /**
     * Id from {@code data.relationships.<name>.data} of a resource object, {@code null} when
     * the relationship is absent or empty.
     */
    @Nullable
    static String relationshipId(JsonNode data, String relationship, String type) {
        JsonNode linkage = data.path("relationships").path(relationship).path("data");
        if (linkage.isMissingNode() || linkage.isNull()) {
            return null;
        }
        return identifier(linkage, type);
    }

    @Nullable
    static String stringAttribute(Map<String, Object> attributes, String name) {
        Object value = attributes.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new BadRequestException("Attribute '" + name + "' must be a string");
        }
        return text;
    }
}
