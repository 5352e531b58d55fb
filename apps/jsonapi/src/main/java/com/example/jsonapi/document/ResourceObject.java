package com.example.jsonapi.document;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A serialized resource: type, id, attributes and relationships.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ResourceObject(
        String type,
        String id,
        Map<String, Object> attributes,
        Map<String, Relationship> relationships,
        Map<String, Object> meta
) {
    public static Builder builder(String type, String id) {
        return new Builder(type, id);
    }

    @JsonIgnore
    public ResourceIdentifier identifier() {
        return new ResourceIdentifier(type, id);
    }

    /**
     * Copy restricted to the given sparse fieldset. {@code null} keeps every field.
     */
    public ResourceObject withFields(@Nullable Set<String> fields) {
        if (fields == null) {
            return this;
        }
        Map<String, Object> keptAttributes = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((k, v) -> {
                if (fields.contains(k)) {
                    keptAttributes.put(k, v);
                }
            });
        }
        Map<String, Relationship> keptRelationships = new LinkedHashMap<>();
        if (relationships != null) {
            relationships.forEach((k, v) -> {
                if (fields.contains(k)) {
                    keptRelationships.put(k, v);
                }
            });
        }
        return new ResourceObject(type, id, keptAttributes, keptRelationships, meta);
    }

    public static final class Builder {
        private final String type;
        private final String id;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Map<String, Relationship> relationships = new LinkedHashMap<>();
        private final Map<String, Object> meta = new LinkedHashMap<>();

        private Builder(String type, String id) {
            this.type = type;
            this.id = id;
        }

        public Builder attribute(String name, Object value) {
            attributes.put(name, value);
            return this;
        }

        public Builder toOne(String name, String type, @Nullable String id) {
            relationships.put(name, Relationship.toOne(type, id));
            return this;
        }

        public Builder toMany(String name, String type, List<String> ids) {
            relationships.put(name, Relationship.toMany(type, ids));
            return this;
        }

        public Builder meta(String key, Object value) {
            meta.put(key, value);
            return this;
        }

        public ResourceObject build() {
            return new ResourceObject(type, id, attributes, relationships, meta);
        }
    }
}
