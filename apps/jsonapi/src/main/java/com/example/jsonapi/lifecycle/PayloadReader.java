package com.example.jsonapi.lifecycle;

import com.example.jsonapi.common.util.Inflector;
import com.example.jsonapi.context.JsonApiRequest;
import com.example.jsonapi.exception.BadRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses request documents. Every failure surfaces as a 400.
 */
@RequiredArgsConstructor
public class PayloadReader {

    public static final String MALFORMED = "Malformed JSON:API request payload";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    @NonNull
    public JsonNode read(@NonNull JsonApiRequest request) {
        if (!request.hasBody()) {
            throw new BadRequestException(MALFORMED);
        }
        try {
            JsonNode document = objectMapper.readTree(request.body());
            if (document == null || !document.isObject()) {
                throw new BadRequestException(MALFORMED);
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new BadRequestException(MALFORMED, e);
        }
    }

    /**
     * Top-level {@code data} member. May be a JSON null, never a missing node.
     */
    @NonNull
    public JsonNode dataMember(@NonNull JsonNode document) {
        JsonNode data = document.get("data");
        if (data == null) {
            throw new BadRequestException(MALFORMED);
        }
        return data;
    }

    @NonNull
    public Map<String, Object> attributes(@NonNull JsonNode data) {
        JsonNode attributes = data.path("attributes");
        if (attributes.isMissingNode() || attributes.isNull()) {
            return Map.of();
        }
        if (!attributes.isObject()) {
            throw new BadRequestException(MALFORMED);
        }
        Map<String, Object> raw = objectMapper.convertValue(attributes, MAP_TYPE);
        Map<String, Object> camelized = new LinkedHashMap<>();
        raw.forEach((key, value) -> camelized.put(Inflector.camelize(key), value));
        return camelized;
    }
}
