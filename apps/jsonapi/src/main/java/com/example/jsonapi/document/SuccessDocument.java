package com.example.jsonapi.document;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Top-level success document.
 *
 * @param data     primary data: a resource object, identifier, list of either, or {@code null}
 * @param included resources pulled in through {@code include}
 * @param meta     non-standard meta information
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SuccessDocument(
        @JsonInclude(JsonInclude.Include.ALWAYS) Object data,
        List<ResourceObject> included,
        Map<String, Object> meta
) {
    public static SuccessDocument of(Object data) {
        return new SuccessDocument(data, List.of(), Map.of());
    }
}
