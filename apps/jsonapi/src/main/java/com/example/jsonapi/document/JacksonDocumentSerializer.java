package com.example.jsonapi.document;

import com.example.jsonapi.common.JsonApiConstants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Jackson-backed {@link DocumentSerializer}. Adds the top-level {@code jsonapi} member to
 * every document.
 */
@Slf4j
public class JacksonDocumentSerializer implements DocumentSerializer {

    private final ObjectMapper objectMapper;

    public JacksonDocumentSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    @NonNull
    public String serializeResponseBody(@NonNull SuccessDocument document) {
        ObjectNode root = objectMapper.valueToTree(document);
        if (!root.has("data")) {
            root.putNull("data");
        }
        root.set("jsonapi", versionNode());
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response document", e);
        }
    }

    @Override
    @NonNull
    public String serializeErrors(@NonNull List<ErrorObject> errors, @Nullable ErrorLogger logger, @Nullable Throwable cause) {
        if (logger != null) {
            errors.forEach(error -> logger.log(error, cause));
        }
        try {
            ObjectNode root = objectMapper.createObjectNode();
            root.set("jsonapi", versionNode());
            ArrayNode array = root.putArray("errors");
            errors.forEach(error -> array.add(objectMapper.valueToTree(error)));
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Failed to serialize error document with ObjectMapper: {}", e.getMessage());
            return buildSafeJson(errors);
        }
    }

    private ObjectNode versionNode() {
        return objectMapper.createObjectNode().put("version", JsonApiConstants.JSONAPI_VERSION);
    }

    /**
     * Minimal error document built by hand, used only when Jackson fails on the error list.
     * Meta is dropped since it is what usually fails to serialize.
     */
    @NonNull
    private String buildSafeJson(@NonNull List<ErrorObject> errors) {
        StringBuilder json = new StringBuilder("{\"errors\":[");
        for (int i = 0; i < errors.size(); i++) {
            ErrorObject error = errors.get(i);
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"status\":\"").append(escapeJson(error.status())).append('"');
            json.append(",\"title\":\"").append(escapeJson(error.title())).append('"');
            json.append(",\"detail\":\"").append(escapeJson(error.detail())).append("\"}");
        }
        return json.append("]}").toString();
    }

    private static String escapeJson(@Nullable String value) {
        if (value == null) {
            return "";
        }
        return value
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
