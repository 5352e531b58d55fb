package com.example.jsonapi.lifecycle;

import com.example.jsonapi.exception.BadRequestException;
import com.example.jsonapi.exception.ConflictException;
import com.example.jsonapi.resource.ResourceName;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SanityChecker")
class SanityCheckerTest {

    private static final ResourceName POSTS = ResourceName.of("posts");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SanityChecker checker = new SanityChecker();

    private JsonNode data(String json) throws Exception {
        return objectMapper.readTree(json);
    }

    @Test
    @DisplayName("should pass a matching type without path id")
    void shouldPassCreate() throws Exception {
        JsonNode data = data("{\"type\":\"posts\"}");

        assertThatCode(() -> checker.check(data, POSTS, null)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should pass matching type and id")
    void shouldPassUpdate() throws Exception {
        JsonNode data = data("{\"type\":\"posts\",\"id\":\"42\"}");

        assertThatCode(() -> checker.check(data, POSTS, "42")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should answer 400 when type is missing")
    void shouldRejectMissingType() throws Exception {
        JsonNode data = data("{\"id\":\"42\"}");

        assertThatThrownBy(() -> checker.check(data, POSTS, "42"))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Resource type missing from payload");
    }

    @Test
    @DisplayName("should answer 409 for a different type")
    void shouldRejectTypeMismatch() throws Exception {
        JsonNode data = data("{\"type\":\"comments\"}");

        assertThatThrownBy(() -> checker.check(data, POSTS, null))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Resource type in payload does not match endpoint");
    }

    @Test
    @DisplayName("should answer 409 for a different id")
    void shouldRejectIdMismatch() throws Exception {
        JsonNode data = data("{\"type\":\"posts\",\"id\":\"7\"}");

        assertThatThrownBy(() -> checker.check(data, POSTS, "42"))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Resource ID in payload does not match endpoint");
    }

    @Test
    @DisplayName("should treat a missing id as empty when the path has one")
    void shouldRejectMissingId() throws Exception {
        JsonNode data = data("{\"type\":\"posts\"}");

        assertThatThrownBy(() -> checker.check(data, POSTS, "42")).isInstanceOf(ConflictException.class);
    }
}
