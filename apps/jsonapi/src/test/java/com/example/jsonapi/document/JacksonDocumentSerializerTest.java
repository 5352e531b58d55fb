package com.example.jsonapi.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JacksonDocumentSerializer")
class JacksonDocumentSerializerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JacksonDocumentSerializer serializer = new JacksonDocumentSerializer(objectMapper);

    @Test
    @DisplayName("should write data, included and the jsonapi member")
    void shouldWriteSuccessDocument() throws Exception {
        ResourceObject post = ResourceObject.builder("posts", "1")
                .attribute("title", "Hello")
                .toOne("author", "people", "9")
                .build();
        ResourceObject author = ResourceObject.builder("people", "9").attribute("name", "Ada").build();

        JsonNode json = objectMapper.readTree(serializer.serializeResponseBody(
                new SuccessDocument(post, List.of(author), Map.of())));

        assertThat(json.path("data").path("attributes").path("title").asText()).isEqualTo("Hello");
        assertThat(json.path("data").path("relationships").path("author").path("data").path("type").asText())
                .isEqualTo("people");
        assertThat(json.path("included").path(0).path("id").asText()).isEqualTo("9");
        assertThat(json.path("jsonapi").path("version").asText()).isEqualTo("1.1");
        assertThat(json.has("meta")).isFalse();
    }

    @Test
    @DisplayName("should write null data explicitly")
    void shouldWriteNullData() throws Exception {
        JsonNode json = objectMapper.readTree(serializer.serializeResponseBody(SuccessDocument.of(null)));

        assertThat(json.has("data")).isTrue();
        assertThat(json.path("data").isNull()).isTrue();
    }

    @Test
    @DisplayName("should write an empty to-one relationship as null data")
    void shouldWriteEmptyToOne() throws Exception {
        ResourceObject post = ResourceObject.builder("posts", "1").toOne("author", "people", null).build();

        JsonNode json = objectMapper.readTree(serializer.serializeResponseBody(SuccessDocument.of(post)));

        JsonNode author = json.path("data").path("relationships").path("author");
        assertThat(author.has("data")).isTrue();
        assertThat(author.path("data").isNull()).isTrue();
    }

    @Test
    @DisplayName("should write errors and hand each one to the logger")
    void shouldWriteErrors() throws Exception {
        List<ErrorObject> logged = new ArrayList<>();
        IllegalStateException cause = new IllegalStateException("boom");
        List<ErrorObject> errors = List.of(
                ErrorObject.atPointer(422, "Unprocessable Entity", "must not be blank", "/data/attributes/title"),
                ErrorObject.of(422, "Unprocessable Entity", "too long", null));

        JsonNode json = objectMapper.readTree(serializer.serializeErrors(errors, (error, t) -> logged.add(error), cause));

        assertThat(json.path("errors")).hasSize(2);
        assertThat(json.path("errors").path(0).path("status").asText()).isEqualTo("422");
        assertThat(json.path("errors").path(0).path("source").path("pointer").asText()).isEqualTo("/data/attributes/title");
        assertThat(json.path("errors").path(1).has("source")).isFalse();
        assertThat(logged).containsExactlyElementsOf(errors);
    }

    @Test
    @DisplayName("should fall back to a minimal document when meta cannot be serialized")
    void shouldFallBackToSafeJson() throws Exception {
        ErrorObject error = ErrorObject.of(500, "Internal Server Error", "An unexpected \"error\"",
                Map.of("self", new Object()));

        JsonNode json = objectMapper.readTree(serializer.serializeErrors(List.of(error), null, null));

        assertThat(json.path("errors").path(0).path("detail").asText()).isEqualTo("An unexpected \"error\"");
        assertThat(json.path("errors").path(0).has("meta")).isFalse();
    }
}
