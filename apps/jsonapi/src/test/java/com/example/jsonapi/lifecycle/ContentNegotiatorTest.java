package com.example.jsonapi.lifecycle;

import com.example.jsonapi.exception.BadRequestException;
import com.example.jsonapi.exception.NotAcceptableException;
import com.example.jsonapi.exception.UnsupportedMediaTypeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.example.jsonapi.util.JsonApiRequestTestBuilder.aGet;
import static com.example.jsonapi.util.JsonApiRequestTestBuilder.aPost;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ContentNegotiator")
class ContentNegotiatorTest {

    private static final String BODY = "{\"data\":{\"type\":\"posts\"}}";

    private final ContentNegotiator negotiator = new ContentNegotiator();

    @Nested
    @DisplayName("Accept")
    class Accept {

        @ParameterizedTest
        @ValueSource(strings = {
                "application/vnd.api+json",
                "application/vnd.api+json;q=0.9",
                "application/vnd.api+json, text/html;q=0.5",
                "text/html;q=0.1, application/vnd.api+json"
        })
        @DisplayName("should accept when the preferred entry is the bare JSON:API type")
        void shouldAccept(String accept) {
            assertThatCode(() -> negotiator.negotiate(aGet("/posts").withAccept(accept).build()))
                    .doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "text/html",
                "application/json",
                "*/*",
                "application/vnd.api+json;ext=bulk",
                "text/html, application/vnd.api+json;q=0.8"
        })
        @DisplayName("should reject with 406 otherwise")
        void shouldReject(String accept) {
            assertThatThrownBy(() -> negotiator.negotiate(aGet("/posts").withAccept(accept).build()))
                    .isInstanceOf(NotAcceptableException.class);
        }

        @Test
        @DisplayName("should treat a missing Accept header as */* and reject")
        void shouldRejectMissingAccept() {
            assertThatThrownBy(() -> negotiator.negotiate(aGet("/posts").withoutAccept().build()))
                    .isInstanceOf(NotAcceptableException.class);
        }

        @Test
        @DisplayName("should answer 400 for an unparseable Accept header")
        void shouldRejectInvalidAccept() {
            assertThatThrownBy(() -> negotiator.negotiate(aGet("/posts").withAccept("not a media type").build()))
                    .isInstanceOf(BadRequestException.class);
        }
    }

    @Nested
    @DisplayName("Content-Type")
    class ContentType {

        @Test
        @DisplayName("should accept the JSON:API type with a charset")
        void shouldAcceptCharset() {
            assertThatCode(() -> negotiator.negotiate(aPost("/posts", BODY)
                    .withContentType("application/vnd.api+json; charset=utf-8").build()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should not check Content-Type without a body")
        void shouldIgnoreContentTypeWithoutBody() {
            assertThatCode(() -> negotiator.negotiate(aGet("/posts").withContentType("text/plain").build()))
                    .doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(strings = {"application/json", "application/vnd.api+json; ext=bulk", "text/plain"})
        @DisplayName("should reject other body media types with 415")
        void shouldRejectMediaType(String contentType) {
            assertThatThrownBy(() -> negotiator.negotiate(aPost("/posts", BODY).withContentType(contentType).build()))
                    .isInstanceOf(UnsupportedMediaTypeException.class);
        }

        @Test
        @DisplayName("should reject a body without Content-Type with 415")
        void shouldRejectMissingContentType() {
            assertThatThrownBy(() -> negotiator.negotiate(aPost("/posts", BODY).withoutContentType().build()))
                    .isInstanceOf(UnsupportedMediaTypeException.class);
        }
    }
}
