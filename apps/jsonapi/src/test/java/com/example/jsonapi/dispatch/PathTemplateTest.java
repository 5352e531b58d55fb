package com.example.jsonapi.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PathTemplate")
class PathTemplateTest {

    @Test
    @DisplayName("should match the four path shapes")
    void shouldMatchShapes() {
        assertThat(PathTemplate.match(List.of())).hasValue(new PathTemplate.Match(PathTemplate.COLLECTION, null, null));
        assertThat(PathTemplate.match(List.of("42"))).hasValue(new PathTemplate.Match(PathTemplate.MEMBER, "42", null));
        assertThat(PathTemplate.match(List.of("42", "author")))
                .hasValue(new PathTemplate.Match(PathTemplate.RELATED, "42", "author"));
        assertThat(PathTemplate.match(List.of("42", "relationships", "author")))
                .hasValue(new PathTemplate.Match(PathTemplate.RELATIONSHIP, "42", "author"));
    }

    @Test
    @DisplayName("should not match other shapes")
    void shouldRejectOtherShapes() {
        assertThat(PathTemplate.match(List.of("42", "links", "author"))).isEmpty();
        assertThat(PathTemplate.match(List.of("42", "relationships", "author", "extra"))).isEmpty();
    }
}
