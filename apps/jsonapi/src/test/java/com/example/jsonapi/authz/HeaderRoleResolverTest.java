package com.example.jsonapi.authz;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.example.jsonapi.util.JsonApiRequestTestBuilder.aGet;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HeaderRoleResolver")
class HeaderRoleResolverTest {

    private final HeaderRoleResolver resolver = new HeaderRoleResolver("X-Role");

    @Test
    @DisplayName("should read the trimmed header value")
    void shouldReadHeader() {
        assertThat(resolver.resolve(aGet("/posts").withRole("  admin ").build())).isEqualTo("admin");
    }

    @Test
    @DisplayName("should resolve to null without the header")
    void shouldResolveNullWithoutHeader() {
        assertThat(resolver.resolve(aGet("/posts").build())).isNull();
        assertThat(resolver.resolve(aGet("/posts").withRole("   ").build())).isNull();
    }
}
