package com.example.jsonapi.config;

import com.example.jsonapi.config.properties.JsonApiProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsonApiProperties")
class JsonApiPropertiesTest {

    @Test
    @DisplayName("should apply defaults for absent settings")
    void shouldApplyDefaults() {
        JsonApiProperties properties = new JsonApiProperties(null, null, null, null, null);

        assertThat(properties.basePath()).isEmpty();
        assertThat(properties.roleHeader()).isEqualTo("X-Role");
        assertThat(properties.freezeOnStartup()).isTrue();
        assertThat(properties.errorLogging().enabled()).isTrue();
        assertThat(properties.errorLogging().includeClientErrors()).isFalse();
        assertThat(properties.resources()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "/, ''",
            "api, /api",
            "/api/, /api",
            "' /api/v1 ', /api/v1"
    })
    @DisplayName("should normalize the base path")
    void shouldNormalizeBasePath(String raw, String expected) {
        assertThat(new JsonApiProperties(raw, null, null, null, null).basePath()).isEqualTo(expected);
    }
}
