package com.example.jsonapi;

import com.example.jsonapi.registry.ResourceConfig;
import com.example.jsonapi.resource.ResourceRegistrar;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JsonApiApplicationTests {

    @Autowired
    private ResourceRegistrar registrar;

    @Autowired
    private ResourceConfig resourceConfig;

    @Test
    void contextLoads() {
        assertThat(registrar.endpoints()).extracting(e -> e.name().value())
                .containsExactly("comments", "people", "posts");
        assertThat(resourceConfig.isFrozen()).isTrue();
    }
}
