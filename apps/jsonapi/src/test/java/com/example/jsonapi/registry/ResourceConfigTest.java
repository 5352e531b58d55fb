package com.example.jsonapi.registry;

import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.RelationType;
import com.example.jsonapi.resource.ResourceName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResourceConfig")
class ResourceConfigTest {

    private static final ResourceName POSTS = ResourceName.of("posts");
    private static final ResourceName PEOPLE = ResourceName.of("people");

    private ResourceConfig config;

    @BeforeEach
    void setUp() {
        config = new ResourceConfig();
    }

    @Nested
    @DisplayName("before freeze")
    class BeforeFreeze {

        @Test
        @DisplayName("should lazily create permissive entries")
        void shouldCreatePermissiveEntries() {
            assertThat(config.roleTable().contains(POSTS)).isFalse();

            ResourceRoles roles = config.roles(POSTS);

            assertThat(config.roleTable().contains(POSTS)).isTrue();
            assertThat(roles.resource(Action.DESTROY).isUnrestricted()).isTrue();
            assertThat(config.sideloads(POSTS).parentsOf(Action.SHOW)).isEmpty();
        }

        @Test
        @DisplayName("should return the same entry on repeated lookups")
        void shouldReturnSameEntry() {
            assertThat(config.roles(POSTS)).isSameAs(config.roles(POSTS));
            assertThat(config.sideloads(POSTS)).isSameAs(config.sideloads(POSTS));
        }

        @Test
        @DisplayName("should fall back to the resource entry when a relationship has none")
        void shouldFallBackToResourceEntry() {
            config.roles(POSTS)
                    .permit(Action.PLUCK, "user")
                    .permit(RelationType.HAS_ONE, "author", Action.PLUCK, Roles.of("admin"));

            assertThat(config.roles(POSTS).lookup(Action.PLUCK, RelationType.HAS_ONE, "author").values())
                    .containsExactly("admin");
            assertThat(config.roles(POSTS).lookup(Action.PLUCK, RelationType.HAS_ONE, "editor").values())
                    .containsExactly("user");
            assertThat(config.roles(POSTS).lookup(Action.PLUCK, null, null).values())
                    .containsExactly("user");
        }
    }

    @Nested
    @DisplayName("after freeze")
    class AfterFreeze {

        @BeforeEach
        void freeze() {
            config.roles(POSTS).permit(Action.DESTROY, "admin");
            config.sideloads(PEOPLE).allow(Action.SHOW, POSTS);
            config.freeze();
        }

        @Test
        @DisplayName("should keep configured entries readable")
        void shouldKeepEntries() {
            assertThat(config.isFrozen()).isTrue();
            assertThat(config.roles(POSTS).resource(Action.DESTROY).values()).containsExactly("admin");
            assertThat(config.sideloads(PEOPLE).permits(Action.SHOW, POSTS)).isTrue();
        }

        @Test
        @DisplayName("should reject role mutations")
        void shouldRejectRoleMutations() {
            assertThatThrownBy(() -> config.roles(POSTS).permit(Action.CREATE, "admin"))
                    .isInstanceOf(ConfigFrozenException.class);
        }

        @Test
        @DisplayName("should reject sideload mutations")
        void shouldRejectSideloadMutations() {
            assertThatThrownBy(() -> config.sideloads(PEOPLE).allow(Action.INDEX, POSTS))
                    .isInstanceOf(ConfigFrozenException.class);
        }

        @Test
        @DisplayName("should serve unknown resources as unrestricted without storing them")
        void shouldServeUnknownResources() {
            ResourceName unknown = ResourceName.of("tags");

            assertThat(config.roles(unknown).resource(Action.DESTROY).isUnrestricted()).isTrue();
            assertThat(config.roleTable().contains(unknown)).isFalse();
            assertThatThrownBy(() -> config.roles(unknown).permit(Action.DESTROY, "admin"))
                    .isInstanceOf(ConfigFrozenException.class);
        }

        @Test
        @DisplayName("should publish frozen entries to request threads")
        void shouldPublishFrozenEntries() throws Exception {
            ResourceConfig other = new ResourceConfig();
            other.roles(PEOPLE).permit(Action.SHOW, "admin");
            other.sideloads(PEOPLE).allow(Action.SHOW, POSTS);
            CompletableFuture.runAsync(other::freeze).get(5, TimeUnit.SECONDS);

            boolean[] seen = CompletableFuture.supplyAsync(() -> new boolean[] {
                    other.roles(PEOPLE).resource(Action.SHOW).matches("admin"),
                    other.sideloads(PEOPLE).permits(Action.SHOW, POSTS)
            }).get(5, TimeUnit.SECONDS);

            assertThat(seen).containsExactly(true, true);
            for (Field field : List.of(
                    ResourceRoles.class.getDeclaredField("resource"),
                    ResourceRoles.class.getDeclaredField("relationships"),
                    ResourceSideloads.class.getDeclaredField("parents"))) {
                assertThat(Modifier.isVolatile(field.getModifiers())).as(field.getName()).isTrue();
            }
        }

        @Test
        @DisplayName("should fail loudly on ensureMutable")
        void shouldFailEnsureMutable() {
            assertThatThrownBy(() -> config.ensureMutable("declare resource 'tags'"))
                    .isInstanceOf(ConfigFrozenException.class)
                    .hasMessageContaining("declare resource 'tags'");
        }
    }

    @Nested
    @DisplayName("Roles")
    class RolesMatching {

        @Test
        @DisplayName("should be unrestricted when empty")
        void shouldBeUnrestrictedWhenEmpty() {
            assertThat(Roles.of().isUnrestricted()).isTrue();
            assertThat(Roles.of((Collection<String>) null).isUnrestricted()).isTrue();
        }

        @Test
        @DisplayName("should require membership when not empty")
        void shouldRequireMembership() {
            Roles admins = Roles.of("admin");

            assertThat(admins.isUnrestricted()).isFalse();
            assertThat(admins.matches("admin")).isTrue();
            assertThat(admins.matches("user")).isFalse();
            assertThat(admins.matches(null)).isFalse();
        }

        @Test
        @DisplayName("should match any identified role with the wildcard")
        void shouldMatchWildcard() {
            Roles anyone = Roles.of("*");

            assertThat(anyone.matches("user")).isTrue();
            assertThat(anyone.matches(null)).isFalse();
        }
    }
}
