package com.example.jsonapi.authz;

import com.example.jsonapi.context.JsonApiRequest;
import com.example.jsonapi.context.RoleMemo;
import com.example.jsonapi.context.SideloadPassthrough;
import com.example.jsonapi.registry.ResourceConfig;
import com.example.jsonapi.registry.Roles;
import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.RelationType;
import com.example.jsonapi.resource.ResourceName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.example.jsonapi.util.JsonApiRequestTestBuilder.aGet;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResourceAuthorizer")
class ResourceAuthorizerTest {

    private static final ResourceName POSTS = ResourceName.of("posts");
    private static final ResourceName PEOPLE = ResourceName.of("people");

    @Mock
    private RoleResolver roleResolver;

    private ResourceConfig config;
    private ResourceAuthorizer authorizer;

    @BeforeEach
    void setUp() {
        config = new ResourceConfig();
        authorizer = new ResourceAuthorizer(config);
    }

    private RoleMemo memo() {
        JsonApiRequest request = aGet("/posts").build();
        return new RoleMemo(() -> roleResolver.resolve(request));
    }

    @Nested
    @DisplayName("can")
    class Can {

        @Test
        @DisplayName("should allow any caller when the role set is empty")
        void shouldAllowWhenUnrestricted() {
            config.freeze();

            assertThat(authorizer.can(RoleMemo.of(null), POSTS, Action.DESTROY)).isTrue();
            assertThat(authorizer.can(RoleMemo.of("user"), POSTS, Action.DESTROY)).isTrue();
        }

        @Test
        @DisplayName("should not resolve the role for unrestricted actions")
        void shouldNotResolveRoleWhenUnrestricted() {
            config.freeze();

            authorizer.can(memo(), POSTS, Action.INDEX);

            verify(roleResolver, never()).resolve(any());
        }

        @Test
        @DisplayName("should allow only members of a single-role set")
        void shouldRequireMembership() {
            config.roles(POSTS).permit(Action.DESTROY, "admin");
            config.freeze();

            assertThat(authorizer.can(RoleMemo.of("admin"), POSTS, Action.DESTROY)).isTrue();
            assertThat(authorizer.can(RoleMemo.of("user"), POSTS, Action.DESTROY)).isFalse();
            assertThat(authorizer.can(RoleMemo.of(null), POSTS, Action.DESTROY)).isFalse();
        }

        @Test
        @DisplayName("should resolve the role once per request")
        void shouldMemoizeRole() {
            config.roles(POSTS)
                    .permit(Action.CREATE, "admin")
                    .permit(Action.UPDATE, "admin")
                    .permit(Action.DESTROY, "admin");
            config.freeze();
            when(roleResolver.resolve(any())).thenReturn("admin");
            RoleMemo role = memo();

            authorizer.can(role, POSTS, Action.CREATE);
            authorizer.can(role, POSTS, Action.UPDATE);
            authorizer.can(role, POSTS, Action.DESTROY);

            verify(roleResolver, times(1)).resolve(any());
        }

        @Test
        @DisplayName("should memoize a null role as well")
        void shouldMemoizeNullRole() {
            config.roles(POSTS).permit(Action.DESTROY, "admin");
            config.freeze();
            when(roleResolver.resolve(any())).thenReturn(null);
            RoleMemo role = memo();

            assertThat(authorizer.can(role, POSTS, Action.DESTROY)).isFalse();
            assertThat(authorizer.can(role, POSTS, Action.DESTROY)).isFalse();

            verify(roleResolver, times(1)).resolve(any());
        }

        @Test
        @DisplayName("should prefer the relationship entry over the resource entry")
        void shouldPreferRelationshipEntry() {
            config.roles(POSTS)
                    .permit(Action.GRAFT, "user")
                    .permit(RelationType.HAS_ONE, "author", Action.GRAFT, Roles.of("admin"));
            config.freeze();

            assertThat(authorizer.can(RoleMemo.of("user"), POSTS, Action.GRAFT, RelationType.HAS_ONE, "author")).isFalse();
            assertThat(authorizer.can(RoleMemo.of("user"), POSTS, Action.GRAFT, RelationType.HAS_ONE, "editor")).isTrue();
            assertThat(authorizer.can(RoleMemo.of("admin"), POSTS, Action.GRAFT, RelationType.HAS_ONE, "author")).isTrue();
        }
    }

    @Nested
    @DisplayName("sideload")
    class Sideload {

        @Test
        @DisplayName("should be false outside a sideload")
        void shouldBeFalseWithoutPassthrough() {
            config.sideloads(PEOPLE).allow(Action.SHOW, POSTS);
            config.freeze();

            assertThat(authorizer.sideload(RoleMemo.of("user"), null, PEOPLE, Action.SHOW)).isFalse();
        }

        @Test
        @DisplayName("should be true when the table lists the parent and the parent action is allowed")
        void shouldAllowListedParent() {
            config.sideloads(PEOPLE).allow(Action.SHOW, POSTS);
            config.freeze();

            SideloadPassthrough passthrough = new SideloadPassthrough(new Object(), POSTS, Action.SHOW);

            assertThat(authorizer.sideload(RoleMemo.of("user"), passthrough, PEOPLE, Action.SHOW)).isTrue();
        }

        @Test
        @DisplayName("should be false when the table does not list the parent")
        void shouldRejectUnlistedParent() {
            config.sideloads(PEOPLE).allow(Action.SHOW, ResourceName.of("comments"));
            config.freeze();

            SideloadPassthrough passthrough = new SideloadPassthrough(new Object(), POSTS, Action.SHOW);

            assertThat(authorizer.sideload(RoleMemo.of("user"), passthrough, PEOPLE, Action.SHOW)).isFalse();
        }

        @Test
        @DisplayName("should be false when the caller may not perform the parent action")
        void shouldRequireParentAuthorization() {
            config.sideloads(PEOPLE).allow(Action.SHOW, POSTS);
            config.roles(POSTS).permit(Action.SHOW, "admin");
            config.freeze();

            SideloadPassthrough passthrough = new SideloadPassthrough(new Object(), POSTS, Action.SHOW);

            assertThat(authorizer.sideload(RoleMemo.of("user"), passthrough, PEOPLE, Action.SHOW)).isFalse();
            assertThat(authorizer.sideload(RoleMemo.of("admin"), passthrough, PEOPLE, Action.SHOW)).isTrue();
        }
    }
}
