package com.example.jsonapi.dispatch;

import com.example.jsonapi.authz.ResourceAuthorizer;
import com.example.jsonapi.context.JsonApiRequest;
import com.example.jsonapi.context.QueryParameters;
import com.example.jsonapi.context.RequestContext;
import com.example.jsonapi.context.RoleMemo;
import com.example.jsonapi.context.SideloadPassthrough;
import com.example.jsonapi.exception.BadRequestException;
import com.example.jsonapi.exception.ForbiddenException;
import com.example.jsonapi.exception.MethodNotAllowedException;
import com.example.jsonapi.lifecycle.PayloadReader;
import com.example.jsonapi.lifecycle.SanityChecker;
import com.example.jsonapi.registry.ResourceConfig;
import com.example.jsonapi.resource.Action;
import com.example.jsonapi.resource.ResourceCapabilities;
import com.example.jsonapi.resource.ResourceName;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.jsonapi.util.JsonApiRequestTestBuilder.aGet;
import static com.example.jsonapi.util.JsonApiRequestTestBuilder.aPatch;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Guards")
class GuardsTest {

    private static final ResourceName POSTS = ResourceName.of("posts");

    private ResourceConfig config;

    @BeforeEach
    void setUp() {
        config = new ResourceConfig();
    }

    private RequestContext context(JsonApiRequest request, String role, SideloadPassthrough passthrough) {
        config.freeze();
        ResourceCapabilities capabilities =
                new ResourceCapabilities(POSTS, new ResourceAuthorizer(config), new SanityChecker());
        return RequestContext.builder()
                .request(request)
                .resourceName(POSTS)
                .capabilities(capabilities)
                .params(QueryParameters.parse(request.queryParams()))
                .roleMemo(RoleMemo.of(role))
                .passthrough(passthrough)
                .payloadReader(new PayloadReader(new ObjectMapper()))
                .build();
    }

    private RequestContext context(JsonApiRequest request) {
        return context(request, null, null);
    }

    @Nested
    @DisplayName("actions")
    class Actions {

        @Test
        @DisplayName("should pass when allowed and handled")
        void shouldPass() {
            Guard guard = Guards.actions((action, rel) -> true, Action.SHOW);

            assertThat(guard.evaluate(context(aGet("/posts/1").build())).passed()).isTrue();
        }

        @Test
        @DisplayName("should carry 403 when the caller is not allowed, even without a handler")
        void shouldCarryForbidden() {
            config.roles(POSTS).permit(Action.DESTROY, "admin");
            Guard guard = Guards.actions((action, rel) -> false, Action.DESTROY);

            GuardResult result = guard.evaluate(context(aGet("/posts/1").build(), "user", null));

            assertThat(result.passed()).isFalse();
            assertThat(result.error()).isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("should carry 405 when the handler is missing")
        void shouldCarryMethodNotAllowed() {
            Guard guard = Guards.actions((action, rel) -> false, Action.DESTROY);

            GuardResult result = guard.evaluate(context(aGet("/posts/1").build()));

            assertThat(result.error()).isInstanceOf(MethodNotAllowedException.class);
        }

        @Test
        @DisplayName("should pass through a permitted sideload")
        void shouldPassThroughSideload() {
            config.roles(POSTS).permit(Action.SHOW, "admin");
            config.sideloads(POSTS).allow(Action.SHOW, "comments");
            Guard guard = Guards.actions((action, rel) -> true, Action.SHOW);
            SideloadPassthrough passthrough = new SideloadPassthrough(new Object(), ResourceName.of("comments"), Action.SHOW);

            assertThat(guard.evaluate(context(aGet("/posts/1").build(), "user", passthrough)).passed()).isTrue();
        }
    }

    @Nested
    @DisplayName("pfilters")
    class Pfilters {

        @Test
        @DisplayName("should require every filter key")
        void shouldRequireEveryKey() {
            Guard guard = Guards.pfilters("author", "status");

            assertThat(guard.evaluate(context(aGet("/posts")
                    .withQueryParam("filter[author]", "9")
                    .withQueryParam("filter[status]", "draft").build())).passed()).isTrue();
        }

        @Test
        @DisplayName("should fail without an error when a key is missing")
        void shouldFailSilently() {
            GuardResult result = Guards.pfilters("author", "status")
                    .evaluate(context(aGet("/posts").withQueryParam("filter[author]", "9").build()));

            assertThat(result.passed()).isFalse();
            assertThat(result.error()).isNull();
        }
    }

    @Nested
    @DisplayName("nullif")
    class Nullif {

        @Test
        @DisplayName("should test the data member")
        void shouldTestData() {
            RequestContext ctx = context(aPatch("/posts/1/relationships/author", "{\"data\":null}").build());

            assertThat(Guards.nullif(JsonNode::isNull).evaluate(ctx).passed()).isTrue();
            assertThat(Guards.nullif(data -> !data.isNull()).evaluate(ctx).passed()).isFalse();
        }

        @Test
        @DisplayName("should carry the read error of a malformed payload")
        void shouldCarryReadError() {
            RequestContext ctx = context(aPatch("/posts/1/relationships/author", "{").build());

            GuardResult result = Guards.nullif(JsonNode::isNull).evaluate(ctx);

            assertThat(result.passed()).isFalse();
            assertThat(result.error()).isInstanceOf(BadRequestException.class);
        }
    }

    @Test
    @DisplayName("all should stop at the first failing guard")
    void shouldStopAtFirstFailure() {
        AtomicInteger evaluated = new AtomicInteger();
        Guard counting = ctx -> {
            evaluated.incrementAndGet();
            return GuardResult.PASS;
        };

        GuardResult result = Guards.all(List.of(counting, ctx -> GuardResult.fail(), counting), context(aGet("/posts").build()));

        assertThat(result.passed()).isFalse();
        assertThat(evaluated).hasValue(1);
    }
}
