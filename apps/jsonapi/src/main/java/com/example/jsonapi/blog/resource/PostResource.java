package com.example.jsonapi.blog.resource;

import com.example.jsonapi.blog.model.Comment;
import com.example.jsonapi.blog.model.Post;
import com.example.jsonapi.blog.model.PostAttributes;
import com.example.jsonapi.blog.repository.InMemoryBlogRepository;
import com.example.jsonapi.context.RequestContext;
import com.example.jsonapi.document.HandlerResult;
import com.example.jsonapi.document.ResourceObject;
import com.example.jsonapi.exception.NotFoundException;
import com.example.jsonapi.resource.ResourceDeclaration;
import com.example.jsonapi.resource.ResourceDefinition;
import com.example.jsonapi.resource.ResourceName;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code /posts}: full CRUD, an index variant filtered by author, a to-one {@code author}
 * and a to-many {@code comments} relationship.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostResource implements ResourceDefinition<Post> {

    private final InMemoryBlogRepository repository;
    private final Validator validator;

    @Override
    public String name() {
        return "post";
    }

    @Override
    public void declare(ResourceDeclaration<Post> resource) {
        resource.finder(repository::findPost)
                .serializer(this::serialize)
                .index(ctx -> HandlerResult.ok(repository.findPosts()))
                .index(ctx -> HandlerResult.ok(repository.findPostsByAuthor(ctx.getParams().filter().get("author"))),
                        "author")
                .show(ctx -> HandlerResult.ok(ctx.resource()))
                .create(this::create)
                .update(this::update)
                .destroy(this::destroy)
                .hasOne("author", "people", author -> author
                        .pluck(ctx -> {
                            Post post = ctx.resource();
                            return HandlerResult.ok(post.authorId() == null
                                    ? null
                                    : repository.findPerson(post.authorId()).orElse(null));
                        })
                        .prune(ctx -> {
                            Post post = ctx.resource();
                            repository.save(post.withAuthor(null));
                            return HandlerResult.noContent();
                        })
                        .graft(ctx -> {
                            Post post = ctx.resource();
                            String personId = existingPerson(Linkage.identifier(ctx.data(), "people"));
                            repository.save(post.withAuthor(personId));
                            return HandlerResult.noContent();
                        }))
                .hasMany("comments", "comments", comments -> comments
                        .fetch(ctx -> HandlerResult.ok(repository.findCommentsByPost(postId(ctx))))
                        .clear(ctx -> {
                            detachAll(postId(ctx));
                            return HandlerResult.noContent();
                        })
                        .replace(ctx -> {
                            List<String> ids = existingComments(Linkage.identifiers(ctx.data(), "comments"));
                            detachAll(postId(ctx));
                            ids.forEach(id -> attach(id, postId(ctx)));
                            return HandlerResult.noContent();
                        })
                        .merge(ctx -> {
                            existingComments(Linkage.identifiers(ctx.data(), "comments"))
                                    .forEach(id -> attach(id, postId(ctx)));
                            return HandlerResult.noContent();
                        })
                        .subtract(ctx -> {
                            String postId = postId(ctx);
                            Linkage.identifiers(ctx.data(), "comments").forEach(id -> repository.findComment(id)
                                    .filter(comment -> postId.equals(comment.postId()))
                                    .ifPresent(comment -> repository.save(comment.withPost(null))));
                            return HandlerResult.noContent();
                        }));
    }

    ResourceObject serialize(ResourceName type, Post post) {
        return ResourceObject.builder(type.value(), post.id())
                .attribute("title", post.title())
                .attribute("body", post.body())
                .toOne("author", "people", post.authorId())
                .toMany("comments", "comments",
                        repository.findCommentsByPost(post.id()).stream().map(Comment::id).toList())
                .build();
    }

    private HandlerResult create(RequestContext ctx) {
        ctx.sanityCheck();
        PostAttributes attributes = validate(ctx.attributes(), null);
        String authorId = Linkage.relationshipId(ctx.data(), "author", "people");
        if (authorId != null) {
            existingPerson(authorId);
        }
        Post post = repository.save(new Post(repository.nextId(), attributes.title(), attributes.body(), authorId));
        log.info("Created post: id={}, author={}", post.id(), authorId);
        return HandlerResult.created(post);
    }

    private HandlerResult update(RequestContext ctx) {
        ctx.sanityCheck();
        Post current = ctx.resource();
        PostAttributes attributes = validate(ctx.attributes(), current);
        Post updated = repository.save(new Post(current.id(), attributes.title(), attributes.body(), current.authorId()));
        return HandlerResult.ok(updated);
    }

    private HandlerResult destroy(RequestContext ctx) {
        Post post = ctx.resource();
        repository.deletePost(post.id());
        log.info("Deleted post: id={}", post.id());
        return HandlerResult.noContent();
    }

    /**
     * Attributes merged over the current post, if any, then validated.
     */
    private PostAttributes validate(Map<String, Object> payload, Post current) {
        String title = payload.containsKey("title")
                ? Linkage.stringAttribute(payload, "title")
                : current != null ? current.title() : null;
        String body = payload.containsKey("body")
                ? Linkage.stringAttribute(payload, "body")
                : current != null ? current.body() : null;
        PostAttributes attributes = new PostAttributes(title, body);
        Set<ConstraintViolation<PostAttributes>> violations = validator.validate(attributes);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        return attributes;
    }

    private String existingPerson(String id) {
        return repository.findPerson(id)
                .map(person -> person.id())
                .orElseThrow(() -> new NotFoundException("Resource '" + id + "' not found"));
    }

    private List<String> existingComments(List<String> ids) {
        ids.forEach(id -> repository.findComment(id)
                .orElseThrow(() -> new NotFoundException("Resource '" + id + "' not found")));
        return ids;
    }

    private void detachAll(String postId) {
        repository.findCommentsByPost(postId).forEach(comment -> repository.save(comment.withPost(null)));
    }

    private void attach(String commentId, String postId) {
        repository.findComment(commentId).ifPresent(comment -> repository.save(comment.withPost(postId)));
    }

    private static String postId(RequestContext ctx) {
        Post post = ctx.resource();
        return post.id();
    }
}
