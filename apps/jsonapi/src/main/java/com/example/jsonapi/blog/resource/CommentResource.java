package com.example.jsonapi.blog.resource;

import com.example.jsonapi.blog.model.Comment;
import com.example.jsonapi.blog.repository.InMemoryBlogRepository;
import com.example.jsonapi.context.RequestContext;
import com.example.jsonapi.document.HandlerResult;
import com.example.jsonapi.document.ResourceObject;
import com.example.jsonapi.exception.NotFoundException;
import com.example.jsonapi.exception.UnprocessableEntityException;
import com.example.jsonapi.resource.ResourceDeclaration;
import com.example.jsonapi.resource.ResourceDefinition;
import com.example.jsonapi.resource.ResourceName;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CommentResource implements ResourceDefinition<Comment> {

    private final InMemoryBlogRepository repository;

    @Override
    public String name() {
        return "comment";
    }

    @Override
    public void declare(ResourceDeclaration<Comment> resource) {
        resource.finder(repository::findComment)
                .serializer(this::serialize)
                .index(ctx -> HandlerResult.ok(repository.findComments()))
                .index(ctx -> HandlerResult.ok(repository.findCommentsByPost(ctx.getParams().filter().get("post"))),
                        "post")
                .show(ctx -> HandlerResult.ok(ctx.resource()))
                .create(this::create)
                .destroy(ctx -> {
                    Comment comment = ctx.resource();
                    repository.deleteComment(comment.id());
                    return HandlerResult.noContent();
                })
                .hasOne("post", "posts", post -> post.pluck(ctx -> {
                    Comment comment = ctx.resource();
                    return HandlerResult.ok(comment.postId() == null
                            ? null
                            : repository.findPost(comment.postId()).orElse(null));
                }))
                .hasOne("author", "people", author -> author.pluck(ctx -> {
                    Comment comment = ctx.resource();
                    return HandlerResult.ok(comment.authorId() == null
                            ? null
                            : repository.findPerson(comment.authorId()).orElse(null));
                }));
    }

    ResourceObject serialize(ResourceName type, Comment comment) {
        return ResourceObject.builder(type.value(), comment.id())
                .attribute("body", comment.body())
                .toOne("post", "posts", comment.postId())
                .toOne("author", "people", comment.authorId())
                .build();
    }

    private HandlerResult create(RequestContext ctx) {
        ctx.sanityCheck();
        String body = Linkage.stringAttribute(ctx.attributes(), "body");
        if (body == null || body.isBlank()) {
            throw new UnprocessableEntityException("Comment body must not be blank");
        }
        String postId = Linkage.relationshipId(ctx.data(), "post", "posts");
        if (postId != null && repository.findPost(postId).isEmpty()) {
            throw new NotFoundException("Resource '" + postId + "' not found");
        }
        String authorId = Linkage.relationshipId(ctx.data(), "author", "people");
        if (authorId != null && repository.findPerson(authorId).isEmpty()) {
            throw new NotFoundException("Resource '" + authorId + "' not found");
        }
        return HandlerResult.created(repository.save(new Comment(repository.nextId(), body, postId, authorId)));
    }
}
