package com.example.jsonapi.blog.model;

import org.springframework.lang.Nullable;

/**
 * @param postId post the comment is attached to, {@code null} when detached
 */
public record Comment(String id, String body, @Nullable String postId, @Nullable String authorId) {

    public Comment withPost(@Nullable String postId) {
        return new Comment(id, body, postId, authorId);
    }
}
