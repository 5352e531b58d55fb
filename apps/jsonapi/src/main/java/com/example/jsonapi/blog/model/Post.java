package com.example.jsonapi.blog.model;

import org.springframework.lang.Nullable;

/**
 * @param authorId id of the {@link Person} who wrote the post, {@code null} when unassigned
 */
public record Post(String id, String title, String body, @Nullable String authorId) {

    public Post withAuthor(@Nullable String authorId) {
        return new Post(id, title, body, authorId);
    }
}
