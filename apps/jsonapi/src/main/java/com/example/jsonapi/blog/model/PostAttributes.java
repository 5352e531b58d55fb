package com.example.jsonapi.blog.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Writable attributes of a post, as read from a request payload.
 */
public record PostAttributes(
        @NotBlank(message = "must not be blank")
        @Size(max = 200, message = "must be at most 200 characters")
        String title,

        @Size(max = 10000, message = "must be at most 10000 characters")
        String body
) {
}
