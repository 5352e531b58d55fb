package com.example.jsonapi.resource;

import com.example.jsonapi.common.util.Inflector;
import org.springframework.lang.NonNull;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Canonical resource name: plural, hyphen-separated, lower case.
 *
 * <p>Derived once from a human-supplied name ("Post", "blog_post", "BlogPost") and used as
 * the only key for authorization and sideload lookups. Canonicalization is idempotent:
 * {@code of(of(x).value())} equals {@code of(x)}.
 *
 * @param value the canonical form, e.g. {@code "blog-posts"}
 */
public record ResourceName(String value) implements Comparable<ResourceName> {

    public ResourceName {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Resource name must not be blank");
        }
    }

    /**
     * Canonicalize a raw name. Only the last word is pluralized.
     */
    @NonNull
    public static ResourceName of(@NonNull String rawName) {
        Objects.requireNonNull(rawName, "rawName");
        String dasherized = Inflector.dasherize(rawName);
        String[] words = Arrays.stream(dasherized.split("-"))
                .filter(w -> !w.isEmpty())
                .toArray(String[]::new);
        if (words.length == 0) {
            throw new IllegalArgumentException("Resource name must contain at least one word: '" + rawName + "'");
        }
        words[words.length - 1] = Inflector.pluralize(words[words.length - 1]);
        return new ResourceName(Arrays.stream(words).collect(Collectors.joining("-")));
    }

    @Override
    public int compareTo(@NonNull ResourceName other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
