package com.example.jsonapi.blog.resource;

import com.example.jsonapi.blog.model.Person;
import com.example.jsonapi.blog.model.Post;
import com.example.jsonapi.blog.repository.InMemoryBlogRepository;
import com.example.jsonapi.document.HandlerResult;
import com.example.jsonapi.document.ResourceObject;
import com.example.jsonapi.exception.UnprocessableEntityException;
import com.example.jsonapi.resource.ResourceDeclaration;
import com.example.jsonapi.resource.ResourceDefinition;
import com.example.jsonapi.resource.ResourceName;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@code /people}. Reads are usually restricted by configuration and reached through
 * sideloads from posts and comments.
 */
@Component
@RequiredArgsConstructor
public class PersonResource implements ResourceDefinition<Person> {

    private final InMemoryBlogRepository repository;

    @Override
    public String name() {
        return "person";
    }

    @Override
    public void declare(ResourceDeclaration<Person> resource) {
        resource.finder(repository::findPerson)
                .serializer(this::serialize)
                .index(ctx -> HandlerResult.ok(repository.findPeople()))
                .show(ctx -> HandlerResult.ok(ctx.resource()))
                .create(ctx -> {
                    ctx.sanityCheck();
                    String name = Linkage.stringAttribute(ctx.attributes(), "name");
                    if (name == null || name.isBlank()) {
                        throw new UnprocessableEntityException("Person name must not be blank");
                    }
                    String email = Linkage.stringAttribute(ctx.attributes(), "email");
                    return HandlerResult.created(repository.save(new Person(repository.nextId(), name, email)));
                })
                .hasMany("posts", "posts", posts -> posts.fetch(ctx -> {
                    Person person = ctx.resource();
                    return HandlerResult.ok(repository.findPostsByAuthor(person.id()));
                }));
    }

    ResourceObject serialize(ResourceName type, Person person) {
        return ResourceObject.builder(type.value(), person.id())
                .attribute("name", person.name())
                .attribute("email", person.email())
                .toMany("posts", "posts", repository.findPostsByAuthor(person.id()).stream().map(Post::id).toList())
                .build();
    }
}
