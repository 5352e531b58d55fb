package com.example.jsonapi.blog.repository;

import com.example.jsonapi.blog.model.Comment;
import com.example.jsonapi.blog.model.Person;
import com.example.jsonapi.blog.model.Post;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * In-memory store for the blog resources. Supports whole-store snapshots so mutating
 * requests can be rolled back.
 */
@Slf4j
@Repository
public class InMemoryBlogRepository {

    private final Map<String, Post> posts = new ConcurrentHashMap<>();
    private final Map<String, Comment> comments = new ConcurrentHashMap<>();
    private final Map<String, Person> people = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public String nextId() {
        return String.valueOf(sequence.incrementAndGet());
    }

    // posts

    public Optional<Post> findPost(String id) {
        return Optional.ofNullable(posts.get(id));
    }

    public List<Post> findPosts() {
        return sorted(posts.values().stream().toList(), Post::id);
    }

    public List<Post> findPostsByAuthor(String authorId) {
        return findPosts().stream()
                .filter(post -> Objects.equals(post.authorId(), authorId))
                .toList();
    }

    public Post save(Post post) {
        posts.put(post.id(), post);
        return post;
    }

    public void deletePost(String id) {
        posts.remove(id);
        comments.replaceAll((commentId, comment) -> id.equals(comment.postId()) ? comment.withPost(null) : comment);
    }

    // comments

    public Optional<Comment> findComment(String id) {
        return Optional.ofNullable(comments.get(id));
    }

    public List<Comment> findComments() {
        return sorted(comments.values().stream().toList(), Comment::id);
    }

    public List<Comment> findCommentsByPost(String postId) {
        return findComments().stream()
                .filter(comment -> postId.equals(comment.postId()))
                .toList();
    }

    public Comment save(Comment comment) {
        comments.put(comment.id(), comment);
        return comment;
    }

    public void deleteComment(String id) {
        comments.remove(id);
    }

    // people

    public Optional<Person> findPerson(String id) {
        return Optional.ofNullable(people.get(id));
    }

    public List<Person> findPeople() {
        return sorted(people.values().stream().toList(), Person::id);
    }

    public Person save(Person person) {
        people.put(person.id(), person);
        return person;
    }

    // snapshots

    public Snapshot snapshot() {
        return new Snapshot(Map.copyOf(posts), Map.copyOf(comments), Map.copyOf(people), sequence.get());
    }

    public void restore(Snapshot snapshot) {
        posts.clear();
        posts.putAll(snapshot.posts());
        comments.clear();
        comments.putAll(snapshot.comments());
        people.clear();
        people.putAll(snapshot.people());
        sequence.set(snapshot.sequence());
        log.debug("Restored blog repository snapshot: posts={}, comments={}, people={}",
                posts.size(), comments.size(), people.size());
    }

    public void reset() {
        restore(new Snapshot(Map.of(), Map.of(), Map.of(), 0));
    }

    private static <T> List<T> sorted(List<T> values, Function<T, String> id) {
        return values.stream()
                .sorted(Comparator.comparing((T value) -> id.apply(value).length())
                        .thenComparing(id))
                .toList();
    }

    public record Snapshot(
            Map<String, Post> posts,
            Map<String, Comment> comments,
            Map<String, Person> people,
            long sequence
    ) {}
}
