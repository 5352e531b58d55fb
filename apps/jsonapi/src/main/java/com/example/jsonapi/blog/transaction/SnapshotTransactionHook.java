package com.example.jsonapi.blog.transaction;

import com.example.jsonapi.blog.repository.InMemoryBlogRepository;
import com.example.jsonapi.lifecycle.TransactionHook;
import com.example.jsonapi.resource.ResourceName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Transaction hook over the in-memory repository: snapshot before, restore on failure.
 * Mutations are serialized so a rollback cannot discard a concurrent request's writes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotTransactionHook implements TransactionHook {

    private final InMemoryBlogRepository repository;

    @Override
    public synchronized <T> T inTransaction(ResourceName resourceName, Supplier<T> work) {
        InMemoryBlogRepository.Snapshot snapshot = repository.snapshot();
        try {
            return work.get();
        } catch (RuntimeException e) {
            log.info("Rolling back: resource={}, error={}", resourceName, e.getClass().getSimpleName());
            repository.restore(snapshot);
            throw e;
        }
    }
}
