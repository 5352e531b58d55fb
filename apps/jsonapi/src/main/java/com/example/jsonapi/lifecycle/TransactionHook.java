package com.example.jsonapi.lifecycle;

import com.example.jsonapi.resource.ResourceName;

import java.util.function.Supplier;

/**
 * Wraps mutating handlers. Implementations roll back and rethrow the original error
 * unchanged when {@code work} fails.
 */
public interface TransactionHook {

    TransactionHook NONE = new TransactionHook() {
        @Override
        public <T> T inTransaction(ResourceName resourceName, Supplier<T> work) {
            return work.get();
        }
    };

    <T> T inTransaction(ResourceName resourceName, Supplier<T> work);
}
