package com.example.jsonapi.document;

import org.springframework.lang.Nullable;

/**
 * Hook invoked once per error, before the error document is serialized.
 */
@FunctionalInterface
public interface ErrorLogger {

    void log(ErrorObject error, @Nullable Throwable cause);
}
