package com.example.jsonapi.document;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Serializer contract used by the request lifecycle.
 */
public interface DocumentSerializer {

    /**
     * Serialize the success document built from a handler's logical result.
     */
    @NonNull
    String serializeResponseBody(@NonNull SuccessDocument document);

    /**
     * Serialize one or more errors. The logger, when given, is called once per error
     * before serialization.
     */
    @NonNull
    String serializeErrors(@NonNull List<ErrorObject> errors, @Nullable ErrorLogger logger, @Nullable Throwable cause);
}
