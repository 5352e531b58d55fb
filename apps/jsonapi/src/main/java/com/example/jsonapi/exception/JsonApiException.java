package com.example.jsonapi.exception;

import com.example.jsonapi.document.ErrorObject;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Base of the error taxonomy. Every subclass maps to exactly one HTTP status and is
 * rendered through the same error-document path.
 */
public class JsonApiException extends RuntimeException {

    private final int status;
    private final Map<String, Object> meta;

    public JsonApiException(int status, String detail) {
        this(status, detail, null, null);
    }

    public JsonApiException(int status, String detail, @Nullable Map<String, Object> meta) {
        this(status, detail, meta, null);
    }

    public JsonApiException(int status, String detail, @Nullable Map<String, Object> meta, @Nullable Throwable cause) {
        super(detail, cause);
        this.status = status;
        this.meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    public int getStatus() {
        return status;
    }

    public Map<String, Object> getMeta() {
        return meta;
    }

    /**
     * Reason phrase for the status, e.g. "Not Found".
     */
    @NonNull
    public String getTitle() {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved != null ? resolved.getReasonPhrase() : "HTTP Error";
    }

    /**
     * Error objects this exception renders as. Most errors render as one.
     */
    @NonNull
    public List<ErrorObject> toErrorObjects() {
        return List.of(ErrorObject.of(status, getTitle(), getMessage(), meta.isEmpty() ? null : meta));
    }
}
