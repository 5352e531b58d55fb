package com.example.jsonapi.exception;

// Role check failed (403).
public class ForbiddenException extends JsonApiException {

    public static final String DEFAULT_DETAIL = "You are not authorized to perform this action";

    public ForbiddenException() {
        super(403, DEFAULT_DETAIL);
    }

    public ForbiddenException(String detail) {
        super(403, detail);
    }

    public ForbiddenException(String detail, Throwable cause) {
        super(403, detail, null, cause);
    }
}
