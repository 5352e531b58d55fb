package com.example.jsonapi.exception;

// Payload identity does not match the endpoint (409).
public class ConflictException extends JsonApiException {

    public static final String DEFAULT_DETAIL = "Resource in payload conflicts with endpoint";

    public ConflictException() {
        super(409, DEFAULT_DETAIL);
    }

    public ConflictException(String detail) {
        super(409, detail);
    }

    public ConflictException(String detail, Throwable cause) {
        super(409, detail, null, cause);
    }
}
