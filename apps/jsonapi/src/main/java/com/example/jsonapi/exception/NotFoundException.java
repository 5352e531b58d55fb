package com.example.jsonapi.exception;

// Resource or route absent (404).
public class NotFoundException extends JsonApiException {

    public static final String DEFAULT_DETAIL = "Not found";

    public NotFoundException() {
        super(404, DEFAULT_DETAIL);
    }

    public NotFoundException(String detail) {
        super(404, detail);
    }

    public NotFoundException(String detail, Throwable cause) {
        super(404, detail, null, cause);
    }
}
