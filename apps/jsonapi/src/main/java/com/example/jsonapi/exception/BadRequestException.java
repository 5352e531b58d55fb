package com.example.jsonapi.exception;

// Malformed payload or negotiation input (400).
public class BadRequestException extends JsonApiException {

    public static final String DEFAULT_DETAIL = "Malformed request";

    public BadRequestException() {
        super(400, DEFAULT_DETAIL);
    }

    public BadRequestException(String detail) {
        super(400, detail);
    }

    public BadRequestException(String detail, Throwable cause) {
        super(400, detail, null, cause);
    }
}
