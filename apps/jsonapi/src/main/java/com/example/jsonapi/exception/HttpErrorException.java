package com.example.jsonapi.exception;

/**
 * Any 4xx/5xx status without a dedicated type, raised by {@code halt}.
 */
public class HttpErrorException extends JsonApiException {

    public HttpErrorException(int status, String detail) {
        super(status, detail);
        if (status < 400 || status > 599) {
            throw new IllegalArgumentException("HTTP error status must be in 400..599, got " + status);
        }
    }
}
