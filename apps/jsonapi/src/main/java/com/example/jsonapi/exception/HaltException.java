package com.example.jsonapi.exception;

import lombok.Getter;

// Immediate non-error response requested by a handler via halt(). Not an error document.
@Getter
public class HaltException extends RuntimeException {

    private final int status;
    private final String body;

    public HaltException(int status, String body) {
        super("Halted with status " + status, null, false, false);
        this.status = status;
        this.body = body;
    }
}
