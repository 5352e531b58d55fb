package com.example.jsonapi.exception;

import com.example.jsonapi.document.ErrorObject;
import org.springframework.lang.NonNull;

import java.util.List;

/**
 * Semantic validation failure (422). May carry one error object per failed constraint.
 */
public class UnprocessableEntityException extends JsonApiException {

    public static final String DEFAULT_DETAIL = "Request payload failed validation";

    private final List<ErrorObject> errors;

    public UnprocessableEntityException() {
        this(DEFAULT_DETAIL);
    }

    public UnprocessableEntityException(String detail) {
        super(422, detail);
        this.errors = List.of();
    }

    public UnprocessableEntityException(String detail, List<ErrorObject> errors) {
        super(422, detail);
        this.errors = List.copyOf(errors);
    }

    @Override
    @NonNull
    public List<ErrorObject> toErrorObjects() {
        return errors.isEmpty() ? super.toErrorObjects() : errors;
    }
}
