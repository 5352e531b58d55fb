package com.example.jsonapi.exception;

import com.example.jsonapi.common.util.Inflector;
import com.example.jsonapi.document.ErrorObject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.web.server.ResponseStatusException;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Maps any fault to a status and its error objects.
 *
 * <ul>
 *   <li>{@link JsonApiException}: its own status and error objects</li>
 *   <li>{@link ConstraintViolationException}: 422, one error per violation pointing at the attribute</li>
 *   <li>{@link ResponseStatusException}: the typed error for its status</li>
 *   <li>anything else: 500 with a generic detail, the cause kept for logging only</li>
 * </ul>
 */
public class ErrorNormalizer {

    public static final String INTERNAL_ERROR_DETAIL = "An unexpected error occurred";

    @NonNull
    public NormalizedError normalize(@NonNull Throwable error) {
        if (error instanceof JsonApiException jsonApiException) {
            Set<String> allowed = error instanceof MethodNotAllowedException notAllowed
                    ? notAllowed.getAllowedMethods()
                    : Set.of();
            return new NormalizedError(jsonApiException.getStatus(), jsonApiException.toErrorObjects(), error, allowed);
        }
        if (error instanceof ConstraintViolationException violations) {
            return new NormalizedError(422, violationErrors(violations), error, Set.of());
        }
        if (error instanceof ResponseStatusException statusException) {
            JsonApiException typed = JsonApiErrors.forStatus(statusException.getStatusCode().value(), statusException.getReason());
            if (typed != null) {
                return new NormalizedError(typed.getStatus(), typed.toErrorObjects(), error, Set.of());
            }
        }
        return new NormalizedError(500,
                List.of(ErrorObject.of(500, HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase(), INTERNAL_ERROR_DETAIL, null)),
                error, Set.of());
    }

    private List<ErrorObject> violationErrors(ConstraintViolationException violations) {
        String title = HttpStatus.UNPROCESSABLE_ENTITY.getReasonPhrase();
        List<ErrorObject> errors = violations.getConstraintViolations().stream()
                .sorted(Comparator.comparing((ConstraintViolation<?> v) -> v.getPropertyPath().toString()))
                .map(v -> ErrorObject.atPointer(422, title, v.getMessage(), pointer(v)))
                .toList();
        return errors.isEmpty()
                ? List.of(ErrorObject.of(422, title, UnprocessableEntityException.DEFAULT_DETAIL, null))
                : errors;
    }

    private static String pointer(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        String leaf = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
        return leaf.isEmpty() ? "/data" : "/data/attributes/" + Inflector.dasherize(leaf);
    }
}
