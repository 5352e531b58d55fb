package com.example.jsonapi.exception;

import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.function.Function;

/**
 * Status-to-error mapping and the {@code halt} entry point.
 */
public final class JsonApiErrors {

    private static final Map<Integer, Function<String, JsonApiException>> ERROR_CODES = Map.of(
            400, BadRequestException::new,
            403, ForbiddenException::new,
            404, NotFoundException::new,
            405, MethodNotAllowedException::new,
            406, NotAcceptableException::new,
            409, ConflictException::new,
            415, UnsupportedMediaTypeException::new,
            422, UnprocessableEntityException::new);

    private JsonApiErrors() {}

    /**
     * Typed error for a status in 400..599, or {@code null} for anything else.
     */
    @Nullable
    public static JsonApiException forStatus(int status, @Nullable String detail) {
        Function<String, JsonApiException> factory = ERROR_CODES.get(status);
        if (factory != null) {
            return detail != null ? factory.apply(detail) : defaultFor(status);
        }
        if (status >= 400 && status < 600) {
            return new HttpErrorException(status, detail != null ? detail : "HTTP error " + status);
        }
        return null;
    }

    /**
     * Stop processing the request. Error statuses always become typed errors so they reach
     * the error document; other statuses short-circuit with the raw body.
     */
    public static RuntimeException halt(int status, @Nullable String body) {
        JsonApiException error = forStatus(status, body);
        throw error != null ? error : new HaltException(status, body);
    }

    private static JsonApiException defaultFor(int status) {
        return switch (status) {
            case 400 -> new BadRequestException();
            case 403 -> new ForbiddenException();
            case 404 -> new NotFoundException();
            case 405 -> new MethodNotAllowedException();
            case 406 -> new NotAcceptableException();
            case 409 -> new ConflictException();
            case 415 -> new UnsupportedMediaTypeException();
            case 422 -> new UnprocessableEntityException();
            default -> new HttpErrorException(status, "HTTP error " + status);
        };
    }
}
