package com.example.jsonapi.document;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * One entry of an error document's {@code errors} array.
 *
 * <h3>Format:</h3>
 * <pre>{@code
 * {
 *   "status": "404",
 *   "title": "Not Found",
 *   "detail": "Resource '42' not found",
 *   "source": { "pointer": "/data/attributes/title" },
 *   "meta": { "correlationId": "..." }
 * }
 * }</pre>
 *
 * @param status HTTP status as a string
 * @param title  reason phrase of the status
 * @param detail human-readable message
 * @param source JSON pointer or parameter that caused the error
 * @param meta   additional context
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorObject(
        String status,
        String title,
        String detail,
        Map<String, String> source,
        Map<String, Object> meta
) {
    public static ErrorObject of(int status, String title, String detail, @Nullable Map<String, Object> meta) {
        return new ErrorObject(String.valueOf(status), title, detail, null, meta);
    }

    /**
     * Error pointing at a member of the request document.
     */
    public static ErrorObject atPointer(int status, String title, String detail, String pointer) {
        return new ErrorObject(String.valueOf(status), title, detail, Map.of("pointer", pointer), null);
    }

    @JsonIgnore
    public int statusCode() {
        try {
            return Integer.parseInt(status);
        } catch (NumberFormatException e) {
            return 500;
        }
    }
}
