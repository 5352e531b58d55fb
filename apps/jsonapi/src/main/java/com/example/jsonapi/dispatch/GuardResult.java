package com.example.jsonapi.dispatch;

import com.example.jsonapi.exception.JsonApiException;
import org.springframework.lang.Nullable;

/**
 * Outcome of a guard. A failure may carry the error the guard would have raised.
 *
 * @param passed whether the guard holds
 * @param error  error to raise if no route passes, {@code null} for a silent failure
 */
public record GuardResult(boolean passed, @Nullable JsonApiException error) {

    public static final GuardResult PASS = new GuardResult(true, null);

    private static final GuardResult SILENT_FAILURE = new GuardResult(false, null);

    public static GuardResult fail() {
        return SILENT_FAILURE;
    }

    public static GuardResult fail(JsonApiException error) {
        return new GuardResult(false, error);
    }
}
