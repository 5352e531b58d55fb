package com.example.jsonapi.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Guards values taken from the request before they reach logs or error details.
 */
public final class StringSanitizer {

    private static final int LOG_LIMIT = 64;
    private static final int HEADER_LIMIT = 256;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, LOG_LIMIT);
    }

    /**
     * Drops control characters and truncates to {@code maxLength} code units.
     */
    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        StringBuilder out = new StringBuilder(Math.min(value.length(), maxLength));
        for (int i = 0; i < value.length() && out.length() < maxLength; i++) {
            char c = value.charAt(i);
            if (!Character.isISOControl(c)) {
                out.append(c);
            }
        }
        return out.toString();
    }

    @Nullable
    public static String headerValue(@Nullable String value) {
        return headerValue(value, HEADER_LIMIT);
    }

    /**
     * Trimmed header value, or {@code null} when absent or blank.
     */
    @Nullable
    public static String headerValue(@Nullable String value, int maxLength) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
