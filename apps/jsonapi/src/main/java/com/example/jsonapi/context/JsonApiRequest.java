package com.example.jsonapi.context;

import com.example.jsonapi.common.util.StringSanitizer;
import com.example.jsonapi.exception.BadRequestException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.lang.Nullable;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Transport-neutral request seen by the dispatcher.
 *
 * @param method      HTTP method
 * @param path        path below the JSON:API mount point as sent, still percent-encoded,
 *                    e.g. {@code /posts/42}
 * @param headers     request headers
 * @param queryParams raw query parameters
 * @param body        raw body, {@code null} or empty when absent
 */
public record JsonApiRequest(
        HttpMethod method,
        String path,
        HttpHeaders headers,
        MultiValueMap<String, String> queryParams,
        @Nullable String body
) {
    public JsonApiRequest {
        headers = headers == null ? new HttpHeaders() : headers;
        queryParams = queryParams == null ? new LinkedMultiValueMap<>() : queryParams;
    }

    /**
     * Internal GET used for sideload fetches. Carries the parent's headers so the same
     * caller is seen, but no query parameters and no body.
     */
    public static JsonApiRequest nestedGet(String path, HttpHeaders headers) {
        return new JsonApiRequest(HttpMethod.GET, path, headers, new LinkedMultiValueMap<>(), null);
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }

    /**
     * Non-empty path segments, percent-decoded.
     *
     * @throws BadRequestException when a segment carries a malformed escape
     */
    public List<String> segments() {
        return Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty())
                .map(JsonApiRequest::decode)
                .toList();
    }

    private static String decode(String segment) {
        try {
            return UriUtils.decode(segment, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Malformed path segment '" + StringSanitizer.forLog(segment) + "'", e);
        }
    }
}
