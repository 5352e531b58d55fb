package com.example.jsonapi.context;

import org.springframework.http.HttpHeaders;
import org.springframework.lang.Nullable;

/**
 * Fully rendered response handed back to the transport adapter.
 */
public record JsonApiResponse(int status, HttpHeaders headers, @Nullable String body) {

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }
}
