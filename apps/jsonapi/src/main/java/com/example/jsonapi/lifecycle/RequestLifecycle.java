package com.example.jsonapi.lifecycle;

import com.example.jsonapi.common.JsonApiConstants;
import com.example.jsonapi.context.JsonApiRequest;
import com.example.jsonapi.context.JsonApiResponse;
import com.example.jsonapi.context.QueryParameters;
import com.example.jsonapi.context.RequestContext;
import com.example.jsonapi.document.DocumentSerializer;
import com.example.jsonapi.document.ErrorLogger;
import com.example.jsonapi.document.HandlerResult;
import com.example.jsonapi.document.SuccessDocument;
import com.example.jsonapi.exception.ErrorNormalizer;
import com.example.jsonapi.exception.HaltException;
import com.example.jsonapi.exception.NormalizedError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.function.Function;

/**
 * Before and after hooks around every dispatched request, and the single path by which
 * faults become error documents.
 */
@Slf4j
public class RequestLifecycle {

    private final ContentNegotiator negotiator;
    private final DocumentSerializer serializer;
    private final ErrorNormalizer errorNormalizer;
    @Nullable
    private final ErrorLogger errorLogger;

    public RequestLifecycle(
            ContentNegotiator negotiator,
            DocumentSerializer serializer,
            ErrorNormalizer errorNormalizer,
            @Nullable ErrorLogger errorLogger) {
        this.negotiator = negotiator;
        this.serializer = serializer;
        this.errorNormalizer = errorNormalizer;
        this.errorLogger = errorLogger;
    }

    /**
     * Negotiate media types (client requests only) and normalize the query parameter groups.
     */
    @NonNull
    public QueryParameters before(@NonNull JsonApiRequest request, boolean sideload) {
        if (!sideload) {
            negotiator.negotiate(request);
        }
        return QueryParameters.parse(request.queryParams());
    }

    /**
     * 200 and 201 get the serialized success document; other statuses go out without a body.
     */
    @NonNull
    public JsonApiResponse after(
            @NonNull RequestContext ctx,
            @NonNull HandlerResult result,
            @NonNull Function<HandlerResult, SuccessDocument> renderer) {
        HttpHeaders headers = new HttpHeaders();
        headers.addAll(ctx.getResponseHeaders());
        headers.set(HttpHeaders.CONTENT_TYPE, JsonApiConstants.MEDIA_TYPE);
        String body = result.hasDocument()
                ? serializer.serializeResponseBody(renderer.apply(result))
                : null;
        return new JsonApiResponse(result.status(), headers, body);
    }

    /**
     * Catch-all: halts become raw responses, everything else an error document.
     */
    @NonNull
    public JsonApiResponse error(@NonNull Throwable error) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.CONTENT_TYPE, JsonApiConstants.MEDIA_TYPE);
        if (error instanceof HaltException halt) {
            return new JsonApiResponse(halt.getStatus(), headers, halt.getBody());
        }
        NormalizedError normalized = errorNormalizer.normalize(error);
        if (!normalized.allowedMethods().isEmpty()) {
            headers.set(HttpHeaders.ALLOW, String.join(",", normalized.allowedMethods()));
        }
        String body = serializer.serializeErrors(normalized.errors(), errorLogger, error);
        return new JsonApiResponse(normalized.status(), headers, body);
    }
}
