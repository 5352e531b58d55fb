package com.example.jsonapi.lifecycle;

import com.example.jsonapi.common.JsonApiConstants;
import com.example.jsonapi.context.JsonApiRequest;
import com.example.jsonapi.exception.BadRequestException;
import com.example.jsonapi.exception.NotAcceptableException;
import com.example.jsonapi.exception.UnsupportedMediaTypeException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Accept and Content-Type checks for client requests.
 *
 * <ul>
 *   <li>The highest-quality Accept entry must be the JSON:API media type with no parameters
 *       other than {@code q}; a missing Accept header counts as {@code *}/{@code *}</li>
 *   <li>A non-empty body must be sent as the JSON:API media type, optionally with a charset</li>
 * </ul>
 */
public class ContentNegotiator {

    public static final MediaType JSON_API = MediaType.parseMediaType(JsonApiConstants.MEDIA_TYPE);

    public void negotiate(@NonNull JsonApiRequest request) {
        checkAccept(request.headers());
        if (request.hasBody()) {
            checkContentType(request.headers());
        }
    }

    private void checkAccept(HttpHeaders headers) {
        List<String> values = headers.get(HttpHeaders.ACCEPT);
        List<MediaType> accepted = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                accepted.addAll(parseAll(value));
            }
        }
        if (accepted.isEmpty()) {
            accepted.add(MediaType.ALL);
        }
        // stable sort keeps header order among equal q values
        accepted.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
        MediaType preferred = accepted.get(0);
        boolean onlyQuality = preferred.getParameters().keySet().stream().allMatch("q"::equalsIgnoreCase);
        if (!JSON_API.equalsTypeAndSubtype(preferred) || !onlyQuality) {
            throw new NotAcceptableException();
        }
    }

    private void checkContentType(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.CONTENT_TYPE);
        if (value == null || value.isBlank()) {
            throw new UnsupportedMediaTypeException();
        }
        MediaType contentType = parse(value);
        boolean onlyCharset = contentType.getParameters().keySet().stream().allMatch("charset"::equalsIgnoreCase);
        if (!JSON_API.equalsTypeAndSubtype(contentType) || !onlyCharset) {
            throw new UnsupportedMediaTypeException();
        }
    }

    private static List<MediaType> parseAll(String value) {
        try {
            return MediaType.parseMediaTypes(value);
        } catch (InvalidMediaTypeException e) {
            throw new BadRequestException("Invalid media type: " + e.getMediaType(), e);
        }
    }

    private static MediaType parse(String value) {
        try {
            return MediaType.parseMediaType(value);
        } catch (InvalidMediaTypeException e) {
            throw new BadRequestException("Invalid media type: " + e.getMediaType(), e);
        }
    }
}
