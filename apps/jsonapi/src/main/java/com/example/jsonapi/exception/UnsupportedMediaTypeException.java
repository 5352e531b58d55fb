package com.example.jsonapi.exception;

import com.example.jsonapi.common.JsonApiConstants;

// Request body is not the document media type (415).
public class UnsupportedMediaTypeException extends JsonApiException {

    public static final String DEFAULT_DETAIL = "Request body must be " + JsonApiConstants.MEDIA_TYPE;

    public UnsupportedMediaTypeException() {
        super(415, DEFAULT_DETAIL);
    }

    public UnsupportedMediaTypeException(String detail) {
        super(415, detail);
    }
}
