package com.example.jsonapi.exception;

import com.example.jsonapi.common.JsonApiConstants;

// Preferred response type is not the document media type (406).
public class NotAcceptableException extends JsonApiException {

    public static final String DEFAULT_DETAIL = "Client must accept " + JsonApiConstants.MEDIA_TYPE;

    public NotAcceptableException() {
        super(406, DEFAULT_DETAIL);
    }

    public NotAcceptableException(String detail) {
        super(406, detail);
    }
}
