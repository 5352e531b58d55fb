package com.example.jsonapi.exception;

import com.example.jsonapi.document.ErrorObject;

import java.util.List;
import java.util.Set;

/**
 * A fault reduced to what the error document needs.
 *
 * @param status         HTTP status of the response
 * @param errors         error objects, at least one
 * @param cause          the original fault
 * @param allowedMethods methods for the {@code Allow} header on 405, empty otherwise
 */
public record NormalizedError(int status, List<ErrorObject> errors, Throwable cause, Set<String> allowedMethods) {
}
