package com.example.jsonapi.document;

/**
 * Resource linkage: the {@code type}/{@code id} pair inside relationship data.
 */
public record ResourceIdentifier(String type, String id) {
}
