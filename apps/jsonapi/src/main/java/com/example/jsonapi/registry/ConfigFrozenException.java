package com.example.jsonapi.registry;

/**
 * Raised when a declaration or table mutation is attempted after {@link ResourceConfig#freeze()}.
 */
public class ConfigFrozenException extends IllegalStateException {

    public ConfigFrozenException(String message) {
        super(message);
    }
}
