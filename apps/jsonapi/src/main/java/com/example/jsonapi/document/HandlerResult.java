package com.example.jsonapi.document;

import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logical result of a handler: a status plus the domain object(s) to render.
 * Rendering into a document happens in the lifecycle's after-hook.
 */
public final class HandlerResult {

    private final int status;
    private final Object data;
    private final Map<String, Object> meta;

    private HandlerResult(int status, @Nullable Object data, Map<String, Object> meta) {
        this.status = status;
        this.data = data;
        this.meta = meta;
    }

    public static HandlerResult ok(@Nullable Object data) {
        return new HandlerResult(200, data, Map.of());
    }

    public static HandlerResult created(Object data) {
        return new HandlerResult(201, data, Map.of());
    }

    public static HandlerResult accepted() {
        return new HandlerResult(202, null, Map.of());
    }

    public static HandlerResult noContent() {
        return new HandlerResult(204, null, Map.of());
    }

    public HandlerResult withMeta(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(meta);
        copy.put(key, value);
        return new HandlerResult(status, data, copy);
    }

    public int status() {
        return status;
    }

    @Nullable
    public Object data() {
        return data;
    }

    public Map<String, Object> meta() {
        return meta;
    }

    /**
     * Only 200 and 201 responses carry a serialized success document.
     */
    public boolean hasDocument() {
        return status == 200 || status == 201;
    }
}
