package com.etl.core;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Key/value state shared by the inputs and outputs of a pipeline and handed down to chained
 * pipelines. Values are stored as given; the session never interprets them.
 */
public final class Session {
    private final Map<String, Object> values;

    public Session() {
        this.values = new LinkedHashMap<>();
    }

    private Session(Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values);
    }

    /** The stored value as an opaque reference, {@code null} when absent. */
    public Object get(String key) {
        return values.get(key);
    }

    public <T> T get(String key, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return type.cast(values.get(key));
    }

    /**
     * The stored value in a multi-value context: list elements, map entries, or a scalar as a
     * single element. Empty when the key is absent.
     */
    public List<Object> values(String key) {
        if (!values.containsKey(key)) return List.of();
        Object value = values.get(key);
        if (value instanceof List<?> list) return Collections.unmodifiableList(new ArrayList<>(list));
        if (value instanceof Map<?, ?> map) {
            List<Object> entries = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), entry.getValue()));
            }
            return Collections.unmodifiableList(entries);
        }
        return Collections.singletonList(value);
    }

    public Session set(String key, Object value) {
        values.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }

    public Session setAll(Map<String, ?> entries) {
        Objects.requireNonNull(entries, "entries");
        for (Map.Entry<String, ?> entry : entries.entrySet()) set(entry.getKey(), entry.getValue());
        return this;
    }

    /** Existence only; a key stored with a {@code null} value still counts. */
    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Session remove(String key) {
        values.remove(key);
        return this;
    }

    /** Discards every variable and starts over with {@code entries}. */
    public Session replace(Map<String, ?> entries) {
        Objects.requireNonNull(entries, "entries");
        values.clear();
        return setAll(entries);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }

    /** Independent copy of the table. Values themselves are shared, not cloned. */
    public Session copy() {
        return new Session(values);
    }
}
