package com.etl.core;

import java.util.Map;
import java.util.Objects;

/** Typed reads from the loosely typed option maps given to inputs and outputs. */
public final class Options {
    private Options() {}

    public static String string(Map<String, ?> options, String name, String defaultValue) {
        Object value = options.get(name);
        return value == null ? defaultValue : value.toString();
    }

    public static int integer(Map<String, ?> options, String name, int defaultValue) {
        Object value = options.get(name);
        if (value == null) return defaultValue;
        if (value instanceof Number number) return number.intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option '" + name + "' must be an integer: " + value, e);
        }
    }

    public static boolean bool(Map<String, ?> options, String name, boolean defaultValue) {
        Object value = options.get(name);
        if (value == null) return defaultValue;
        if (value instanceof Boolean b) return b;
        return Boolean.parseBoolean(value.toString().trim());
    }

    public static <T> T get(Map<String, ?> options, String name, Class<T> type) {
        Objects.requireNonNull(type, "type");
        Object value = options.get(name);
        if (value == null) return null;
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                "Option '" + name + "' must be a " + type.getSimpleName() + ", got " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    public static <T> T required(Map<String, ?> options, String name, Class<T> type) {
        T value = get(options, name, type);
        if (value == null) throw new IllegalArgumentException("Option '" + name + "' is required");
        return value;
    }
}
