package com.etl.core;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.Objects;

/**
 * Instantiates a component class by name: through a public {@code (Map)} constructor when it has
 * one, otherwise through its public no-arg constructor.
 */
final class ReflectiveComponentFactory<T> implements ComponentRegistry.Factory<T> {
    private final Class<? extends T> type;
    private final String reference;

    private ReflectiveComponentFactory(Class<? extends T> type, String reference) {
        this.type = type;
        this.reference = reference;
    }

    static <T> ReflectiveComponentFactory<T> forName(String className, Class<T> kind) {
        Objects.requireNonNull(className, "className");
        Class<?> loaded;
        try {
            loaded = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Unknown " + kind.getSimpleName().toLowerCase() + " class: " + className, e);
        }
        if (!kind.isAssignableFrom(loaded)) {
            throw new IllegalArgumentException(className + " does not implement " + kind.getName());
        }
        return new ReflectiveComponentFactory<>(loaded.asSubclass(kind), className);
    }

    @Override
    public T create(Map<String, Object> options) {
        try {
            Constructor<? extends T> withOptions = optionsConstructor();
            if (withOptions != null) return withOptions.newInstance(options);
            if (!options.isEmpty()) {
                throw new IllegalArgumentException(reference + " takes no options but got " + options.keySet());
            }
            return type.getConstructor().newInstance();
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) throw runtime;
            throw new IllegalStateException("Failed to instantiate: " + reference, cause);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to instantiate: " + reference, e);
        }
    }

    private Constructor<? extends T> optionsConstructor() {
        try {
            return type.getConstructor(Map.class);
        } catch (NoSuchMethodException e) {
            return null;
        }
    }
}
