package com.etl.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Decorators composed around a {@link FieldReader} when a pipeline is built. */
public final class FieldReaders {
    private FieldReaders() {}

    /** Strips leading and trailing whitespace from string results, including rule results. */
    public static FieldReader trimming(FieldReader delegate) {
        Objects.requireNonNull(delegate, "delegate");
        return (locator, record) -> {
            List<Object> found = delegate.read(locator, record);
            List<Object> trimmed = new ArrayList<>(found.size());
            for (Object value : found) {
                trimmed.add(value instanceof String s ? s.strip() : value);
            }
            return trimmed;
        };
    }
}
