package com.etl.core;

import java.util.Objects;

/** Source of one output field plus the separator used when the source yields several values. */
public record FieldMapping(Locator locator, String separator) {
    public static final String DEFAULT_SEPARATOR = "; ";

    public FieldMapping {
        locator = Objects.requireNonNull(locator, "locator");
        separator = Objects.requireNonNull(separator, "separator");
    }

    public static FieldMapping of(Locator locator) {
        return new FieldMapping(locator, DEFAULT_SEPARATOR);
    }
}
