package com.etl.core;

/**
 * Computed field. The result is used verbatim; a {@link java.util.Collection} counts as several
 * values and {@code null} as no value.
 */
@FunctionalInterface
public interface FieldRule {
    Object apply(Pipeline pipeline, Object record) throws Exception;
}
