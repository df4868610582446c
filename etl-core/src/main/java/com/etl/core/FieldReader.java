package com.etl.core;

import java.util.List;

/**
 * Reads values out of a record. {@link FieldResolver} is the base implementation; decorators from
 * {@link FieldReaders} post-process what it returns.
 */
@FunctionalInterface
public interface FieldReader {

    /** Every match, in structural order. Never {@code null}. */
    List<Object> read(Locator locator, Object record) throws Exception;

    /** The first match, or {@code null} when nothing matches. */
    default Object first(Locator locator, Object record) throws Exception {
        List<Object> found = read(locator, record);
        return found.isEmpty() ? null : found.get(0);
    }
}
