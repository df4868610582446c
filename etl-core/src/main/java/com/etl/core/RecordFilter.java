package com.etl.core;

/**
 * Runs on every record before mapping. It may edit the record; returning {@code false} drops it.
 */
@FunctionalInterface
public interface RecordFilter {
    boolean test(Pipeline pipeline, Object record) throws Exception;
}
