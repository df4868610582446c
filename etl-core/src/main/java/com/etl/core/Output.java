package com.etl.core;

import java.io.IOException;
import java.util.Map;

/**
 * Destination of mapped records. Opened once, written many times, closed once per run.
 */
public interface Output {

    void open(Pipeline pipeline) throws IOException;

    /**
     * Persists one record. {@code false} rejects the record without aborting the run; throw to
     * abort. Implementations may keep the map, it is never reused.
     */
    boolean write(Pipeline pipeline, Map<String, Object> record) throws IOException;

    void close(Pipeline pipeline) throws IOException;
}
