package com.etl.core;

import java.io.IOException;

/**
 * Source of raw records.
 *
 * <p>{@link Pipeline#process()} calls {@link #configure} once, then {@link #run}, which must hand
 * every record to {@link Pipeline#record(Object)} and return when the source is exhausted. The
 * input alone decides when that is, and may read several underlying files to get there.
 * {@link #finish} releases whatever {@code configure} acquired.
 */
public interface Input {

    /** One-time setup before the first record. A good place to register aliases. */
    void configure(Pipeline pipeline) throws IOException;

    void run(Pipeline pipeline) throws IOException;

    void finish(Pipeline pipeline) throws IOException;

    /** Name used in status messages. */
    default String describe(Pipeline pipeline) {
        return getClass().getSimpleName();
    }
}
