package com.etl.core.output;

import com.etl.core.Options;
import com.etl.core.Output;
import com.etl.core.Pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Collects mapped records in a list. With the {@code sessionKey} option the list is also published
 * in the session when the output closes, so chained stages can read it.
 */
public final class MemoryOutput implements Output {
    private final List<Map<String, Object>> records = new ArrayList<>();
    private final String sessionKey;

    public MemoryOutput() {
        this.sessionKey = null;
    }

    public MemoryOutput(Map<String, Object> options) {
        this.sessionKey = Options.string(options, "sessionKey", null);
    }

    @Override
    public void open(Pipeline pipeline) {
        records.clear();
    }

    @Override
    public boolean write(Pipeline pipeline, Map<String, Object> record) {
        records.add(record);
        return true;
    }

    @Override
    public void close(Pipeline pipeline) {
        if (sessionKey != null) pipeline.session().set(sessionKey, records());
    }

    /** Records written by the last run, in write order. */
    public List<Map<String, Object>> records() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public void clear() {
        records.clear();
    }
}
