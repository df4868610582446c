package com.etl.core.output;

import com.etl.core.Options;
import com.etl.core.Output;
import com.etl.core.Pipeline;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/** Hands every mapped record to a {@link RecordCallback}. Option: {@code callback}. */
public final class CallbackOutput implements Output {

    @FunctionalInterface
    public interface RecordCallback {
        /** {@code false} rejects the record. */
        boolean accept(Pipeline pipeline, Map<String, Object> record) throws IOException;
    }

    private final RecordCallback callback;

    public CallbackOutput(RecordCallback callback) {
        this.callback = Objects.requireNonNull(callback, "callback");
    }

    public CallbackOutput(Map<String, Object> options) {
        this(Options.required(options, "callback", RecordCallback.class));
    }

    @Override
    public void open(Pipeline pipeline) {
    }

    @Override
    public boolean write(Pipeline pipeline, Map<String, Object> record) throws IOException {
        return callback.accept(pipeline, record);
    }

    @Override
    public void close(Pipeline pipeline) {
    }
}
