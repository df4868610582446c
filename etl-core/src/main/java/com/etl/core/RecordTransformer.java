package com.etl.core;

import com.etl.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Turns one raw record into one output record: normalize, filter, constants, mapping, write.
 * Built once per run from a snapshot of the pipeline configuration.
 */
final class RecordTransformer {
    private static final Logger log = LoggerFactory.getLogger(RecordTransformer.class);

    private final Map<String, FieldMapping> mapping;
    private final Map<String, Object> constants;
    private final RecordFilter filter;
    private final FieldReader reader;
    private final Output output;
    private final boolean trimWhitespace;

    RecordTransformer(Map<String, FieldMapping> mapping,
                      Map<String, Object> constants,
                      RecordFilter filter,
                      FieldReader reader,
                      Output output,
                      boolean trimWhitespace) {
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        this.constants = Objects.requireNonNull(constants, "constants");
        this.filter = filter;
        this.reader = Objects.requireNonNull(reader, "reader");
        this.output = Objects.requireNonNull(output, "output");
        this.trimWhitespace = trimWhitespace;
    }

    boolean process(Pipeline pipeline, Object raw) {
        var rec = Metrics.recorder();
        String name = pipeline.name();

        Object record = Records.normalize(raw, trimWhitespace);
        long number = pipeline.beginRecord(record);
        rec.onRecordRead(name);

        boolean written;
        try {
            if (filter != null && !filter.test(pipeline, record)) {
                rec.onRecordFiltered(name);
                log.debug("[{}] record #{} dropped by filter", name, number);
                return false;
            }

            // fresh map per record: outputs are allowed to keep it
            Map<String, Object> out = new LinkedHashMap<>(constants);
            for (Map.Entry<String, FieldMapping> entry : mapping.entrySet()) {
                FieldMapping field = entry.getValue();
                out.put(entry.getKey(), combine(reader.read(field.locator(), record), field.separator()));
            }

            written = output.write(pipeline, out);
        } catch (PipelineException e) {
            throw e;
        } catch (Exception e) {
            throw new PipelineException(name, number,
                "Pipeline '" + name + "' failed on record #" + number + ": " + e.getMessage(), e);
        }

        if (written) {
            rec.onRecordWritten(name);
        } else {
            rec.onWriteRejected(name);
            log.debug("[{}] record #{} rejected by output", name, number);
        }
        pipeline.status(StatusType.STATUS, null);
        return written;
    }

    /** No value, the value itself, or the non-null values joined with {@code separator}. */
    static Object combine(List<Object> values, String separator) {
        if (values.isEmpty()) return null;
        if (values.size() == 1) return values.get(0);

        List<Object> present = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value != null) present.add(value);
        }
        if (present.isEmpty()) return null;

        StringJoiner joined = new StringJoiner(separator);
        for (Object value : present) joined.add(String.valueOf(value));
        return joined.toString();
    }
}
