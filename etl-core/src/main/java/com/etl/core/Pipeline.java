package com.etl.core;

import com.etl.core.files.FileFinder;
import com.etl.core.files.NamePatterns;
import com.etl.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * One input, one output, and the mapping between them.
 *
 * <p>Configure through {@link #builder(String)} or the setters, then call {@link #process()}. The
 * input drives the run by calling {@link #record(Object)} once per raw record. {@code process()}
 * returns the pipeline itself so further stages can be {@linkplain #chain chained} onto it:
 *
 * <pre>{@code
 * Pipeline.builder("patients")
 *     .workIn(Path.of("/data/export"))
 *     .input("DelimitedText", Map.of("iname", "*.csv"))
 *     .mapping("Name", Locator.key("A"))
 *     .constant("Type", "Demographic")
 *     .output(store)
 *     .build()
 *     .process()
 *     .chain(b -> b.input("JsonFiles", Map.of("iname", "*.json")).mapping(Map.of(...)))
 *     .process();
 * }</pre>
 *
 * Not thread-safe. A pipeline runs once; reconfigure it or chain a new one to run again.
 */
public final class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    public enum State { UNCONFIGURED, CONFIGURED, RUNNING, FINISHED }

    private final String name;
    private final ComponentRegistry registry;
    private final StatusListener statusListener;
    private final boolean trimWhitespace;
    private final List<UnaryOperator<FieldReader>> readDecorators;
    private final AliasRegistry aliases = new AliasRegistry();
    private final Session session;
    private final FieldReader reader;

    private Path workIn;
    private Path dataIn;
    private Input input;
    private Output output;
    private final Map<String, FieldMapping> mapping = new LinkedHashMap<>();
    private final Map<String, Object> constants = new LinkedHashMap<>();
    private RecordFilter onRecord;

    private State state = State.UNCONFIGURED;
    private long count;
    private Object current;
    private RecordTransformer transformer;

    public Pipeline(String name) {
        this(name, ComponentRegistry.withDefaults(), new LoggingStatusListener(), true, List.of(), new Session());
    }

    private Pipeline(String name,
                     ComponentRegistry registry,
                     StatusListener statusListener,
                     boolean trimWhitespace,
                     List<UnaryOperator<FieldReader>> readDecorators,
                     Session session) {
        this.name = Objects.requireNonNull(name, "name");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.statusListener = Objects.requireNonNull(statusListener, "statusListener");
        this.trimWhitespace = trimWhitespace;
        this.readDecorators = List.copyOf(readDecorators);
        this.session = Objects.requireNonNull(session, "session");

        FieldReader composed = new FieldResolver(this, aliases);
        if (trimWhitespace) composed = FieldReaders.trimming(composed);
        for (UnaryOperator<FieldReader> decorator : this.readDecorators) {
            composed = Objects.requireNonNull(decorator.apply(composed), "decorator returned null");
        }
        this.reader = composed;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    // ---------------------------------------------------------------------------------------------
    // Configuration

    /** Sets the working directory and resets {@link #dataIn()} to it. Relative paths are made absolute. */
    public Pipeline workIn(Path path) {
        configuring();
        this.workIn = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        this.dataIn = this.workIn;
        return this;
    }

    /** Working directory = first subdirectory directly under {@code root} whose name matches (case insensitive glob). */
    public Pipeline workIn(Path root, String namePattern) {
        return workIn(root, NamePatterns.iname(namePattern));
    }

    public Pipeline workIn(Path root, Pattern namePattern) {
        Objects.requireNonNull(root, "root");
        Path match = findDirectory(root, namePattern, 1);
        return workIn(match);
    }

    /**
     * Data directory = first directory below {@link #workIn()} whose name matches (case insensitive
     * glob). An empty pattern resets it to the working directory.
     */
    public Pipeline dataIn(String namePattern) {
        if (namePattern == null || namePattern.isBlank()) {
            requireWorkIn();
            configuring();
            this.dataIn = workIn;
            return this;
        }
        return dataIn(NamePatterns.iname(namePattern));
    }

    public Pipeline dataIn(Pattern namePattern) {
        requireWorkIn();
        Path match = findDirectory(workIn, namePattern, Integer.MAX_VALUE);
        configuring();
        this.dataIn = match;
        return this;
    }

    public Pipeline input(Input input) {
        configuring();
        this.input = Objects.requireNonNull(input, "input");
        return this;
    }

    public Pipeline input(String name) {
        return input(name, Map.of());
    }

    public Pipeline input(String name, Map<String, ?> options) {
        return input(registry.createInput(name, new LinkedHashMap<>(options)));
    }

    public Pipeline output(Output output) {
        configuring();
        this.output = Objects.requireNonNull(output, "output");
        return this;
    }

    public Pipeline output(String name) {
        return output(name, Map.of());
    }

    public Pipeline output(String name, Map<String, ?> options) {
        return output(registry.createOutput(name, new LinkedHashMap<>(options)));
    }

    /** Adds (or replaces) the source of one output field. */
    public Pipeline mapping(String field, Locator locator) {
        return mapping(field, FieldMapping.of(locator));
    }

    /** Adds a field whose multiple values are joined with {@code separator} instead of {@code "; "}. */
    public Pipeline mapping(String field, Locator locator, String separator) {
        return mapping(field, new FieldMapping(locator, separator));
    }

    public Pipeline mapping(String field, FieldMapping source) {
        configuring();
        mapping.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(source, "source"));
        return this;
    }

    /** Replaces the whole mapping. */
    public Pipeline mapping(Map<String, FieldMapping> replacement) {
        Objects.requireNonNull(replacement, "replacement");
        configuring();
        mapping.clear();
        replacement.forEach(this::mapping);
        return this;
    }

    public Pipeline constant(String field, Object value) {
        configuring();
        constants.put(Objects.requireNonNull(field, "field"), value);
        return this;
    }

    /** Replaces all constants. */
    public Pipeline constants(Map<String, ?> replacement) {
        Objects.requireNonNull(replacement, "replacement");
        configuring();
        constants.clear();
        replacement.forEach(this::constant);
        return this;
    }

    public Pipeline onRecord(RecordFilter filter) {
        configuring();
        this.onRecord = filter;
        return this;
    }

    /** Adds an alias. Inputs register with {@code INPUT}, configuration with {@code USER}. */
    public Pipeline registerAlias(String alias, Locator target, AliasRegistry.Origin origin) {
        if (origin == AliasRegistry.Origin.USER) configuring();
        aliases.register(alias, target, origin);
        return this;
    }

    // ---------------------------------------------------------------------------------------------
    // Running

    /** Checks, in order: working folder, input, output, mapping or constants. */
    public Validation validate() {
        if (workIn == null) return Validation.invalid("The working folder was not set");
        if (input == null) return Validation.invalid("The \"input\" object was not set");
        if (output == null) return Validation.invalid("The \"output\" object was not set");
        if (mapping.isEmpty() && constants.isEmpty()) return Validation.invalid("The mapping was not set");
        return Validation.ok();
    }

    /**
     * Runs the pipeline: configure input, open output, let the input feed every record, close output,
     * finish input.
     *
     * @return this pipeline, for chaining
     * @throws InvalidPipelineException if {@link #validate()} fails; nothing is opened
     * @throws PipelineException if an input, output, rule or filter fails; the run is aborted
     */
    public Pipeline process() {
        if (state == State.RUNNING) throw new IllegalStateException("Pipeline '" + name + "' is already running");
        if (state == State.FINISHED) {
            throw new IllegalStateException("Pipeline '" + name + "' already finished; reconfigure it or chain a new pipeline");
        }
        Validation validation = validate();
        if (!validation.valid()) throw new InvalidPipelineException(name, validation.reason());

        var rec = Metrics.recorder();
        long runStartNanos = System.nanoTime();

        count = 0;
        current = null;
        aliases.clear(AliasRegistry.Origin.INPUT);
        transformer = new RecordTransformer(
            Collections.unmodifiableMap(new LinkedHashMap<>(mapping)),
            Collections.unmodifiableMap(new LinkedHashMap<>(constants)),
            onRecord, reader, output, trimWhitespace);
        state = State.RUNNING;

        boolean inputConfigured = false;
        boolean outputOpen = false;
        PipelineException failure = null;
        Throwable primary = null;
        try {
            input.configure(this);
            inputConfigured = true;
            output.open(this);
            outputOpen = true;

            status(StatusType.START, null);
            input.run(this);
            status(StatusType.END, null);

            outputOpen = false;
            output.close(this);
            inputConfigured = false;
            input.finish(this);
        } catch (Exception e) {
            failure = e instanceof PipelineException pe
                ? pe
                : new PipelineException(name, count, "Pipeline '" + name + "' failed: " + e.getMessage(), e);
            primary = failure;
            throw failure;
        } catch (Error e) {
            primary = e;
            throw e;
        } finally {
            if (outputOpen) closeAfterFailure(primary);
            if (inputConfigured) finishAfterFailure(primary);
            endRun();
            if (failure != null) {
                rec.onRunError(name, failure);
                status(StatusType.ERROR, failure.getMessage());
            }
        }

        rec.onRunComplete(name, count, System.nanoTime() - runStartNanos);
        log.debug("[{}] run complete, {} records", name, count);
        return this;
    }

    /** Called by the input for every raw record. Returns whether the output accepted it. */
    public boolean record(Object raw) {
        RecordTransformer active = transformer;
        if (state != State.RUNNING || active == null) {
            throw new IllegalStateException("record() called outside of process() on pipeline '" + name + "'");
        }
        return active.process(this, raw);
    }

    long beginRecord(Object record) {
        current = record;
        return ++count;
    }

    public void status(StatusType type, String message) {
        statusListener.status(this, Objects.requireNonNull(type, "type"), message);
    }

    private void endRun() {
        transformer = null;
        state = State.FINISHED;
    }

    private void closeAfterFailure(Throwable failure) {
        try {
            output.close(this);
        } catch (Exception e) {
            failure.addSuppressed(e);
        }
    }

    private void finishAfterFailure(Throwable failure) {
        try {
            input.finish(this);
        } catch (Exception e) {
            failure.addSuppressed(e);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Reading the current record

    /** First value matching {@code locator} in the current record, {@code null} if none. */
    public Object get(Locator locator) {
        return get(locator, current);
    }

    /** First value matching {@code locator} in {@code record}; use it on sub-records. */
    public Object get(Locator locator, Object record) {
        try {
            return reader.first(locator, record);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new PipelineException(name, count, "Reading " + locator + " failed: " + e.getMessage(), e);
        }
    }

    public List<Object> getAll(Locator locator) {
        return getAll(locator, current);
    }

    public List<Object> getAll(Locator locator, Object record) {
        try {
            return reader.read(locator, record);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new PipelineException(name, count, "Reading " + locator + " failed: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Chaining

    /**
     * A builder for the next stage, seeded with this pipeline's working and data directories, a
     * copy of its session, its registry, status listener and user aliases.
     */
    public Builder chain() {
        Builder next = new Builder(name)
            .registry(registry)
            .statusListener(statusListener)
            .trimWhitespace(trimWhitespace);
        next.session = session.copy();
        next.inheritedWorkIn = workIn;
        next.inheritedDataIn = dataIn;
        next.readDecorators.addAll(readDecorators);
        for (AliasRegistry.Alias alias : aliases.entries(AliasRegistry.Origin.USER)) {
            next.alias(alias.name(), alias.target());
        }
        return next;
    }

    /** Chains a new pipeline and applies {@code overrides} to it. */
    public Pipeline chain(Consumer<Builder> overrides) {
        Builder next = chain();
        Objects.requireNonNull(overrides, "overrides").accept(next);
        return next.build();
    }

    // ---------------------------------------------------------------------------------------------
    // Accessors

    public String name() { return name; }
    public State state() { return state; }
    public Path workIn() { return workIn; }
    public Path dataIn() { return dataIn; }
    public Input input() { return input; }
    public Output output() { return output; }
    public Map<String, FieldMapping> mapping() { return Collections.unmodifiableMap(mapping); }
    public Map<String, Object> constants() { return Collections.unmodifiableMap(constants); }
    public boolean hasMapping() { return !mapping.isEmpty(); }
    public boolean hasConstants() { return !constants.isEmpty(); }
    public RecordFilter onRecord() { return onRecord; }
    public Session session() { return session; }
    public AliasRegistry aliases() { return aliases; }
    public ComponentRegistry registry() { return registry; }
    public boolean trimWhitespace() { return trimWhitespace; }

    /** Records seen in the current (or last) run, including filtered ones. The first record is 1. */
    public long count() { return count; }

    /** The record being processed, after whitespace normalization. */
    public Object current() { return current; }

    /** Input name for status messages. */
    public String source() {
        return input == null ? "?" : input.describe(this);
    }

    private void configuring() {
        if (state == State.RUNNING) {
            throw new IllegalStateException("Pipeline '" + name + "' cannot be reconfigured while running");
        }
        state = State.CONFIGURED;
    }

    private void requireWorkIn() {
        if (workIn == null) throw new IllegalStateException("The working folder was not set");
    }

    private static Path findDirectory(Path root, Pattern namePattern, int maxDepth) {
        Objects.requireNonNull(namePattern, "namePattern");
        try {
            return FileFinder.firstDirectory(root, namePattern, 1, maxDepth)
                .orElseThrow(() -> new IllegalArgumentException(
                    "No matching directories for '" + namePattern.pattern() + "' in " + root));
        } catch (IOException e) {
            throw new UncheckedIOException("Searching " + root + " failed", e);
        }
    }

    // ---------------------------------------------------------------------------------------------

    public static final class Builder {
        private String name;
        private ComponentRegistry registry;
        private StatusListener statusListener;
        private boolean trimWhitespace = true;
        private final List<UnaryOperator<FieldReader>> readDecorators = new ArrayList<>();
        private Session session = new Session();

        private Path inheritedWorkIn;
        private Path inheritedDataIn;
        private Path workIn;
        private Path workInRoot;
        private Pattern workInPattern;
        private Pattern dataInPattern;
        private boolean resetDataIn;

        private Input input;
        private String inputName;
        private Map<String, Object> inputOptions = Map.of();
        private Output output;
        private String outputName;
        private Map<String, Object> outputOptions = Map.of();

        private Map<String, FieldMapping> mapping;
        private final Map<String, FieldMapping> addedMapping = new LinkedHashMap<>();
        private Map<String, Object> constants;
        private final Map<String, Object> addedConstants = new LinkedHashMap<>();
        private final List<AliasRegistry.Alias> aliases = new ArrayList<>();
        private RecordFilter onRecord;

        public Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder name(String name) { this.name = Objects.requireNonNull(name, "name"); return this; }

        public Builder registry(ComponentRegistry registry) { this.registry = registry; return this; }

        public Builder statusListener(StatusListener listener) { this.statusListener = listener; return this; }

        /** Whether string values are stripped of surrounding whitespace. On by default. */
        public Builder trimWhitespace(boolean trim) { this.trimWhitespace = trim; return this; }

        /** Wraps every field read; decorators apply in the order added, outermost last. */
        public Builder decorateReads(UnaryOperator<FieldReader> decorator) {
            readDecorators.add(Objects.requireNonNull(decorator, "decorator"));
            return this;
        }

        public Builder workIn(Path path) {
            this.workIn = Objects.requireNonNull(path, "path");
            this.workInRoot = null;
            this.workInPattern = null;
            return this;
        }

        public Builder workIn(Path root, String namePattern) {
            return workIn(root, NamePatterns.iname(namePattern));
        }

        public Builder workIn(Path root, Pattern namePattern) {
            this.workInRoot = Objects.requireNonNull(root, "root");
            this.workInPattern = Objects.requireNonNull(namePattern, "namePattern");
            this.workIn = null;
            return this;
        }

        /** Blank resets the data directory to the working directory. */
        public Builder dataIn(String namePattern) {
            if (namePattern == null || namePattern.isBlank()) {
                this.dataInPattern = null;
                this.resetDataIn = true;
                return this;
            }
            return dataIn(NamePatterns.iname(namePattern));
        }

        public Builder dataIn(Pattern namePattern) {
            this.dataInPattern = Objects.requireNonNull(namePattern, "namePattern");
            this.resetDataIn = false;
            return this;
        }

        public Builder input(Input input) {
            this.input = Objects.requireNonNull(input, "input");
            this.inputName = null;
            return this;
        }

        public Builder input(String name) { return input(name, Map.of()); }

        public Builder input(String name, Map<String, ?> options) {
            this.inputName = Objects.requireNonNull(name, "name");
            this.inputOptions = new LinkedHashMap<>(options);
            this.input = null;
            return this;
        }

        public Builder output(Output output) {
            this.output = Objects.requireNonNull(output, "output");
            this.outputName = null;
            return this;
        }

        public Builder output(String name) { return output(name, Map.of()); }

        public Builder output(String name, Map<String, ?> options) {
            this.outputName = Objects.requireNonNull(name, "name");
            this.outputOptions = new LinkedHashMap<>(options);
            this.output = null;
            return this;
        }

        public Builder mapping(String field, Locator locator) {
            return mapping(field, FieldMapping.of(locator));
        }

        public Builder mapping(String field, Locator locator, String separator) {
            return mapping(field, new FieldMapping(locator, separator));
        }

        public Builder mapping(String field, FieldMapping source) {
            addedMapping.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(source, "source"));
            return this;
        }

        /** Replaces everything mapped so far. */
        public Builder mapping(Map<String, FieldMapping> replacement) {
            this.mapping = new LinkedHashMap<>(replacement);
            addedMapping.clear();
            return this;
        }

        public Builder constant(String field, Object value) {
            addedConstants.put(Objects.requireNonNull(field, "field"), value);
            return this;
        }

        /** Replaces every constant set so far. */
        public Builder constants(Map<String, ?> replacement) {
            this.constants = new LinkedHashMap<>(replacement);
            addedConstants.clear();
            return this;
        }

        /** A user alias, resolved after any alias the input registers under the same name. */
        public Builder alias(String alias, Locator target) {
            aliases.add(new AliasRegistry.Alias(alias, target, AliasRegistry.Origin.USER));
            return this;
        }

        public Builder session(String key, Object value) {
            session.set(key, value);
            return this;
        }

        public Builder onRecord(RecordFilter filter) {
            this.onRecord = filter;
            return this;
        }

        public Pipeline build() {
            Pipeline p = new Pipeline(
                name,
                registry == null ? ComponentRegistry.withDefaults() : registry,
                statusListener == null ? new LoggingStatusListener() : statusListener,
                trimWhitespace,
                readDecorators,
                session);

            if (workIn != null) {
                p.workIn(workIn);
            } else if (workInRoot != null) {
                p.workIn(workInRoot, workInPattern);
            } else if (inheritedWorkIn != null) {
                p.workIn = inheritedWorkIn;
                p.dataIn = inheritedDataIn == null ? inheritedWorkIn : inheritedDataIn;
            }
            if (dataInPattern != null) {
                p.dataIn(dataInPattern);
            } else if (resetDataIn && p.workIn != null) {
                p.dataIn = p.workIn;
            }

            for (AliasRegistry.Alias alias : aliases) {
                p.aliases.register(alias.name(), alias.target(), alias.origin());
            }

            if (input != null) p.input(input);
            else if (inputName != null) p.input(inputName, inputOptions);
            if (output != null) p.output(output);
            else if (outputName != null) p.output(outputName, outputOptions);

            if (mapping != null) mapping.forEach(p::mapping);
            addedMapping.forEach(p::mapping);
            if (constants != null) constants.forEach(p::constant);
            addedConstants.forEach(p::constant);
            if (onRecord != null) p.onRecord(onRecord);

            if (p.workIn != null || p.input != null || p.output != null || p.hasMapping() || p.hasConstants()) {
                p.state = State.CONFIGURED;
            }
            return p;
        }
    }
}
