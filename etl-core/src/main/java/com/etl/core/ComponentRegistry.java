package com.etl.core;

import com.etl.core.input.MemoryInput;
import com.etl.core.output.CallbackOutput;
import com.etl.core.output.MemoryOutput;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named inputs, outputs, rules and filters.
 *
 * <p>Inputs and outputs are looked up by short name ({@code "Memory"}). A name starting with
 * {@code +} is a fully qualified class name instead, instantiated reflectively.
 */
public final class ComponentRegistry {

    @FunctionalInterface
    public interface Factory<T> {
        T create(Map<String, Object> options);
    }

    private final Map<String, Factory<? extends Input>> inputs = new ConcurrentHashMap<>();
    private final Map<String, Factory<? extends Output>> outputs = new ConcurrentHashMap<>();
    private final Map<String, FieldRule> rules = new ConcurrentHashMap<>();
    private final Map<String, RecordFilter> filters = new ConcurrentHashMap<>();

    /** A registry holding the in-memory input and the memory and callback outputs. */
    public static ComponentRegistry withDefaults() {
        ComponentRegistry registry = new ComponentRegistry();
        registry.registerInput("Memory", MemoryInput::new);
        registry.registerOutput("Memory", MemoryOutput::new);
        registry.registerOutput("Callback", CallbackOutput::new);
        return registry;
    }

    public ComponentRegistry registerInput(String name, Factory<? extends Input> factory) {
        inputs.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(factory, "factory"));
        return this;
    }

    public ComponentRegistry registerOutput(String name, Factory<? extends Output> factory) {
        outputs.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(factory, "factory"));
        return this;
    }

    public ComponentRegistry registerRule(String name, FieldRule rule) {
        rules.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(rule, "rule"));
        return this;
    }

    public ComponentRegistry registerFilter(String name, RecordFilter filter) {
        filters.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(filter, "filter"));
        return this;
    }

    public boolean hasInput(String name) { return isClassReference(name) || inputs.containsKey(name); }

    public boolean hasOutput(String name) { return isClassReference(name) || outputs.containsKey(name); }

    public boolean hasRule(String name) { return rules.containsKey(name); }

    public boolean hasFilter(String name) { return filters.containsKey(name); }

    public Input createInput(String name, Map<String, Object> options) {
        Objects.requireNonNull(options, "options");
        if (isClassReference(name)) return ReflectiveComponentFactory.forName(name.substring(1), Input.class).create(options);
        Factory<? extends Input> factory = inputs.get(name);
        if (factory == null) throw new IllegalArgumentException("Unknown input: " + name);
        return factory.create(options);
    }

    public Output createOutput(String name, Map<String, Object> options) {
        Objects.requireNonNull(options, "options");
        if (isClassReference(name)) return ReflectiveComponentFactory.forName(name.substring(1), Output.class).create(options);
        Factory<? extends Output> factory = outputs.get(name);
        if (factory == null) throw new IllegalArgumentException("Unknown output: " + name);
        return factory.create(options);
    }

    public FieldRule getRule(String name) {
        FieldRule rule = rules.get(name);
        if (rule == null) throw new IllegalArgumentException("Unknown rule: " + name);
        return rule;
    }

    public RecordFilter getFilter(String name) {
        RecordFilter filter = filters.get(name);
        if (filter == null) throw new IllegalArgumentException("Unknown filter: " + name);
        return filter;
    }

    private static boolean isClassReference(String name) {
        return Objects.requireNonNull(name, "name").startsWith("+") && name.length() > 1;
    }
}
