package com.etl.core.input;

import com.etl.core.AliasRegistry;
import com.etl.core.Input;
import com.etl.core.Locator;
import com.etl.core.Options;
import com.etl.core.Pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Records held in memory. Aliases given here are registered as input aliases on every run, the way
 * a file reader registers its column headers.
 *
 * <p>Options: {@code records} (a list), {@code aliases} (alias name to a {@link Locator} or a key).
 */
public final class MemoryInput implements Input {
    private final List<Object> records;
    private final Map<String, List<Locator>> aliases = new LinkedHashMap<>();

    public MemoryInput(List<?> records) {
        this.records = new ArrayList<>(Objects.requireNonNull(records, "records"));
    }

    public MemoryInput(Map<String, Object> options) {
        List<?> given = Options.get(options, "records", List.class);
        this.records = given == null ? new ArrayList<>() : new ArrayList<>(given);
        Map<?, ?> named = Options.get(options, "aliases", Map.class);
        if (named != null) {
            named.forEach((alias, target) -> alias(String.valueOf(alias),
                target instanceof Locator locator ? locator : Locator.key(target)));
        }
    }

    /** Adds an input alias. The same name may be given more than once. */
    public MemoryInput alias(String name, Locator target) {
        aliases.computeIfAbsent(Objects.requireNonNull(name, "name"), n -> new ArrayList<>())
            .add(Objects.requireNonNull(target, "target"));
        return this;
    }

    public MemoryInput alias(String name, Object key) {
        return alias(name, Locator.key(key));
    }

    public List<Object> records() {
        return List.copyOf(records);
    }

    @Override
    public void configure(Pipeline pipeline) {
        aliases.forEach((name, targets) ->
            targets.forEach(target -> pipeline.registerAlias(name, target, AliasRegistry.Origin.INPUT)));
    }

    @Override
    public void run(Pipeline pipeline) {
        for (Object record : records) pipeline.record(record);
    }

    @Override
    public void finish(Pipeline pipeline) {
    }

    @Override
    public String describe(Pipeline pipeline) {
        return "memory";
    }
}
