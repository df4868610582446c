package com.etl.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Alternate names for fields.
 *
 * <p>Inputs register names they discover (column letters, column headers); the pipeline
 * configuration registers its own. Entries from the input always come before user entries.
 * Registration only appends: a header used twice keeps both columns.
 */
public final class AliasRegistry {

    public enum Origin { INPUT, USER }

    public record Alias(String name, Locator target, Origin origin) {
        public Alias {
            name = Objects.requireNonNull(name, "name");
            target = Objects.requireNonNull(target, "target");
            origin = Objects.requireNonNull(origin, "origin");
        }
    }

    private final List<Alias> input = new ArrayList<>();
    private final List<Alias> user = new ArrayList<>();
    private final Map<String, Integer> nameCounts = new HashMap<>();

    // rebuilt lazily after each registration
    private List<Alias> entries;

    public void register(String name, Locator target, Origin origin) {
        Alias alias = new Alias(name, target, origin);
        (origin == Origin.INPUT ? input : user).add(alias);
        nameCounts.merge(name, 1, Integer::sum);
        entries = null;
    }

    public boolean contains(String name) {
        return nameCounts.containsKey(name);
    }

    /** Number of targets registered under {@code name}. */
    public int count(String name) {
        return nameCounts.getOrDefault(name, 0);
    }

    public List<Locator> resolve(String name) {
        if (!contains(name)) return List.of();
        List<Locator> targets = new ArrayList<>();
        for (Alias alias : entries()) {
            if (alias.name().equals(name)) targets.add(alias.target());
        }
        return targets;
    }

    public List<Alias> entries() {
        List<Alias> current = entries;
        if (current == null) {
            List<Alias> all = new ArrayList<>(input.size() + user.size());
            all.addAll(input);
            all.addAll(user);
            current = List.copyOf(all);
            entries = current;
        }
        return current;
    }

    public List<Alias> entries(Origin origin) {
        return List.copyOf(origin == Origin.INPUT ? input : user);
    }

    public int size() {
        return input.size() + user.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    void clear(Origin origin) {
        List<Alias> removed = origin == Origin.INPUT ? input : user;
        for (Alias alias : removed) {
            nameCounts.computeIfPresent(alias.name(), (name, n) -> n > 1 ? n - 1 : null);
        }
        removed.clear();
        entries = null;
    }
}
