package com.etl.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves locators against a record, consulting the pipeline's aliases.
 *
 * <p>Resolution never fails on shape: a missing key, a path that runs into a scalar, or a pattern
 * that matches nothing all produce an empty list. Only rules may throw.
 */
public final class FieldResolver implements FieldReader {
    private final Pipeline pipeline;
    private final AliasRegistry aliases;

    public FieldResolver(Pipeline pipeline, AliasRegistry aliases) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.aliases = Objects.requireNonNull(aliases, "aliases");
    }

    @Override
    public List<Object> read(Locator locator, Object record) throws Exception {
        List<Object> found = new ArrayList<>();
        readInto(locator, record, found, new HashSet<>());
        return found;
    }

    private void readInto(Locator locator, Object record, List<Object> found, Set<String> visiting) throws Exception {
        Objects.requireNonNull(locator, "locator");
        if (locator instanceof Locator.KeyLocator key) {
            readKey(key.key(), record, found, visiting);
        } else if (locator instanceof PathLocator path) {
            readPath(path.segments(), record, found, visiting);
        } else if (locator instanceof Locator.PatternLocator pattern) {
            readPattern(pattern, record, found, visiting);
        } else if (locator instanceof Locator.RuleLocator rule) {
            Object value = rule.rule().apply(pipeline, record);
            if (value instanceof Collection<?> values) {
                found.addAll(values);
            } else if (value != null) {
                found.add(value);
            }
        } else {
            throw new IllegalArgumentException("Unsupported locator: " + locator);
        }
    }

    private void readKey(Object key, Object record, List<Object> found, Set<String> visiting) throws Exception {
        if (record instanceof Map<?, ?> map && map.containsKey(key)) {
            found.add(map.get(key));
            return;
        }
        if (record instanceof List<?> list && key instanceof Integer index && index >= 0 && index < list.size()) {
            found.add(list.get(index));
            return;
        }
        if (key instanceof String name) readAlias(name, record, found, visiting);
    }

    private void readAlias(String name, Object record, List<Object> found, Set<String> visiting) throws Exception {
        if (!aliases.contains(name) || !visiting.add(name)) return;
        try {
            for (Locator target : aliases.resolve(name)) {
                readInto(target, record, found, visiting);
            }
        } finally {
            visiting.remove(name);
        }
    }

    private void readPath(List<String> segments, Object record, List<Object> found, Set<String> visiting) throws Exception {
        if (segments.isEmpty()) {
            found.add(record);
            return;
        }

        String first = segments.get(0);
        if (first.equals(PathLocator.DESCENDANTS) || first.equals(PathLocator.ANY)) {
            walk(record, segments, 0, found);
            return;
        }

        List<Object> starts = Records.children(record, first);
        if (starts.isEmpty()) readAlias(first, record, starts, visiting);
        for (Object start : starts) {
            walk(start, segments, 1, found);
        }
    }

    private static void walk(Object node, List<String> segments, int index, List<Object> found) {
        if (index == segments.size()) {
            found.add(node);
            return;
        }
        String segment = segments.get(index);
        if (segment.equals(PathLocator.DESCENDANTS)) {
            descend(node, segments, index + 1, found);
            return;
        }
        for (Object child : Records.children(node, segment)) {
            walk(child, segments, index + 1, found);
        }
    }

    // descendant-or-self: match here first, then below every child
    private static void descend(Object node, List<String> segments, int index, List<Object> found) {
        walk(node, segments, index, found);
        for (Object child : Records.children(node)) {
            if (child instanceof Map<?, ?> || child instanceof List<?>) descend(child, segments, index, found);
        }
    }

    private void readPattern(Locator.PatternLocator locator, Object record, List<Object> found, Set<String> visiting)
            throws Exception {
        Set<Locator> seen = new HashSet<>();
        if (record instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (locator.pattern().matcher(String.valueOf(entry.getKey())).find()) {
                    found.add(entry.getValue());
                    seen.add(Locator.key(entry.getKey()));
                }
            }
        } else if (record instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                if (locator.pattern().matcher(Integer.toString(i)).find()) {
                    found.add(list.get(i));
                    seen.add(Locator.key(i));
                }
            }
        }

        for (AliasRegistry.Alias alias : aliases.entries()) {
            if (!locator.pattern().matcher(alias.name()).find()) continue;
            if (!seen.add(alias.target())) continue;
            if (!visiting.add(alias.name())) continue;
            try {
                readInto(alias.target(), record, found, visiting);
            } finally {
                visiting.remove(alias.name());
            }
        }
    }
}
