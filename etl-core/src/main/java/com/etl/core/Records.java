package com.etl.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Helpers for the generic record tree: maps, lists and scalar leaves. */
public final class Records {
    private Records() {}

    /**
     * Deep copy into mutable {@link LinkedHashMap}/{@link ArrayList} containers. String leaves are
     * stripped when {@code trim} is set. Arrays become lists.
     */
    public static Object normalize(Object value, boolean trim) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), normalize(entry.getValue(), trim));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) copy.add(normalize(element, trim));
            return copy;
        }
        if (value instanceof Object[] array) {
            List<Object> copy = new ArrayList<>(array.length);
            for (Object element : array) copy.add(normalize(element, trim));
            return copy;
        }
        if (trim && value instanceof String s) return s.strip();
        return value;
    }

    /** Direct children of a node: map values or list elements. Scalars have none. */
    static List<Object> children(Object node) {
        if (node instanceof Map<?, ?> map) return new ArrayList<>(map.values());
        if (node instanceof List<?> list) return new ArrayList<>(list);
        return List.of();
    }

    /** Children reached through one path segment. */
    static List<Object> children(Object node, String segment) {
        if (PathLocator.ANY.equals(segment)) return children(node);

        List<Object> found = new ArrayList<>();
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (segment.equals(String.valueOf(entry.getKey()))) found.add(entry.getValue());
            }
        } else if (node instanceof List<?> list) {
            int index = parseIndex(segment);
            if (index >= 0 && index < list.size()) found.add(list.get(index));
        }
        return found;
    }

    private static int parseIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) return -1;
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) return -1;
        }
        return Integer.parseInt(segment);
    }
}
