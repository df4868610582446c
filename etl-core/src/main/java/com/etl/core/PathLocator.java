package com.etl.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed path expression.
 *
 * <p>Segments compare against the string form of map keys. On lists a numeric segment is an
 * index. {@code *} matches every child and an empty segment (written {@code //}) descends
 * through all levels, so {@code //Name} finds a {@code Name} key at any depth.
 */
public record PathLocator(String expression, List<String> segments) implements Locator {
    public static final String ANY = "*";
    public static final String DESCENDANTS = "";

    public PathLocator {
        expression = Objects.requireNonNull(expression, "expression");
        segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
    }

    public static PathLocator parse(String expression) {
        Objects.requireNonNull(expression, "expression");
        String body = expression;
        if (body.startsWith("/")) body = body.substring(1);
        while (body.endsWith("/")) body = body.substring(0, body.length() - 1);

        List<String> segments = new ArrayList<>();
        if (!body.isEmpty()) {
            for (String segment : body.split("/", -1)) segments.add(segment);
        }
        return new PathLocator(expression, segments);
    }

    @Override
    public String toString() {
        return "path " + expression;
    }
}
