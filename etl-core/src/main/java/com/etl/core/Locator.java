package com.etl.core;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Where to find a value inside a record.
 *
 * <p>The kind of locator is always chosen by the caller: {@code key(3)}, {@code key("3")} and
 * {@code path("3")} are three different locators and the resolver never guesses between them.
 */
public interface Locator {

    /** Exact top-level key. Integer keys also index into list records. */
    static Locator key(Object key) {
        return new KeyLocator(key);
    }

    /** Slash-delimited path through nested maps and lists, e.g. {@code /person/0/name}. */
    static Locator path(String expression) {
        return PathLocator.parse(expression);
    }

    /** Regular expression matched against top-level key names and alias names. */
    static Locator pattern(String regex) {
        return new PatternLocator(Pattern.compile(regex));
    }

    static Locator pattern(Pattern pattern) {
        return new PatternLocator(pattern);
    }

    /** Computed value. */
    static Locator rule(FieldRule rule) {
        return new RuleLocator("rule", rule);
    }

    static Locator rule(String name, FieldRule rule) {
        return new RuleLocator(name, rule);
    }

    record KeyLocator(Object key) implements Locator {
        public KeyLocator {
            key = Objects.requireNonNull(key, "key");
        }

        @Override
        public String toString() {
            return key instanceof String ? "key '" + key + "'" : "key " + key;
        }
    }

    record PatternLocator(Pattern pattern) implements Locator {
        public PatternLocator {
            pattern = Objects.requireNonNull(pattern, "pattern");
        }

        @Override
        public String toString() {
            return "pattern /" + pattern.pattern() + "/";
        }
    }

    record RuleLocator(String name, FieldRule rule) implements Locator {
        public RuleLocator {
            name = Objects.requireNonNull(name, "name");
            rule = Objects.requireNonNull(rule, "rule");
        }

        @Override
        public String toString() {
            return "rule " + name;
        }
    }
}
