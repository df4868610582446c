package com.etl.config;

import com.etl.core.ComponentRegistry;
import com.etl.core.FieldMapping;
import com.etl.core.Locator;
import com.etl.core.Pipeline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Pipelines from JSON definitions.
 *
 * <pre>{@code
 * {
 *   "pipeline": "patients",
 *   "workIn": {"root": "/data", "iname": "export-*"},
 *   "input": {"type": "DelimitedText", "iname": "*.csv"},
 *   "mapping": {"Name": "A", "Phones": [{"pattern": "^phone", "flags": "i"}, ", "]},
 *   "constants": {"Type": "Demographic"},
 *   "output": {"type": "JsonLines", "file": "patients.jsonl", "sessionKey": "out"},
 *   "chain": [ { "input": "JsonFiles", "mapping": {"Name": {"path": "/person/name"}} } ]
 * }
 * }</pre>
 *
 * The whole definition, chained stages included, is parsed and checked against the registry before
 * anything runs. Every definition error is an {@link IOException}.
 */
public final class PipelineJsonLoader {
    private static final Logger log = LoggerFactory.getLogger(PipelineJsonLoader.class);
    private static final ObjectMapper M = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> OPTIONS = new TypeReference<>() {};

    private static final Set<String> STAGE_FIELDS = Set.of(
        "pipeline", "workIn", "dataIn", "input", "output", "mapping", "constants",
        "aliases", "session", "onRecord", "trimWhitespace");

    private PipelineJsonLoader() {}

    /** Parses a definition. Relative {@code workIn} paths resolve against the current directory. */
    public static PipelineDefinition parse(InputStream in, ComponentRegistry registry) throws IOException {
        return parse(in, registry, null);
    }

    /** Parses a definition file. Relative {@code workIn} paths resolve against the file's directory. */
    public static PipelineDefinition parse(Path file, ComponentRegistry registry) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, registry, file.toAbsolutePath().getParent());
        }
    }

    /** The first stage, configured but not run. */
    public static Pipeline load(InputStream in, ComponentRegistry registry) throws IOException {
        return parse(in, registry).build();
    }

    public static Pipeline load(Path file, ComponentRegistry registry) throws IOException {
        return parse(file, registry).build();
    }

    /** Runs every stage in order and returns the last one. */
    public static Pipeline process(InputStream in, ComponentRegistry registry) throws IOException {
        return parse(in, registry).process();
    }

    public static Pipeline process(Path file, ComponentRegistry registry) throws IOException {
        return parse(file, registry).process();
    }

    private static PipelineDefinition parse(InputStream in, ComponentRegistry registry, Path base) throws IOException {
        Objects.requireNonNull(registry, "registry");
        JsonNode root;
        try {
            root = M.readTree(in);
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid pipeline JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) throw new IOException("Pipeline definition must be a JSON object");

        String name = req(root, "pipeline").asText();
        StageParser parser = new StageParser(registry, base);

        List<Consumer<Pipeline.Builder>> stages = new ArrayList<>();
        stages.add(parser.stage(root, "stage 1", true));
        JsonNode chain = root.path("chain");
        if (!chain.isMissingNode()) {
            if (!chain.isArray()) throw new IOException("'chain' must be an array");
            int n = 2;
            for (JsonNode stage : chain) {
                if (!stage.isObject()) throw new IOException("stage " + n + ": must be an object");
                stages.add(parser.stage(stage, "stage " + n, false));
                n++;
            }
        }
        log.debug("Parsed pipeline '{}' with {} stage(s)", name, stages.size());
        return new PipelineDefinition(name, registry, stages);
    }

    private static JsonNode req(JsonNode n, String field) throws IOException {
        if (!n.has(field) || n.get(field).isNull()) throw new IOException("Missing required field: " + field);
        return n.get(field);
    }

    /** Turns one stage object into builder settings. */
    private static final class StageParser {
        private final ComponentRegistry registry;
        private final Path base;

        StageParser(ComponentRegistry registry, Path base) {
            this.registry = registry;
            this.base = base;
        }

        Consumer<Pipeline.Builder> stage(JsonNode node, String where, boolean first) throws IOException {
            List<Consumer<Pipeline.Builder>> steps = new ArrayList<>();

            for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                String field = it.next();
                if (!STAGE_FIELDS.contains(field) && !(first && field.equals("chain"))) {
                    throw new IOException(where + ": unknown field '" + field + "'");
                }
            }

            if (node.has("pipeline")) {
                String name = node.get("pipeline").asText();
                steps.add(b -> b.name(name));
            }
            if (node.has("trimWhitespace")) {
                boolean trim = bool(node.get("trimWhitespace"), where + ".trimWhitespace");
                steps.add(b -> b.trimWhitespace(trim));
            }
            if (node.has("workIn")) steps.add(workIn(node.get("workIn"), where));
            if (node.has("dataIn")) {
                String dataIn = text(node.get("dataIn"), where + ".dataIn");
                steps.add(b -> b.dataIn(dataIn));
            }
            if (node.has("session")) {
                Map<String, Object> values = object(node.get("session"), where + ".session");
                steps.add(b -> values.forEach(b::session));
            }
            if (node.has("aliases")) {
                JsonNode aliases = node.get("aliases");
                if (!aliases.isObject()) throw new IOException(where + ".aliases: must be an object");
                Map<String, Locator> parsed = new LinkedHashMap<>();
                for (Iterator<Map.Entry<String, JsonNode>> it = aliases.fields(); it.hasNext(); ) {
                    Map.Entry<String, JsonNode> e = it.next();
                    parsed.put(e.getKey(), locator(e.getValue(), where + ".aliases." + e.getKey()));
                }
                steps.add(b -> parsed.forEach(b::alias));
            }
            if (node.has("input")) steps.add(component(node.get("input"), where + ".input", true));
            if (node.has("output")) steps.add(component(node.get("output"), where + ".output", false));
            if (node.has("mapping")) {
                JsonNode mapping = node.get("mapping");
                if (!mapping.isObject()) throw new IOException(where + ".mapping: must be an object");
                Map<String, FieldMapping> parsed = new LinkedHashMap<>();
                for (Iterator<Map.Entry<String, JsonNode>> it = mapping.fields(); it.hasNext(); ) {
                    Map.Entry<String, JsonNode> e = it.next();
                    parsed.put(e.getKey(), fieldMapping(e.getValue(), where + ".mapping." + e.getKey()));
                }
                steps.add(b -> b.mapping(parsed));
            }
            if (node.has("constants")) {
                Map<String, Object> constants = object(node.get("constants"), where + ".constants");
                steps.add(b -> b.constants(constants));
            }
            if (node.has("onRecord")) {
                String filter = text(node.get("onRecord"), where + ".onRecord");
                if (!registry.hasFilter(filter)) throw new IOException(where + ".onRecord: unknown filter '" + filter + "'");
                steps.add(b -> b.onRecord(registry.getFilter(filter)));
            }

            return b -> steps.forEach(step -> step.accept(b));
        }

        private Consumer<Pipeline.Builder> workIn(JsonNode node, String where) throws IOException {
            if (node.isTextual()) {
                Path path = resolve(node.asText());
                return b -> b.workIn(path);
            }
            if (node.isObject()) {
                Path root = resolve(text(req(node, "root"), where + ".workIn.root"));
                String iname = text(req(node, "iname"), where + ".workIn.iname");
                return b -> b.workIn(root, iname);
            }
            throw new IOException(where + ".workIn: must be a string or {root, iname}");
        }

        private Consumer<Pipeline.Builder> component(JsonNode node, String where, boolean input) throws IOException {
            String type;
            Map<String, Object> options;
            if (node.isTextual()) {
                type = node.asText();
                options = Map.of();
            } else if (node.isObject()) {
                type = text(req(node, "type"), where + ".type");
                options = object(node, where);
                options.remove("type");
            } else {
                throw new IOException(where + ": must be a name or an object with 'type'");
            }

            boolean known = input ? registry.hasInput(type) : registry.hasOutput(type);
            if (!known) throw new IOException(where + ": unknown " + (input ? "input" : "output") + " '" + type + "'");
            return input ? b -> b.input(type, options) : b -> b.output(type, options);
        }

        private FieldMapping fieldMapping(JsonNode node, String where) throws IOException {
            if (node.isArray()) {
                if (node.size() != 2 || !node.get(1).isTextual()) {
                    throw new IOException(where + ": array form is [locator, separator]");
                }
                return new FieldMapping(locator(node.get(0), where), node.get(1).asText());
            }
            Locator locator = locator(node, where);
            if (node.isObject() && node.has("separator")) {
                return new FieldMapping(locator, text(node.get("separator"), where + ".separator"));
            }
            return FieldMapping.of(locator);
        }

        private Locator locator(JsonNode node, String where) throws IOException {
            if (node.isTextual()) return Locator.key(node.asText());
            if (node.isInt()) return Locator.key(node.asInt());
            if (!node.isObject()) throw new IOException(where + ": unsupported locator " + node);

            int kinds = (node.has("key") ? 1 : 0) + (node.has("path") ? 1 : 0)
                + (node.has("pattern") ? 1 : 0) + (node.has("rule") ? 1 : 0);
            if (kinds != 1) throw new IOException(where + ": exactly one of key, path, pattern or rule is required");

            if (node.has("key")) {
                JsonNode key = node.get("key");
                if (key.isInt()) return Locator.key(key.asInt());
                return Locator.key(text(key, where + ".key"));
            }
            if (node.has("path")) return Locator.path(text(node.get("path"), where + ".path"));
            if (node.has("pattern")) {
                String regex = text(node.get("pattern"), where + ".pattern");
                String flags = node.path("flags").asText("");
                int bits = 0;
                for (char c : flags.toCharArray()) {
                    switch (c) {
                        case 'i' -> bits |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                        case 'x' -> bits |= Pattern.COMMENTS;
                        default -> throw new IOException(where + ".flags: unsupported flag '" + c + "'");
                    }
                }
                try {
                    return Locator.pattern(Pattern.compile(regex, bits));
                } catch (PatternSyntaxException e) {
                    throw new IOException(where + ".pattern: " + e.getDescription(), e);
                }
            }
            String rule = text(node.get("rule"), where + ".rule");
            if (!registry.hasRule(rule)) throw new IOException(where + ": unknown rule '" + rule + "'");
            return Locator.rule(rule, registry.getRule(rule));
        }

        private Path resolve(String path) {
            Path p = Path.of(path);
            return p.isAbsolute() || base == null ? p : base.resolve(p);
        }

        private static String text(JsonNode node, String where) throws IOException {
            if (!node.isTextual()) throw new IOException(where + ": must be a string");
            return node.asText();
        }

        private static boolean bool(JsonNode node, String where) throws IOException {
            if (!node.isBoolean()) throw new IOException(where + ": must be true or false");
            return node.asBoolean();
        }

        private static Map<String, Object> object(JsonNode node, String where) throws IOException {
            if (!node.isObject()) throw new IOException(where + ": must be an object");
            return new LinkedHashMap<>(M.convertValue(node, OPTIONS));
        }
    }
}
