package io.jsonsift.core.engine;

import io.jsonsift.core.model.Value;
import io.jsonsift.core.modifier.ModifierRegistry;
import io.jsonsift.core.spi.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Entry point of the query engine. A {@code JsonQuery} pairs a {@link ModifierRegistry} with
 * {@link QueryOptions} and evaluates paths against JSON text.
 *
 * <p>Evaluation never throws for malformed documents or paths: anything that cannot be resolved
 * yields {@link Value#none()}. Instances are immutable and may be shared between threads once the
 * registry is populated.
 *
 * <pre>{@code
 * JsonQuery query = JsonQuery.defaults();
 * Value last = query.get(json, "name.last");
 * Value adults = query.get(json, "friends.#(age>=18)#.first");
 * }</pre>
 */
public final class JsonQuery {

    private static final JsonQuery DEFAULTS = new JsonQuery(ModifierRegistry.withBuiltins(), QueryOptions.DEFAULT);

    private final ModifierRegistry modifiers;
    private final QueryOptions options;
    private final PathWalker walker;

    private JsonQuery(ModifierRegistry modifiers, QueryOptions options) {
        this.modifiers = modifiers;
        this.options = options;
        this.walker = new PathWalker(this);
    }

    /** The shared instance with the built-in modifiers and default options. */
    public static JsonQuery defaults() {
        return DEFAULTS;
    }

    /**
     * Creates an engine over the given registry and options. The registry is used as is, so
     * modifiers registered later are visible to this engine.
     */
    public static JsonQuery create(ModifierRegistry modifiers, QueryOptions options) {
        Objects.requireNonNull(modifiers, "modifiers must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return new JsonQuery(modifiers, options);
    }

    /** Evaluates {@code path} against {@code document}. */
    public Value get(String document, String path) {
        return walker.get(document, path).withOwner(this);
    }

    /** Evaluates {@code path} against a UTF-8 encoded document. Offsets refer to the decoded text. */
    public Value get(byte[] document, String path) {
        return get(new String(document, StandardCharsets.UTF_8), path);
    }

    /**
     * Evaluates {@code path} against the raw text of {@code parent}. When the parent has a known
     * origin, the result's origin and match offsets are moved onto the parent's document.
     */
    public Value getIn(Value parent, String path) {
        Value result = walker.get(parent.raw(), path);
        result = parent.hasOrigin() ? result.shiftedBy(parent.origin()) : result.detached();
        return result.withOwner(this);
    }

    /** Evaluates several paths against one document, in order. */
    public List<Value> getMany(String document, String... paths) {
        return getMany(document, Arrays.asList(paths));
    }

    public List<Value> getMany(String document, List<String> paths) {
        List<Value> results = new ArrayList<>(paths.size());
        for (String path : paths) {
            results.add(get(document, path));
        }
        return results;
    }

    /** Reads the first value of {@code document} without evaluating a path. */
    public Value parse(String document) {
        return JsonScanner.parse(document).withOwner(this);
    }

    public boolean isValid(String document) {
        return JsonValidator.isValid(document);
    }

    public boolean isValid(byte[] document) {
        return JsonValidator.isValid(new String(document, StandardCharsets.UTF_8));
    }

    /**
     * Calls {@code callback} with each top-level value of a JSON Lines document until it returns
     * {@code false}. Values carry their offset in {@code document}.
     */
    public void forEachLine(String document, Predicate<Value> callback) {
        int i = 0;
        while (i < document.length()) {
            JsonScanner.Token token = JsonScanner.next(document, i);
            if (!token.value().exists() || !callback.test(token.value().withOwner(this))) {
                return;
            }
            i = token.end();
        }
    }

    /** The path leading to {@code value} in {@code document}, or {@code ""} if it cannot be recovered. */
    public String path(Value value, String document) {
        return PathReconstructor.path(value, document, !options.disableModifiers());
    }

    /** The paths of each element of a {@code #(...)#} result. */
    public List<String> paths(Value value, String document) {
        return PathReconstructor.paths(value, document, !options.disableModifiers());
    }

    public ModifierRegistry modifiers() {
        return modifiers;
    }

    public void registerModifier(String name, Modifier modifier) {
        modifiers.register(name, modifier);
    }

    public boolean modifierExists(String name) {
        return modifiers.hasModifier(name);
    }

    public QueryOptions options() {
        return options;
    }
}
