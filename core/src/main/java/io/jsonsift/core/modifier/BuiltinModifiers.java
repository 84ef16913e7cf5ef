package io.jsonsift.core.modifier;

import io.jsonsift.core.engine.JsonQuery;
import io.jsonsift.core.engine.JsonScanner;
import io.jsonsift.core.engine.JsonStrings;
import io.jsonsift.core.engine.JsonValidator;
import io.jsonsift.core.engine.Numbers;
import io.jsonsift.core.engine.QueryOptions;
import io.jsonsift.core.format.JsonFormatter;
import io.jsonsift.core.format.PrettyOptions;
import io.jsonsift.core.model.Kind;
import io.jsonsift.core.model.Value;
import io.jsonsift.core.spi.Modifier;
import io.jsonsift.core.spi.QueryAwareModifier;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The modifiers every registry created by {@link ModifierRegistry#withBuiltins()} starts with.
 *
 * <p>Each modifier receives the JSON text produced by the previous stage and returns new JSON
 * text. Structural modifiers ({@code reverse}, {@code flatten}, {@code join}, ...) return their
 * input unchanged when it has the wrong shape; string modifiers do the same for anything that is
 * not a JSON string.
 */
public final class BuiltinModifiers {

    private static final Logger LOG = LoggerFactory.getLogger(BuiltinModifiers.class);

    private BuiltinModifiers() {}

    /** Registers all built-in modifiers into {@code registry}, replacing same-named entries. */
    public static void registerAll(ModifierRegistry registry) {
        // dig and search called outside of a path evaluate with the registry they belong to
        JsonQuery standalone = JsonQuery.create(registry, QueryOptions.DEFAULT);

        registry.register("this", (json, arg) -> json);
        registry.register("pretty", pretty(PrettyOptions.DEFAULT));
        registry.register("ugly", (json, arg) -> JsonFormatter.ugly(json));
        registry.register("minify", (json, arg) -> JsonFormatter.ugly(json));
        registry.register("reverse", BuiltinModifiers::reverse);
        registry.register("flip", BuiltinModifiers::reverse);
        registry.register("flatten", BuiltinModifiers::flatten);
        registry.register("join", BuiltinModifiers::join);
        registry.register("keys", BuiltinModifiers::keys);
        registry.register("values", BuiltinModifiers::values);
        registry.register("valid", (json, arg) -> JsonValidator.isValid(json) ? json : "");
        registry.register("tostr", (json, arg) -> JsonStrings.encode(json));
        registry.register("string", (json, arg) -> JsonStrings.encode(json));
        registry.register("fromstr", BuiltinModifiers::fromString);
        registry.register("json", BuiltinModifiers::fromString);
        registry.register("group", BuiltinModifiers::group);
        registry.register("dig", underQuery(standalone, BuiltinModifiers::dig));
        registry.register("search", underQuery(standalone, BuiltinModifiers::search));

        registry.register("uppercase", text(s -> s.toUpperCase(Locale.ROOT)));
        registry.register("lowercase", text(s -> s.toLowerCase(Locale.ROOT)));
        registry.register("snakecase", text(s -> String.join("_", words(s))));
        registry.register("kebabcase", text(s -> String.join("-", words(s))));
        registry.register("camelcase", text(BuiltinModifiers::camelCase));
        registry.register("trim", text(String::strip));
        registry.register("replace", BuiltinModifiers::replaceFirst);
        registry.register("replaceAll", BuiltinModifiers::replaceAll);
        registry.register("insertAt", BuiltinModifiers::insertAt);
        registry.register("padLeft", (json, arg) -> pad(json, arg, true));
        registry.register("padRight", (json, arg) -> pad(json, arg, false));
        registry.register("wc", BuiltinModifiers::wordCount);
        registry.register("hex", (json, arg) -> radix(json, 16));
        registry.register("bin", (json, arg) -> radix(json, 2));

        LOG.debug("Registered built-in modifiers, registry now holds {}", registry.size());
    }

    /**
     * A {@code pretty} modifier whose defaults are {@code options}. An argument object overrides
     * {@code sortKeys}, {@code indent}, {@code prefix} and {@code width}; non-whitespace
     * characters in {@code indent} and {@code prefix} are dropped.
     */
    public static Modifier pretty(PrettyOptions options) {
        return (json, arg) -> {
            if (arg.isEmpty()) {
                return JsonFormatter.pretty(json, options);
            }
            ModifierArgs args = ModifierArgs.parse(arg);
            PrettyOptions effective = options.toBuilder()
                    .sortKeys(args.bool("sortKeys", options.sortKeys()))
                    .indent(whitespaceOnly(args.text("indent", options.indent())))
                    .prefix(whitespaceOnly(args.text("prefix", options.prefix())))
                    .width(args.integer("width", options.width()))
                    .build();
            return JsonFormatter.pretty(json, effective);
        };
    }

    private static String whitespaceOnly(String s) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static String reverse(String json, String arg) {
        Value value = JsonScanner.parse(json);
        if (value.isArray()) {
            List<String> elements = new ArrayList<>();
            value.forEach((key, element) -> elements.add(element.raw()));
            StringBuilder out = new StringBuilder(json.length()).append('[');
            for (int n = elements.size() - 1; n >= 0; n--) {
                if (out.length() > 1) {
                    out.append(',');
                }
                out.append(elements.get(n));
            }
            return out.append(']').toString();
        }
        if (value.isObject()) {
            List<String> members = new ArrayList<>();
            value.forEach((key, member) -> members.add(key.raw() + ':' + member.raw()));
            StringBuilder out = new StringBuilder(json.length()).append('{');
            for (int n = members.size() - 1; n >= 0; n--) {
                if (out.length() > 1) {
                    out.append(',');
                }
                out.append(members.get(n));
            }
            return out.append('}').toString();
        }
        return json;
    }

    private static String flatten(String json, String arg) {
        Value value = JsonScanner.parse(json);
        if (!value.isArray()) {
            return json;
        }
        boolean deep = ModifierArgs.parse(arg).bool("deep", false);
        StringBuilder out = new StringBuilder(json.length()).append('[');
        Deque<Deque<Value>> pending = new ArrayDeque<>();
        pending.push(children(value));
        while (!pending.isEmpty()) {
            Value element = pending.peek().poll();
            if (element == null) {
                pending.pop();
                continue;
            }
            String raw;
            if (element.isArray()) {
                if (deep) {
                    pending.push(children(element));
                    continue;
                }
                raw = unwrap(element.raw());
            } else {
                raw = element.raw();
            }
            raw = raw.strip();
            if (!raw.isEmpty()) {
                if (out.length() > 1) {
                    out.append(',');
                }
                out.append(raw);
            }
        }
        return out.append(']').toString();
    }

    private static Deque<Value> children(Value parent) {
        Deque<Value> children = new ArrayDeque<>();
        parent.forEach((key, child) -> children.add(child));
        return children;
    }

    private static String join(String json, String arg) {
        Value value = JsonScanner.parse(json);
        if (!value.isArray()) {
            return json;
        }
        StringBuilder out = new StringBuilder(json.length()).append('{');
        if (ModifierArgs.parse(arg).bool("preserve", false)) {
            value.forEach((key, element) -> {
                if (element.isObject()) {
                    String members = unwrap(element.raw());
                    if (!members.isBlank()) {
                        if (out.length() > 1) {
                            out.append(',');
                        }
                        out.append(members);
                    }
                }
                return true;
            });
            return out.append('}').toString();
        }
        // last value wins, keys stay in first-seen order
        Map<String, String[]> members = new LinkedHashMap<>();
        value.forEach((index, element) -> {
            if (element.isObject()) {
                element.forEach((key, member) -> {
                    String[] previous = members.get(key.text());
                    if (previous == null) {
                        members.put(key.text(), new String[] {key.raw(), member.raw()});
                    } else {
                        previous[1] = member.raw();
                    }
                    return true;
                });
            }
            return true;
        });
        for (String[] member : members.values()) {
            if (out.length() > 1) {
                out.append(',');
            }
            out.append(member[0]).append(':').append(member[1]);
        }
        return out.append('}').toString();
    }

    private static String keys(String json, String arg) {
        Value value = JsonScanner.parse(json);
        if (!value.exists()) {
            return "[]";
        }
        boolean object = value.isObject();
        StringBuilder out = new StringBuilder().append('[');
        value.forEach((key, member) -> {
            if (out.length() > 1) {
                out.append(',');
            }
            out.append(object ? key.raw() : "null");
            return true;
        });
        return out.append(']').toString();
    }

    private static String values(String json, String arg) {
        Value value = JsonScanner.parse(json);
        if (!value.exists()) {
            return "[]";
        }
        if (value.isArray()) {
            return json;
        }
        StringBuilder out = new StringBuilder(json.length()).append('[');
        value.forEach((key, member) -> {
            if (out.length() > 1) {
                out.append(',');
            }
            out.append(member.raw());
            return true;
        });
        return out.append(']').toString();
    }

    private static String fromString(String json, String arg) {
        if (!JsonValidator.isValid(json)) {
            return "";
        }
        return JsonScanner.parse(json).toString();
    }

    /** Transposes {@code {"a":[1,2],"b":[3,4]}} into {@code [{"a":1,"b":3},{"a":2,"b":4}]}. */
    private static String group(String json, String arg) {
        Value value = JsonScanner.parse(json);
        if (!value.isObject()) {
            return "";
        }
        List<String> names = new ArrayList<>();
        List<List<String>> columns = new ArrayList<>();
        value.forEach((key, member) -> {
            if (member.isArray()) {
                List<String> column = new ArrayList<>();
                member.forEach((index, element) -> column.add(element.raw()));
                names.add(key.raw());
                columns.add(column);
            }
            return true;
        });
        int rows = columns.isEmpty() ? 0 : Integer.MAX_VALUE;
        for (List<String> column : columns) {
            rows = Math.min(rows, column.size());
        }
        StringBuilder out = new StringBuilder(json.length()).append('[');
        for (int row = 0; row < rows; row++) {
            if (row > 0) {
                out.append(',');
            }
            out.append('{');
            for (int n = 0; n < names.size(); n++) {
                if (n > 0) {
                    out.append(',');
                }
                out.append(names.get(n)).append(':').append(columns.get(n).get(row));
            }
            out.append('}');
        }
        return out.append(']').toString();
    }

    /** Every match of {@code arg} at any depth, in document order. */
    private static String dig(JsonQuery query, String json, String arg) {
        List<String> found = new ArrayList<>();
        Deque<Value> pending = new ArrayDeque<>();
        pending.push(JsonScanner.parse(json));
        while (!pending.isEmpty()) {
            Value parent = pending.pop();
            Value result = query.getIn(parent, arg);
            if (result.exists()) {
                found.add(result.raw());
            }
            if (parent.isArray() || parent.isObject()) {
                Deque<Value> children = children(parent);
                while (!children.isEmpty()) {
                    pending.push(children.pollLast());
                }
            }
        }
        return "[" + String.join(",", found) + "]";
    }

    private static String search(JsonQuery query, String json, String arg) {
        if (arg.isEmpty()) {
            return json;
        }
        Value result = query.get(json, arg);
        if (!result.exists()) {
            return "";
        }
        return result.raw().isEmpty() ? JsonStrings.encode(result.toString()) : result.raw();
    }

    /** A path-evaluating modifier; calls made outside of a query run under {@code standalone}. */
    private static Modifier underQuery(JsonQuery standalone, QueryFunction function) {
        return new QueryAwareModifier() {
            @Override
            public String apply(String json, String arg) {
                return function.apply(standalone, json, arg);
            }

            @Override
            public String apply(JsonQuery query, String json, String arg) {
                return function.apply(query, json, arg);
            }
        };
    }

    @FunctionalInterface
    private interface QueryFunction {

        String apply(JsonQuery query, String json, String arg);
    }

    /** Lifts a text transform to a modifier over JSON strings. */
    private static Modifier text(UnaryOperator<String> transform) {
        return (json, arg) -> {
            Value value = JsonScanner.parse(json);
            if (value.kind() != Kind.STRING) {
                return json;
            }
            return JsonStrings.encode(transform.apply(value.text()));
        };
    }

    /** Splits text into lower-cased words at separators and lower-to-upper case changes. */
    static List<String> words(String s) {
        List<String> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                flush(word, words);
                continue;
            }
            if (Character.isUpperCase(c) && word.length() > 0) {
                char previous = s.charAt(i - 1);
                boolean nextLower = i + 1 < s.length() && Character.isLowerCase(s.charAt(i + 1));
                if (Character.isLowerCase(previous)
                        || Character.isDigit(previous)
                        || (Character.isUpperCase(previous) && nextLower)) {
                    flush(word, words);
                }
            }
            word.append(Character.toLowerCase(c));
        }
        flush(word, words);
        return words;
    }

    private static void flush(StringBuilder word, List<String> words) {
        if (word.length() > 0) {
            words.add(word.toString());
            word.setLength(0);
        }
    }

    private static String camelCase(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (String word : words(s)) {
            if (out.length() == 0) {
                out.append(word);
            } else {
                out.append(Character.toUpperCase(word.charAt(0))).append(word, 1, word.length());
            }
        }
        return out.toString();
    }

    private static String replaceFirst(String json, String arg) {
        ModifierArgs args = ModifierArgs.parse(arg);
        String target = args.text("target", "");
        String replacement = args.text("replacement", "");
        return text(s -> {
                    int at = target.isEmpty() ? -1 : s.indexOf(target);
                    return at < 0 ? s : s.substring(0, at) + replacement + s.substring(at + target.length());
                })
                .apply(json, arg);
    }

    private static String replaceAll(String json, String arg) {
        ModifierArgs args = ModifierArgs.parse(arg);
        String target = args.text("target", "");
        String replacement = args.text("replacement", "");
        return text(s -> target.isEmpty() ? s : s.replace(target, replacement)).apply(json, arg);
    }

    private static String insertAt(String json, String arg) {
        ModifierArgs args = ModifierArgs.parse(arg);
        String insert = args.text("insert", "");
        int index = args.integer("index", 0);
        return text(s -> {
                    int at = Math.max(0, Math.min(index, s.length()));
                    return s.substring(0, at) + insert + s.substring(at);
                })
                .apply(json, arg);
    }

    private static String pad(String json, String arg, boolean left) {
        ModifierArgs args = ModifierArgs.parse(arg);
        String padding = args.text("padding", " ");
        int length = args.integer("length", 0);
        return text(s -> {
                    if (padding.isEmpty() || s.length() >= length) {
                        return s;
                    }
                    StringBuilder fill = new StringBuilder(length);
                    while (fill.length() < length - s.length()) {
                        fill.append(padding);
                    }
                    fill.setLength(length - s.length());
                    return left ? fill + s : s + fill;
                })
                .apply(json, arg);
    }

    private static String wordCount(String json, String arg) {
        Value value = JsonScanner.parse(json);
        if (value.kind() != Kind.STRING) {
            return json;
        }
        String text = value.text().strip();
        return text.isEmpty() ? "0" : Integer.toString(text.split("\\s+").length);
    }

    /** Integral numbers in base 16 or 2; strings as the digits of their UTF-8 bytes. */
    private static String radix(String json, int radix) {
        Value value = JsonScanner.parse(json);
        if (value.kind() == Kind.NUMBER) {
            double number = value.number();
            var exact = Numbers.isIntegerText(value.raw())
                    ? Numbers.parseLong(value.raw())
                    : number == Math.rint(number) ? Numbers.safeLong(number) : OptionalLong.empty();
            if (exact.isEmpty()) {
                return json;
            }
            long n = exact.getAsLong();
            String digits = Long.toString(Math.abs(n), radix);
            if (n == Long.MIN_VALUE) {
                digits = Long.toUnsignedString(n, radix);
            }
            return JsonStrings.encode(n < 0 ? "-" + digits : digits);
        }
        if (value.kind() == Kind.STRING) {
            StringBuilder out = new StringBuilder();
            for (byte b : value.text().getBytes(StandardCharsets.UTF_8)) {
                String digits = Integer.toString(b & 0xff, radix);
                int width = radix == 16 ? 2 : 8;
                for (int n = digits.length(); n < width; n++) {
                    out.append('0');
                }
                out.append(digits);
            }
            return JsonStrings.encode(out.toString());
        }
        return json;
    }

    private static String unwrap(String json) {
        String trimmed = json.strip();
        if (trimmed.length() >= 2 && (trimmed.charAt(0) == '[' || trimmed.charAt(0) == '{')) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
