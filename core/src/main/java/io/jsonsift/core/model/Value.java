package io.jsonsift.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ContainerNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jsonsift.core.engine.JsonQuery;
import io.jsonsift.core.engine.JsonScanner;
import io.jsonsift.core.engine.Numbers;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.BiPredicate;

/**
 * Immutable result of a query: a typed view over a span of JSON text.
 *
 * <p>A value knows its {@link Kind}, the exact raw text backing it, the decoded string payload
 * (strings only), the decoded number (numbers only) and where the raw text sits in the document
 * it was found in. Values built by the engine (counts, multi-selector output, modifier output)
 * have no known origin and report {@code 0}.
 *
 * <p>All accessors are total: a conversion that does not apply yields its type's zero value.
 */
public final class Value {

    private static final Value NONE = new Value(Kind.NULL, "", "", 0, 0, false, List.of(), null);

    private final Kind kind;
    private final String raw;
    private final String text;
    private final double number;
    private final int origin;
    private final boolean anchored;
    private final List<Integer> matchOffsets;
    private final JsonQuery owner;

    private Value(
            Kind kind,
            String raw,
            String text,
            double number,
            int origin,
            boolean anchored,
            List<Integer> matchOffsets,
            JsonQuery owner) {
        this.kind = kind;
        this.raw = raw;
        this.text = text;
        this.number = number;
        this.origin = origin;
        this.anchored = anchored;
        this.matchOffsets = matchOffsets;
        this.owner = owner;
    }

    /** The non-existent value. */
    public static Value none() {
        return NONE;
    }

    /** A string value from its raw token and decoded payload. */
    public static Value string(String raw, String text) {
        return new Value(Kind.STRING, raw, text, 0, 0, false, List.of(), null);
    }

    /** A number value from its raw token and decoded double. */
    public static Value number(String raw, double number) {
        return new Value(Kind.NUMBER, raw, "", number, 0, false, List.of(), null);
    }

    /** A computed number, e.g. an element count; its raw text is the integer rendering. */
    public static Value count(int count) {
        return new Value(Kind.NUMBER, Integer.toString(count), "", count, 0, false, List.of(), null);
    }

    /** An object or array value from its raw text. */
    public static Value json(String raw) {
        return new Value(Kind.JSON, raw, "", 0, 0, false, List.of(), null);
    }

    /** A {@code true}, {@code false} or {@code null} value from its raw token. */
    public static Value literal(Kind kind, String raw) {
        return new Value(kind, raw, "", 0, 0, false, List.of(), null);
    }

    /** Returns a copy whose raw text is known to start at {@code offset} of the queried text. */
    public Value at(int offset) {
        return new Value(kind, raw, text, number, offset, true, matchOffsets, owner);
    }

    /** Returns a copy with no known origin and no match offsets. */
    public Value detached() {
        if (!anchored && matchOffsets.isEmpty()) {
            return this;
        }
        return new Value(kind, raw, text, number, 0, false, List.of(), owner);
    }

    /** Returns a copy carrying the given per-element offsets of a multi-match array. */
    public Value withMatchOffsets(List<Integer> offsets) {
        return new Value(kind, raw, text, number, origin, anchored, List.copyOf(offsets), owner);
    }

    /** Returns a copy that resolves nested {@link #get(String)} calls with {@code query}. */
    public Value withOwner(JsonQuery query) {
        if (owner == query) {
            return this;
        }
        return new Value(kind, raw, text, number, origin, anchored, matchOffsets, query);
    }

    /**
     * Returns a copy whose origin and match offsets are shifted by {@code delta}. Used when a
     * result found inside a value's raw text is mapped back onto the enclosing document.
     */
    public Value shiftedBy(int delta) {
        List<Integer> shifted = matchOffsets;
        if (!matchOffsets.isEmpty()) {
            List<Integer> offsets = new ArrayList<>(matchOffsets.size());
            for (int offset : matchOffsets) {
                offsets.add(offset == 0 ? 0 : offset + delta);
            }
            shifted = Collections.unmodifiableList(offsets);
        }
        return new Value(kind, raw, text, number, anchored ? origin + delta : 0, anchored, shifted, owner);
    }

    public Kind kind() {
        return kind;
    }

    /** The exact source text backing this value; empty for the non-existent value. */
    public String raw() {
        return raw;
    }

    /** The decoded string payload for strings, otherwise empty. */
    public String text() {
        return text;
    }

    /** The decoded number for numbers, otherwise 0. */
    public double number() {
        return number;
    }

    /** Offset of {@link #raw()} in the queried document, or 0 when unknown. */
    public int origin() {
        return anchored ? origin : 0;
    }

    /** True when {@link #origin()} is a real position in the queried document. */
    public boolean hasOrigin() {
        return anchored;
    }

    /** Offsets of each element of a multi-match array (0 marks an unknown element), else empty. */
    public List<Integer> matchOffsets() {
        return matchOffsets;
    }

    public boolean exists() {
        return kind != Kind.NULL || !raw.isEmpty();
    }

    public boolean isObject() {
        return kind == Kind.JSON && !raw.isEmpty() && raw.charAt(0) == '{';
    }

    public boolean isArray() {
        return kind == Kind.JSON && !raw.isEmpty() && raw.charAt(0) == '[';
    }

    public boolean isBool() {
        return kind == Kind.TRUE || kind == Kind.FALSE;
    }

    public boolean asBoolean() {
        switch (kind) {
            case TRUE:
                return true;
            case NUMBER:
                return number != 0;
            case STRING:
                return parseBool(text).orElse(false);
            default:
                return false;
        }
    }

    public long asLong() {
        switch (kind) {
            case TRUE:
                return 1;
            case STRING:
                return Numbers.parseLong(text).orElse(0);
            case NUMBER:
                var safe = Numbers.safeLong(number);
                if (safe.isPresent()) {
                    return safe.getAsLong();
                }
                var exact = Numbers.parseLong(raw);
                return exact.isPresent() ? exact.getAsLong() : (long) number;
            default:
                return 0;
        }
    }

    /** Unsigned 64-bit conversion; read the result with {@link Long#toUnsignedString(long)}. */
    public long asUnsignedLong() {
        switch (kind) {
            case TRUE:
                return 1;
            case STRING:
                return Numbers.parseUnsignedLong(text).orElse(0);
            case NUMBER:
                var safe = Numbers.safeLong(number);
                if (safe.isPresent() && safe.getAsLong() >= 0) {
                    return safe.getAsLong();
                }
                var exact = Numbers.parseUnsignedLong(raw);
                if (exact.isPresent()) {
                    return exact.getAsLong();
                }
                if (number > Long.MAX_VALUE && !Double.isInfinite(number)) {
                    return new BigDecimal(number).toBigInteger().longValue();
                }
                return (long) number;
            default:
                return 0;
        }
    }

    public int asInt() {
        return (int) asLong();
    }

    public double asDouble() {
        switch (kind) {
            case TRUE:
                return 1;
            case STRING:
                OptionalDouble parsed = Numbers.parseStrict(text);
                return parsed.orElse(0);
            case NUMBER:
                return number;
            default:
                return 0;
        }
    }

    /** Parses {@link #toString()} as an RFC 3339 timestamp. */
    public Optional<OffsetDateTime> time() {
        try {
            return Optional.of(OffsetDateTime.parse(toString()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * The elements of an array. A non-existent or null value gives an empty list, any other
     * non-array value a singleton list.
     */
    public List<Value> array() {
        if (kind == Kind.NULL) {
            return List.of();
        }
        if (!isArray()) {
            return List.of(this);
        }
        List<Value> elements = new ArrayList<>();
        forEach((key, value) -> elements.add(value));
        return elements;
    }

    /** The members of an object; the first occurrence of a duplicate key wins. */
    public Map<String, Value> map() {
        Map<String, Value> members = new LinkedHashMap<>();
        if (!isObject()) {
            return members;
        }
        forEach((key, value) -> {
            members.putIfAbsent(key.text(), value);
            return true;
        });
        return members;
    }

    /**
     * Iterates over the members of an object or the elements of an array. Object keys arrive as
     * string values, array positions as number values. A scalar is passed once with a
     * non-existent key; a non-existent value is not iterated. Iteration stops when the callback
     * returns {@code false}.
     */
    public void forEach(BiPredicate<Value, Value> callback) {
        if (!exists()) {
            return;
        }
        if (kind != Kind.JSON) {
            callback.test(NONE, this);
            return;
        }
        if (!matchOffsets.isEmpty()) {
            List<Value[]> pairs = new ArrayList<>();
            scanMembers((key, value) -> pairs.add(new Value[] {key, value}));
            boolean aligned = pairs.size() == matchOffsets.size();
            for (int n = 0; n < pairs.size(); n++) {
                Value element = pairs.get(n)[1];
                int offset = aligned ? matchOffsets.get(n) : 0;
                element = offset > 0 ? element.repositioned(offset) : element.unpositioned();
                if (!callback.test(pairs.get(n)[0], element)) {
                    return;
                }
            }
            return;
        }
        scanMembers(callback);
    }

    private void scanMembers(BiPredicate<Value, Value> callback) {
        String json = raw;
        int i = JsonScanner.skipSpace(json, 0);
        if (i >= json.length() || (json.charAt(i) != '{' && json.charAt(i) != '[')) {
            return;
        }
        boolean object = json.charAt(i) == '{';
        int index = 0;
        i++;
        while (i < json.length()) {
            Value key = NONE;
            if (object) {
                while (i < json.length() && json.charAt(i) != '"') {
                    i++;
                }
                if (i >= json.length()) {
                    return;
                }
                JsonScanner.Token keyToken = JsonScanner.next(json, i);
                if (!keyToken.value().exists()) {
                    return;
                }
                key = child(keyToken.value());
                i = keyToken.end();
            } else {
                key = Value.count(index);
            }
            while (i < json.length() && (json.charAt(i) <= ' ' || json.charAt(i) == ',' || json.charAt(i) == ':')) {
                i++;
            }
            if (i >= json.length() || json.charAt(i) == ']' || json.charAt(i) == '}') {
                return;
            }
            JsonScanner.Token token = JsonScanner.next(json, i);
            if (!token.value().exists() || !callback.test(key, child(token.value()))) {
                return;
            }
            i = token.end();
            index++;
        }
    }

    private Value child(Value scanned) {
        Value value = anchored ? scanned.shiftedBy(origin) : scanned.unpositioned();
        return value.withOwner(owner);
    }

    private Value repositioned(int offset) {
        return new Value(kind, raw, text, number, offset, true, List.of(), owner);
    }

    private Value unpositioned() {
        return new Value(kind, raw, text, number, 0, false, matchOffsets, owner);
    }

    /**
     * Evaluates a path against this value's raw text. Origins and match offsets of the result are
     * mapped back onto this value's document when this value's own origin is known.
     */
    public Value get(String path) {
        return (owner != null ? owner : JsonQuery.defaults()).getIn(this, path);
    }

    /**
     * Ordering used for sorting: by kind rank first, then strings lexically, numbers numerically
     * and everything else by raw text.
     */
    public boolean less(Value other, boolean caseSensitive) {
        if (kind != other.kind) {
            return kind.compareTo(other.kind) < 0;
        }
        if (kind == Kind.STRING) {
            return caseSensitive ? text.compareTo(other.text) < 0 : lessIgnoringAsciiCase(text, other.text);
        }
        if (kind == Kind.NUMBER) {
            return number < other.number;
        }
        return raw.compareTo(other.raw) < 0;
    }

    private static boolean lessIgnoringAsciiCase(String a, String b) {
        int n = Math.min(a.length(), b.length());
        for (int i = 0; i < n; i++) {
            char ca = foldAscii(a.charAt(i));
            char cb = foldAscii(b.charAt(i));
            if (ca != cb) {
                return ca < cb;
            }
        }
        return a.length() < b.length();
    }

    private static char foldAscii(char c) {
        return c >= 'A' && c <= 'Z' ? (char) (c + 32) : c;
    }

    /**
     * Materializes this value as a Jackson tree: booleans, numbers (integral text as long),
     * strings, null, arrays and objects. Duplicate object keys keep their first occurrence. A
     * non-existent value becomes a {@code NullNode}.
     */
    public JsonNode toJsonNode() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        switch (kind) {
            case TRUE:
                return nodes.booleanNode(true);
            case FALSE:
                return nodes.booleanNode(false);
            case STRING:
                return nodes.textNode(text);
            case NUMBER:
                if (Numbers.isIntegerText(raw)) {
                    var exact = Numbers.parseLong(raw);
                    if (exact.isPresent()) {
                        return nodes.numberNode(exact.getAsLong());
                    }
                }
                return nodes.numberNode(number);
            case JSON:
                return treeNode(raw);
            default:
                return nodes.nullNode();
        }
    }

    /** Builds an array or object tree in one pass, keeping open containers on a stack. */
    private static JsonNode treeNode(String json) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        int i = JsonScanner.skipSpace(json, 0);
        if (i >= json.length() || (json.charAt(i) != '{' && json.charAt(i) != '[')) {
            return nodes.nullNode();
        }
        ContainerNode<?> root = json.charAt(i) == '{' ? nodes.objectNode() : nodes.arrayNode();
        Deque<ContainerNode<?>> open = new ArrayDeque<>();
        open.push(root);
        String key = null;
        i++;
        while (i < json.length() && !open.isEmpty()) {
            char c = json.charAt(i);
            ContainerNode<?> parent = open.peek();
            if (c == '}' || c == ']') {
                open.pop();
                key = null;
                i++;
                continue;
            }
            if (parent.isObject() && key == null) {
                if (c == '"') {
                    JsonScanner.Token token = JsonScanner.next(json, i);
                    if (!token.value().exists()) {
                        break;
                    }
                    key = token.value().text;
                    i = token.end();
                } else {
                    i++;
                }
                continue;
            }
            JsonNode node;
            if (c == '{' || c == '[') {
                ContainerNode<?> child = c == '{' ? nodes.objectNode() : nodes.arrayNode();
                open.push(child);
                node = child;
                i++;
            } else if (c == '"' || c == 't' || c == 'f' || c == 'n' || JsonScanner.isNumberStart(json, i)) {
                JsonScanner.Token token = JsonScanner.next(json, i);
                if (!token.value().exists()) {
                    break;
                }
                node = token.value().toJsonNode();
                i = token.end();
            } else {
                i++;
                continue;
            }
            if (parent.isArray()) {
                ((ArrayNode) parent).add(node);
            } else if (!parent.has(key)) {
                ((ObjectNode) parent).set(key, node);
            }
            key = null;
        }
        return root;
    }

    /**
     * Display string: {@code true}/{@code false}, a number's raw text when it is a plain integer
     * (otherwise the shortest decimal rendering), a string's decoded payload, the raw text of an
     * object or array, and the empty string for null or non-existent values.
     */
    @Override
    public String toString() {
        switch (kind) {
            case FALSE:
                return "false";
            case TRUE:
                return "true";
            case NUMBER:
                return Numbers.isIntegerText(raw) ? raw : Numbers.format(number);
            case STRING:
                return text;
            case JSON:
                return raw;
            default:
                return "";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        return kind == other.kind
                && Double.compare(number, other.number) == 0
                && origin() == other.origin()
                && anchored == other.anchored
                && raw.equals(other.raw)
                && text.equals(other.text)
                && matchOffsets.equals(other.matchOffsets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, raw, text, number, origin(), anchored, matchOffsets);
    }

    private static Optional<Boolean> parseBool(String s) {
        switch (s.toLowerCase(Locale.ROOT)) {
            case "1":
            case "t":
            case "true":
                return Optional.of(Boolean.TRUE);
            case "0":
            case "f":
            case "false":
                return Optional.of(Boolean.FALSE);
            default:
                return Optional.empty();
        }
    }
}
