package io.jsonsift.core.engine;

import io.jsonsift.core.model.Kind;
import io.jsonsift.core.model.Value;

/**
 * Span scanner over raw JSON text. Every method takes a start offset and returns the offset just
 * past the identified span; nothing is unescaped or materialized here and malformed input never
 * throws. Scalars end early or at the end of input; strings and composites that never close are
 * reported as {@code -1}.
 */
public final class JsonScanner {

    private JsonScanner() {}

    /** A scanned value together with the offset just past it. */
    public record Token(int end, Value value) {}

    /**
     * Scans a string whose opening quote is at {@code i - 1}. Returns the offset just past the
     * closing quote, or {@code -1} when the string is not terminated.
     */
    public static int stringEnd(String json, int i) {
        for (; i < json.length(); i++) {
            char c = json.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\') {
                i++;
            }
        }
        return -1;
    }

    /**
     * Scans a balanced composite whose opening brace, bracket or parenthesis is at {@code i}.
     * Brackets inside strings are ignored. Returns {@code -1} when the composite is not closed
     * before the end of input.
     */
    public static int compositeEnd(String json, int i) {
        int depth = 1;
        for (i++; i < json.length(); i++) {
            char c = json.charAt(i);
            switch (c) {
                case '"':
                    int end = stringEnd(json, i + 1);
                    if (end < 0) {
                        return -1;
                    }
                    i = end - 1;
                    break;
                case '{':
                case '[':
                case '(':
                    depth++;
                    break;
                case '}':
                case ']':
                case ')':
                    depth--;
                    if (depth == 0) {
                        return i + 1;
                    }
                    break;
                default:
                    break;
            }
        }
        return -1;
    }

    /** Scans a number token: it runs until whitespace, a comma or a closing bracket or brace. */
    public static int numberEnd(String json, int i) {
        for (i++; i < json.length(); i++) {
            char c = json.charAt(i);
            if (c <= ' ' || c == ',' || c == ']' || c == '}') {
                return i;
            }
        }
        return json.length();
    }

    /** Scans a literal token: it runs while lowercase ASCII letters follow. */
    public static int literalEnd(String json, int i) {
        for (i++; i < json.length(); i++) {
            char c = json.charAt(i);
            if (c < 'a' || c > 'z') {
                return i;
            }
        }
        return json.length();
    }

    /**
     * True when the character at {@code i} starts a number: a sign, a digit, {@code i},
     * {@code I}, {@code N}, or an {@code n} that is not the start of {@code null}.
     */
    public static boolean isNumberStart(String json, int i) {
        char c = json.charAt(i);
        if (c == 'n') {
            return i + 1 < json.length() && json.charAt(i + 1) != 'u';
        }
        return c == '-' || c == '+' || (c >= '0' && c <= '9') || c == 'i' || c == 'I' || c == 'N';
    }

    /** Skips whitespace (any character up to and including space). */
    public static int skipSpace(String json, int i) {
        while (i < json.length() && json.charAt(i) <= ' ') {
            i++;
        }
        return i;
    }

    /**
     * Identifies the next complete value at or after {@code i}, skipping leading whitespace and
     * any other character that cannot start a value. The returned value carries its offset in
     * {@code json} as origin. When nothing can be scanned the token holds {@link Value#none()}.
     */
    public static Token next(String json, int i) {
        for (; i < json.length(); i++) {
            char c = json.charAt(i);
            if (c <= ' ') {
                continue;
            }
            if (c == '{' || c == '[') {
                int end = compositeEnd(json, i);
                if (end < 0) {
                    return new Token(json.length(), Value.none());
                }
                return new Token(end, Value.json(json.substring(i, end)).at(i));
            }
            if (c == '"') {
                int end = stringEnd(json, i + 1);
                if (end < 0) {
                    return new Token(json.length(), Value.none());
                }
                return new Token(end, stringAt(json, i, end));
            }
            if (isNumberStart(json, i)) {
                int end = numberEnd(json, i);
                return new Token(end, numberAt(json, i, end));
            }
            if (c == 't' || c == 'f' || c == 'n') {
                int end = literalEnd(json, i);
                return new Token(end, literalAt(json, i, end));
            }
        }
        return new Token(i, Value.none());
    }

    /**
     * Reads the first value of {@code json}. An object or array takes the whole remaining text as
     * its raw form without checking it; a scalar is scanned like {@link #next}. Leading text that
     * cannot start a value yields {@link Value#none()}.
     */
    public static Value parse(String json) {
        int i = skipSpace(json, 0);
        if (i >= json.length()) {
            return Value.none();
        }
        char c = json.charAt(i);
        if (c == '{' || c == '[') {
            return Value.json(json.substring(i)).at(i);
        }
        if (c == '"') {
            int end = stringEnd(json, i + 1);
            if (end < 0) {
                String raw = json.substring(i);
                return Value.string(raw, JsonStrings.decodeToken(raw)).at(i);
            }
            return stringAt(json, i, end);
        }
        if (isNumberStart(json, i)) {
            return numberAt(json, i, numberEnd(json, i));
        }
        if (c == 't' || c == 'f' || c == 'n') {
            return literalAt(json, i, literalEnd(json, i));
        }
        return Value.none();
    }

    static Value stringAt(String json, int start, int end) {
        String raw = json.substring(start, end);
        return Value.string(raw, JsonStrings.decodeToken(raw)).at(start);
    }

    static Value numberAt(String json, int start, int end) {
        String raw = json.substring(start, end);
        return Value.number(raw, Numbers.decode(raw)).at(start);
    }

    static Value literalAt(String json, int start, int end) {
        String raw = json.substring(start, end);
        Kind kind;
        switch (json.charAt(start)) {
            case 't':
                kind = Kind.TRUE;
                break;
            case 'f':
                kind = Kind.FALSE;
                break;
            default:
                kind = Kind.NULL;
        }
        return Value.literal(kind, raw).at(start);
    }
}
