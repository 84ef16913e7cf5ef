package io.jsonsift.core.engine;

import java.util.Locale;

/**
 * Literal segments: {@code !value} injects a constant instead of reading the document. A JSON
 * string, number, object or array is taken verbatim; otherwise the literal runs to the next
 * {@code .} or {@code |} and must be {@code true}, {@code false}, {@code null}, {@code nan} or
 * {@code inf}.
 */
final class Literals {

    /** The literal's JSON text and the path that follows it. */
    record Literal(String json, String rest) {}

    private Literals() {}

    /** Parses a path starting with {@code !}; null when the literal is not recognized. */
    static Literal parse(String path) {
        String body = path.substring(1);
        if (body.isEmpty()) {
            return null;
        }
        char first = body.charAt(0);
        if (first == '{' || first == '[' || first == '"') {
            String json = PathSegments.squash(body);
            return new Literal(json, body.substring(json.length()));
        }
        if (first == '+' || first == '-' || (first >= '0' && first <= '9')) {
            int end = Numbers.numericPrefix(body);
            if (end > 0 && body.charAt(end - 1) == '.') {
                end--;
            }
            if (end == 0) {
                return null;
            }
            return new Literal(body.substring(0, end), body.substring(end));
        }
        int end = 0;
        while (end < body.length() && body.charAt(end) != '.' && body.charAt(end) != '|') {
            end++;
        }
        String word = body.substring(0, end);
        String rest = body.substring(end);
        switch (word.toLowerCase(Locale.ROOT)) {
            case "true":
            case "false":
            case "null":
                return new Literal(word.toLowerCase(Locale.ROOT), rest);
            case "nan":
            case "inf":
                return new Literal(word, rest);
            default:
                return null;
        }
    }
}
