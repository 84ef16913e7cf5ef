package io.jsonsift.core.engine;

import io.jsonsift.core.model.Value;
import java.util.ArrayList;
import java.util.List;

/**
 * Recovers the path that leads to a value from its origin in the document, by walking backwards
 * from the origin and collecting the enclosing keys and array positions. Only values inside the
 * first top-level value of the document can be traced.
 */
final class PathReconstructor {

    private PathReconstructor() {}

    /**
     * The path of {@code value} in {@code document}, or {@code ""} when it cannot be recovered.
     * The document root gives {@code @this}, or {@code ""} when modifiers are disabled.
     */
    static String path(Value value, String document, boolean modifiersEnabled) {
        if (!value.exists() || !value.hasOrigin()) {
            return "";
        }
        int origin = value.origin();
        String raw = value.raw();
        if (origin + raw.length() > document.length() || !document.startsWith(raw, origin)) {
            return "";
        }
        List<String> components = new ArrayList<>();
        for (int i = origin - 1; i >= 0; i--) {
            char c = document.charAt(i);
            if (c <= ' ') {
                continue;
            }
            if (c == ':') {
                while (i >= 0 && document.charAt(i) != '"') {
                    i--;
                }
                if (i < 0) {
                    return "";
                }
                int keyStart = reverseSquash(document, i);
                components.add(document.substring(keyStart, i + 1));
                i = keyStart - 1;
                if (i < 0) {
                    return "";
                }
                // skip the members before the key back to the opening brace
                i = reverseSquash(document, i);
            } else if (c == '{') {
                return "";
            } else if (c == ',' || c == '[') {
                int index = 0;
                if (c == ',') {
                    index++;
                    i--;
                }
                for (; i >= 0; i--) {
                    char d = document.charAt(i);
                    if (d == ':') {
                        return "";
                    } else if (d == ',') {
                        index++;
                    } else if (d == '[') {
                        components.add(Integer.toString(index));
                        break;
                    } else if (d == ']' || d == '}' || d == '"') {
                        i = reverseSquash(document, i);
                    }
                }
            } else {
                // the walk left the top-level value, e.g. into an earlier JSON Lines entry
                return "";
            }
        }
        if (components.isEmpty()) {
            return modifiersEnabled ? "@this" : "";
        }
        StringBuilder path = new StringBuilder();
        for (int n = components.size() - 1; n >= 0; n--) {
            Value component = JsonScanner.parse(components.get(n));
            if (!component.exists()) {
                return "";
            }
            if (path.length() > 0) {
                path.append('.');
            }
            path.append(JsonStrings.escapePathComponent(component.toString()));
        }
        return path.toString();
    }

    /** Paths of each element of a {@code #(...)#} result; empty when they cannot all be matched up. */
    static List<String> paths(Value value, String document, boolean modifiersEnabled) {
        if (value.matchOffsets().isEmpty()) {
            return List.of();
        }
        List<String> paths = new ArrayList<>();
        value.forEach((key, element) -> paths.add(path(element, document, modifiersEnabled)));
        if (paths.size() != value.matchOffsets().size()) {
            return List.of();
        }
        return paths;
    }

    /**
     * Start of the string token or balanced composite ending at {@code last}. When {@code last}
     * is not a closing character, this finds the opening bracket of the container holding it.
     */
    static int reverseSquash(String s, int last) {
        int i = last;
        int depth = 0;
        char c = s.charAt(i);
        if (c != '"') {
            depth++;
        }
        if (c == '}' || c == ']' || c == ')') {
            i--;
        }
        for (; i >= 0; i--) {
            switch (s.charAt(i)) {
                case '"':
                    for (i--; i >= 0; i--) {
                        if (s.charAt(i) != '"') {
                            continue;
                        }
                        int escapes = 0;
                        while (i > 0 && s.charAt(i - 1) == '\\') {
                            i--;
                            escapes++;
                        }
                        if (escapes % 2 == 1) {
                            continue;
                        }
                        i += escapes;
                        break;
                    }
                    if (depth == 0) {
                        return Math.max(i, 0);
                    }
                    break;
                case '}':
                case ']':
                case ')':
                    depth++;
                    break;
                case '{':
                case '[':
                case '(':
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                    break;
                default:
                    break;
            }
        }
        return 0;
    }
}
