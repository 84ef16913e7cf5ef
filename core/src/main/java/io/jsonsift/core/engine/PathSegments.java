package io.jsonsift.core.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits path expressions into segments. Paths are never compiled ahead of time; the walker
 * asks for one segment at a time and receives the unparsed remainder with it.
 */
final class PathSegments {

    private PathSegments() {}

    /**
     * A segment addressed inside an object.
     *
     * @param key the key with escapes resolved
     * @param pattern the segment text as written, used for wildcard matching
     * @param rest the path after a {@code .} separator when {@code more} is set
     * @param pipe the path after a {@code |} (or a {@code .} that starts a new root)
     * @param wild whether the segment contains {@code *} or {@code ?}
     */
    record ObjectSegment(String key, String pattern, String rest, String pipe, boolean more, boolean piped, boolean wild) {}

    /** A {@code #(...)} or {@code #[...]} predicate. Invalid predicates match nothing. */
    record Query(String path, String op, String value, boolean all, boolean valid) {

        static final Query INVALID = new Query("", "", "", false, false);
    }

    /**
     * A segment addressed inside an array.
     *
     * @param part the segment text: an index, {@code #}, or a query
     * @param counting whether the segment starts with {@code #}
     * @param collectKey for {@code #.key}, the path collected from every element, else null
     * @param query the predicate for {@code #(...)} segments, else null
     */
    record ArraySegment(
            String part,
            String rest,
            String pipe,
            boolean more,
            boolean piped,
            boolean counting,
            String collectKey,
            Query query) {}

    /** Parsed pieces of a predicate, {@code end} being the offset after its closing bracket. */
    record QueryParts(String path, String op, String value, int end, boolean escaped) {}

    /** A path split around its first top-level {@code |}. */
    record Split(String left, String right) {}

    /** One item of a multi-selector; {@code name} is empty when none was written. */
    record Selector(String name, String path) {}

    /** The items of a multi-selector and the path that follows its closing bracket. */
    record Selection(List<Selector> selectors, String rest) {}

    /** A {@code @name:arg} invocation and the path that follows it. */
    record ModifierCall(String name, String arg, String rest) {}

    static ObjectSegment objectSegment(String path, boolean modifiersEnabled) {
        StringBuilder key = new StringBuilder(path.length());
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '\\') {
                i++;
                if (i < path.length()) {
                    key.append(path.charAt(i));
                }
                continue;
            }
            if (c == '|') {
                return objectSegment(key, path.substring(0, i), "", path.substring(i + 1), false, true);
            }
            if (c == '.') {
                String after = path.substring(i + 1);
                if (!after.isEmpty() && startsNewRoot(after, modifiersEnabled)) {
                    return objectSegment(key, path.substring(0, i), "", after, false, true);
                }
                return objectSegment(key, path.substring(0, i), after, "", true, false);
            }
            key.append(c);
        }
        return objectSegment(key, path, "", "", false, false);
    }

    private static ObjectSegment objectSegment(
            CharSequence key, String pattern, String rest, String pipe, boolean more, boolean piped) {
        return new ObjectSegment(
                key.toString(), pattern, rest, pipe, more, piped, WildcardMatcher.isPattern(pattern));
    }

    static ArraySegment arraySegment(String path, boolean modifiersEnabled) {
        boolean counting = false;
        String collectKey = null;
        Query query = null;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '|') {
                return new ArraySegment(
                        path.substring(0, i), "", path.substring(i + 1), false, true, counting, collectKey, query);
            }
            if (c == '.') {
                String after = path.substring(i + 1);
                if (!counting && !after.isEmpty() && startsNewRoot(after, modifiersEnabled)) {
                    return new ArraySegment(path.substring(0, i), "", after, false, true, false, null, null);
                }
                return new ArraySegment(path.substring(0, i), after, "", true, false, counting, collectKey, query);
            }
            if (c != '#') {
                continue;
            }
            counting = true;
            if (i != 0 || path.length() < 2) {
                continue;
            }
            char next = path.charAt(1);
            if (next == '.') {
                collectKey = path.substring(2);
            } else if (next == '[' || next == '(') {
                QueryParts parts = queryParts(path);
                if (parts == null) {
                    return new ArraySegment(path, "", "", false, false, true, null, Query.INVALID);
                }
                String value = parts.value();
                if (value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"') {
                    value = value.substring(1, value.length() - 1);
                    if (parts.escaped()) {
                        value = JsonStrings.unescape(value);
                    }
                }
                i = parts.end() - 1;
                boolean all = i + 1 < path.length() && path.charAt(i + 1) == '#';
                query = new Query(parts.path(), parts.op(), value, all, true);
            }
        }
        return new ArraySegment(path, "", "", false, false, counting, collectKey, query);
    }

    /**
     * Splits {@code #(path op value)} into its parts. The operator is one of {@code = != < <= >
     * >= % !%}; {@code ==} is read as {@code =}. Returns null when the brackets do not balance.
     */
    static QueryParts queryParts(String query) {
        if (query.length() < 2 || query.charAt(0) != '#' || (query.charAt(1) != '(' && query.charAt(1) != '[')) {
            return null;
        }
        boolean escaped = false;
        int valueStart = 0;
        int depth = 1;
        int i = 2;
        for (; i < query.length(); i++) {
            char c = query.charAt(i);
            if (depth == 1 && valueStart == 0 && (c == '!' || c == '=' || c == '<' || c == '>' || c == '%')) {
                valueStart = i;
                continue;
            }
            if (c == '\\') {
                i++;
            } else if (c == '[' || c == '(') {
                depth++;
            } else if (c == ']' || c == ')') {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (c == '"') {
                for (i++; i < query.length(); i++) {
                    char q = query.charAt(i);
                    if (q == '\\') {
                        escaped = true;
                        i++;
                    } else if (q == '"') {
                        break;
                    }
                }
            }
        }
        if (depth > 0) {
            return null;
        }
        if (valueStart == 0) {
            return new QueryParts(trim(query.substring(2, i)), "", "", i + 1, escaped);
        }
        String path = trim(query.substring(2, valueStart));
        String value = trim(query.substring(valueStart, i));
        int opLength = operatorLength(value);
        String op = value.substring(0, opLength);
        if (op.equals("==")) {
            op = "=";
        }
        return new QueryParts(path, op, trim(value.substring(opLength)), i + 1, escaped);
    }

    private static int operatorLength(String value) {
        if (value.length() == 1) {
            return 1;
        }
        char first = value.charAt(0);
        char second = value.charAt(1);
        if ((first == '!' && (second == '=' || second == '%'))
                || ((first == '<' || first == '>' || first == '=') && second == '=')) {
            return 2;
        }
        if (first == '<' || first == '>' || first == '=' || first == '%') {
            return 1;
        }
        return 0;
    }

    /**
     * A {@code .} followed by a modifier or a multi-selector hands the produced value to the rest
     * of the path as a new root, the same as {@code |}.
     */
    static boolean startsNewRoot(String s, boolean modifiersEnabled) {
        if (!modifiersEnabled) {
            return false;
        }
        char c = s.charAt(0);
        return c == '@' || c == '[' || c == '{';
    }

    /**
     * Splits a path at its first top-level {@code |}, skipping over escapes and the brackets of
     * nested queries. Returns null when there is none.
     */
    static Split splitPipe(String path) {
        if (path.indexOf('|') < 0) {
            return null;
        }
        if (path.charAt(0) == '{') {
            int end = balancedEnd(path, 0);
            if (end < path.length() && path.charAt(end) == '|') {
                return new Split(path.substring(0, end), path.substring(end + 1));
            }
            return null;
        }
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '.') {
                if (i == path.length() - 1) {
                    return null;
                }
                if (path.charAt(i + 1) != '#') {
                    continue;
                }
                i += 2;
                if (i == path.length()) {
                    return null;
                }
                if (path.charAt(i) == '[' || path.charAt(i) == '(') {
                    i = closingBracket(path, i);
                }
            } else if (c == '|') {
                return new Split(path.substring(0, i), path.substring(i + 1));
            }
        }
        return null;
    }

    // offset of the bracket closing the one at start, skipping quoted text; length when unbalanced
    private static int closingBracket(String path, int start) {
        char open = path.charAt(start);
        char close = open == '[' ? ']' : ')';
        int depth = 1;
        int i = start + 1;
        for (; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (c == '"') {
                for (i++; i < path.length(); i++) {
                    if (path.charAt(i) == '\\') {
                        i++;
                    } else if (path.charAt(i) == '"') {
                        break;
                    }
                }
            }
        }
        return i;
    }

    /**
     * Parses the items of a {@code [p1,p2]} or {@code {p1,"name":p2}} selector. Returns null when
     * the brackets do not close.
     */
    static Selection selectors(String path) {
        List<Selector> selectors = new ArrayList<>();
        int modifier = 0;
        int depth = 1;
        int colon = 0;
        int start = 1;
        for (int i = 1; i < path.length(); i++) {
            char c = path.charAt(i);
            switch (c) {
                case '\\':
                    i++;
                    break;
                case '@':
                    if (modifier == 0 && (path.charAt(i - 1) == '.' || path.charAt(i - 1) == '|')) {
                        modifier = i;
                    }
                    break;
                case ':':
                    if (modifier == 0 && colon == 0 && depth == 1) {
                        colon = i;
                    }
                    break;
                case ',':
                    if (depth == 1) {
                        selectors.add(selector(path, start, colon, i));
                        colon = 0;
                        modifier = 0;
                        start = i + 1;
                    }
                    break;
                case '"':
                    for (i++; i < path.length(); i++) {
                        char q = path.charAt(i);
                        if (q == '\\') {
                            i++;
                        } else if (q == '"') {
                            break;
                        }
                    }
                    break;
                case '[':
                case '(':
                case '{':
                    depth++;
                    break;
                case ']':
                case ')':
                case '}':
                    depth--;
                    if (depth == 0) {
                        selectors.add(selector(path, start, colon, i));
                        return new Selection(selectors, path.substring(i + 1));
                    }
                    break;
                default:
                    break;
            }
        }
        return null;
    }

    private static Selector selector(String path, int start, int colon, int end) {
        if (colon == 0) {
            return new Selector("", path.substring(start, end));
        }
        return new Selector(path.substring(start, colon), path.substring(colon + 1, end));
    }

    /** Parses {@code @name}, {@code @name:arg} and the path following the invocation. */
    static ModifierCall modifierCall(String path) {
        String name = path.substring(1);
        String rest = "";
        boolean hasArg = false;
        for (int i = 1; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == ':') {
                name = path.substring(1, i);
                rest = path.substring(i + 1);
                hasArg = !rest.isEmpty();
                break;
            }
            if (c == '|' || c == '.') {
                name = path.substring(1, i);
                rest = path.substring(i);
                break;
            }
        }
        if (!hasArg) {
            return new ModifierCall(name, "", rest);
        }
        char first = rest.charAt(0);
        if (first == '{' || first == '[' || first == '"') {
            String arg = squash(rest);
            return new ModifierCall(name, arg, rest.substring(arg.length()));
        }
        int i = 0;
        for (; i < rest.length(); i++) {
            char c = rest.charAt(i);
            if (c == '|') {
                break;
            }
            if (c == '{' || c == '[' || c == '"' || c == '(') {
                i += squash(rest.substring(i)).length() - 1;
            }
        }
        return new ModifierCall(name, rest.substring(0, i), rest.substring(i));
    }

    /** The leading balanced composite or string token of {@code s}. */
    static String squash(String s) {
        if (s.charAt(0) == '"') {
            int end = JsonScanner.stringEnd(s, 1);
            return end < 0 ? s : s.substring(0, end);
        }
        return s.substring(0, balancedEnd(s, 0));
    }

    /** Like {@link JsonScanner#compositeEnd} but an unclosed group runs to the end of the path. */
    private static int balancedEnd(String path, int i) {
        int end = JsonScanner.compositeEnd(path, i);
        return end < 0 ? path.length() : end;
    }

    /** The last component of a path: the text after its last unescaped {@code .} or {@code |}. */
    static String lastComponent(String path) {
        for (int i = path.length() - 1; i >= 0; i--) {
            char c = path.charAt(i);
            if ((c == '|' || c == '.') && (i == 0 || path.charAt(i - 1) != '\\')) {
                return path.substring(i + 1);
            }
        }
        return path;
    }

    /** True when a component has no control characters and none of {@code []{}()#|!}. */
    static boolean isSimpleName(String component) {
        for (int i = 0; i < component.length(); i++) {
            char c = component.charAt(i);
            if (c < ' ') {
                return false;
            }
            switch (c) {
                case '[':
                case ']':
                case '{':
                case '}':
                case '(':
                case ')':
                case '#':
                case '|':
                case '!':
                    return false;
                default:
                    break;
            }
        }
        return true;
    }

    static String trim(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) <= ' ') {
            start++;
        }
        while (end > start && s.charAt(end - 1) <= ' ') {
            end--;
        }
        return s.substring(start, end);
    }
}
