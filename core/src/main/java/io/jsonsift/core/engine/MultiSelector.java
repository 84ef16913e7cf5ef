package io.jsonsift.core.engine;

import io.jsonsift.core.model.Value;

/**
 * Builds new arrays and objects from several paths: {@code [a,b.c]} gives an array of the
 * results, {@code {a,"x":b.c}} an object. Paths that find nothing are left out. The built value
 * has no origin; a path following the closing bracket is applied to it.
 */
final class MultiSelector {

    private MultiSelector() {}

    /**
     * Evaluates a selector path against {@code json}. Returns null when {@code path} is not a
     * well-formed selector, in which case the caller treats it as an ordinary path.
     */
    static Value select(PathWalker walker, String json, String path) {
        PathSegments.Selection selection = PathSegments.selectors(path);
        if (selection == null) {
            return null;
        }
        String rest = selection.rest();
        if (!rest.isEmpty() && rest.charAt(0) != '|' && rest.charAt(0) != '.') {
            return null;
        }
        boolean object = path.charAt(0) == '{';
        StringBuilder out = new StringBuilder().append(object ? '{' : '[');
        int count = 0;
        for (PathSegments.Selector selector : selection.selectors()) {
            Value result = walker.get(json, selector.path());
            if (!result.exists()) {
                continue;
            }
            if (count > 0) {
                out.append(',');
            }
            if (object) {
                appendName(out, selector);
                out.append(':');
            }
            String raw = result.raw();
            if (raw.isEmpty()) {
                raw = result.toString();
                if (raw.isEmpty()) {
                    raw = "null";
                }
            }
            out.append(raw);
            count++;
        }
        out.append(object ? '}' : ']');
        Value built = Value.json(out.toString());
        if (!rest.isEmpty()) {
            return walker.get(built.raw(), rest.substring(1)).detached();
        }
        return built;
    }

    private static void appendName(StringBuilder out, PathSegments.Selector selector) {
        String name = selector.name();
        if (!name.isEmpty()) {
            if (name.charAt(0) == '"' && JsonValidator.isValid(name)) {
                out.append(name);
            } else {
                JsonStrings.appendEncoded(out, name);
            }
            return;
        }
        String last = PathSegments.lastComponent(selector.path());
        JsonStrings.appendEncoded(out, PathSegments.isSimpleName(last) ? last : "_");
    }
}
