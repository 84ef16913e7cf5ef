package io.jsonsift.core.engine;

import io.jsonsift.core.model.Value;
import io.jsonsift.core.spi.Modifier;
import io.jsonsift.core.spi.QueryAwareModifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a path against raw JSON text, one segment at a time, without building a tree.
 *
 * <p>Objects and arrays are scanned member by member. A member that matches the current segment
 * is either the result (last segment) or descended into with the rest of the path; members that
 * do not match are skipped as balanced spans. Results keep their offset in the scanned text.
 *
 * <p>Paths starting with {@code @}, {@code !}, {@code [} or {@code {} are handled before the
 * scan: modifiers, literals and multi-selectors produce new JSON text that becomes the root for
 * whatever path follows them. A path starting with {@code ..} reads the text as JSON Lines.
 */
final class PathWalker {

    private static final Logger LOG = LoggerFactory.getLogger(PathWalker.class);

    /** Where a scan stopped and whether it produced the result. */
    private record Outcome(int index, boolean found) {}

    /** State shared by the nested scans of one evaluation. */
    private static final class Walk {

        final String json;
        Value result = Value.none();
        String pipe = "";
        boolean piped;

        Walk(String json) {
            this.json = json;
        }

        void pipeTo(String path) {
            pipe = path;
            piped = true;
        }
    }

    private final JsonQuery query;

    PathWalker(JsonQuery query) {
        this.query = query;
    }

    private boolean modifiersEnabled() {
        return !query.options().disableModifiers();
    }

    private int wildcardLimit() {
        return query.options().wildcardComplexityLimit();
    }

    Value get(String json, String path) {
        if (path.length() > 1) {
            char lead = path.charAt(0);
            if (lead == '@' && modifiersEnabled()) {
                return applyModifier(json, path);
            }
            if (lead == '!') {
                Literals.Literal literal = Literals.parse(path);
                if (literal != null) {
                    return continueFrom(literal.json(), literal.rest());
                }
            }
            if (lead == '[' || lead == '{') {
                Value selected = MultiSelector.select(this, json, path);
                if (selected != null) {
                    return selected;
                }
            }
        }
        Walk walk = new Walk(json);
        if (path.startsWith("..")) {
            walkArray(walk, 0, path.substring(2));
        } else {
            for (int i = 0; i < json.length(); i++) {
                char c = json.charAt(i);
                if (c == '{') {
                    walkObject(walk, i + 1, path);
                    break;
                }
                if (c == '[') {
                    walkArray(walk, i + 1, path);
                    break;
                }
            }
        }
        if (walk.piped) {
            if (LOG.isTraceEnabled()) {
                LOG.trace("Piping {} into '{}'", walk.result.kind(), walk.pipe);
            }
            return query.getIn(walk.result, walk.pipe).detached();
        }
        return walk.result;
    }

    /** Treats {@code json} as a fresh root and applies the rest of a path to it. */
    private Value continueFrom(String json, String rest) {
        if (!rest.isEmpty() && (rest.charAt(0) == '|' || rest.charAt(0) == '.')) {
            return get(json, rest.substring(1)).detached();
        }
        return JsonScanner.parse(json).detached();
    }

    private Value applyModifier(String json, String path) {
        PathSegments.ModifierCall call = PathSegments.modifierCall(path);
        Optional<Modifier> modifier = query.modifiers().find(call.name());
        String output;
        if (modifier.isEmpty()) {
            LOG.debug("Unknown modifier '@{}', passing value through", call.name());
            output = json;
        } else {
            try {
                Modifier found = modifier.get();
                output = found instanceof QueryAwareModifier aware
                        ? aware.apply(query, json, call.arg())
                        : found.apply(json, call.arg());
            } catch (RuntimeException e) {
                LOG.warn("Modifier '@{}' failed: {}", call.name(), e.getMessage(), e);
                output = "";
            } catch (StackOverflowError e) {
                LOG.warn("Modifier '@{}' ran out of stack on a {}-char value", call.name(), json.length());
                output = "";
            }
            if (output == null) {
                output = "";
            }
        }
        return continueFrom(output, call.rest());
    }

    private Outcome walkObject(Walk walk, int i, String path) {
        PathSegments.ObjectSegment segment = PathSegments.objectSegment(path, modifiersEnabled());
        if (!segment.more() && segment.piped()) {
            walk.pipeTo(segment.pipe());
        }
        String json = walk.json;
        while (i < json.length()) {
            String key = null;
            for (; i < json.length(); i++) {
                char c = json.charAt(i);
                if (c == '"') {
                    int end = JsonScanner.stringEnd(json, i + 1);
                    if (end < 0) {
                        return new Outcome(json.length(), false);
                    }
                    key = json.substring(i + 1, end - 1);
                    i = end;
                    break;
                }
                if (c == '}') {
                    return new Outcome(i + 1, false);
                }
            }
            if (key == null) {
                return new Outcome(i, false);
            }
            if (key.indexOf('\\') >= 0) {
                key = JsonStrings.unescape(key);
            }
            boolean match = segment.wild()
                    ? WildcardMatcher.matches(key, segment.pattern(), wildcardLimit())
                    : segment.key().equals(key);
            boolean hit = match && !segment.more();
            for (; i < json.length(); i++) {
                char c = json.charAt(i);
                int end;
                if (c == '"') {
                    end = JsonScanner.stringEnd(json, i + 1);
                    if (end < 0) {
                        return new Outcome(json.length(), false);
                    }
                    if (hit) {
                        walk.result = JsonScanner.stringAt(json, i, end);
                        return new Outcome(end, true);
                    }
                } else if (c == '{' || c == '[') {
                    if (match && !hit) {
                        Outcome nested = c == '{'
                                ? walkObject(walk, i + 1, segment.rest())
                                : walkArray(walk, i + 1, segment.rest());
                        if (nested.found()) {
                            return nested;
                        }
                        end = nested.index();
                    } else {
                        end = JsonScanner.compositeEnd(json, i);
                        if (end < 0) {
                            return new Outcome(json.length(), false);
                        }
                        if (hit) {
                            walk.result = Value.json(json.substring(i, end)).at(i);
                            return new Outcome(end, true);
                        }
                    }
                } else if (JsonScanner.isNumberStart(json, i)) {
                    end = JsonScanner.numberEnd(json, i);
                    if (hit) {
                        walk.result = JsonScanner.numberAt(json, i, end);
                        return new Outcome(end, true);
                    }
                } else if (c == 't' || c == 'f' || c == 'n') {
                    end = JsonScanner.literalEnd(json, i);
                    if (hit) {
                        walk.result = JsonScanner.literalAt(json, i, end);
                        return new Outcome(end, true);
                    }
                } else {
                    continue;
                }
                i = end;
                break;
            }
        }
        return new Outcome(i, false);
    }

    /** Per-scan state of {@link #walkArray}: collected query matches and element starts. */
    private static final class ArrayScan {

        StringBuilder matches;
        final List<Integer> matchOffsets = new ArrayList<>();
        final List<Integer> elementStarts = new ArrayList<>();
        String queryRest;
        boolean querySplit;
    }

    private Outcome walkArray(Walk walk, int i, String path) {
        PathSegments.ArraySegment segment = PathSegments.arraySegment(path, modifiersEnabled());
        int wanted = -1;
        if (!segment.counting()) {
            var index = Numbers.parseUnsignedLong(segment.part());
            if (index.isPresent() && index.getAsLong() <= Integer.MAX_VALUE) {
                wanted = (int) index.getAsLong();
            }
        }
        if (!segment.more() && segment.piped()) {
            walk.pipeTo(segment.pipe());
        }
        if (LOG.isTraceEnabled()) {
            LOG.trace("Array segment '{}' (query={}, collect={})", segment.part(), segment.query() != null,
                    segment.collectKey() != null);
        }
        String json = walk.json;
        ArrayScan scan = new ArrayScan();
        scan.queryRest = segment.rest();
        boolean collecting = segment.collectKey() != null;
        int position = 0;
        while (i < json.length() + 1) {
            boolean match = !segment.counting() && wanted == position;
            boolean hit = match && !segment.more();
            position++;
            if (collecting) {
                scan.elementStarts.add(i);
            }
            for (; ; i++) {
                if (i > json.length()) {
                    break;
                }
                char c = i == json.length() ? ']' : json.charAt(i);
                if (c == ']') {
                    return closeArray(walk, segment, scan, position - 1, i);
                }
                Value element;
                int end;
                if (c == '"') {
                    end = JsonScanner.stringEnd(json, i + 1);
                    if (end < 0) {
                        return new Outcome(json.length(), false);
                    }
                    element = JsonScanner.stringAt(json, i, end);
                } else if (c == '{' || c == '[') {
                    if (match && !hit) {
                        Outcome nested = c == '{'
                                ? walkObject(walk, i + 1, segment.rest())
                                : walkArray(walk, i + 1, segment.rest());
                        if (nested.found()) {
                            return nested;
                        }
                        i = nested.index();
                        break;
                    }
                    end = JsonScanner.compositeEnd(json, i);
                    if (end < 0) {
                        // a truncated element ends the array before it
                        return hit
                                ? new Outcome(json.length(), false)
                                : closeArray(walk, segment, scan, position - 1, json.length());
                    }
                    element = Value.json(json.substring(i, end)).at(i);
                } else if (JsonScanner.isNumberStart(json, i)) {
                    end = JsonScanner.numberEnd(json, i);
                    element = JsonScanner.numberAt(json, i, end);
                } else if (c == 't' || c == 'f' || c == 'n') {
                    end = JsonScanner.literalEnd(json, i);
                    element = JsonScanner.literalAt(json, i, end);
                } else {
                    continue;
                }
                if (segment.query() != null) {
                    if (matchElement(walk, segment, scan, element)) {
                        return new Outcome(end, true);
                    }
                } else if (hit) {
                    walk.result = element;
                    return new Outcome(end, true);
                }
                i = end;
                break;
            }
        }
        return new Outcome(i, false);
    }

    /**
     * Runs the segment's predicate against one element. A first-match query stores the result and
     * returns true; a match-all query appends the result to the collected array.
     */
    private boolean matchElement(Walk walk, PathSegments.ArraySegment segment, ArrayScan scan, Value element) {
        PathSegments.Query predicate = segment.query();
        if (predicate.all() && scan.matches == null) {
            scan.matches = new StringBuilder().append('[');
        }
        Value candidate;
        if (element.isObject() || element.isArray()) {
            candidate = query.getIn(element, predicate.path());
        } else {
            if (!predicate.path().isEmpty()) {
                return false;
            }
            candidate = element;
        }
        if (!QueryMatcher.matches(predicate, candidate, wildcardLimit())) {
            return false;
        }
        Value selected = element;
        if (segment.more()) {
            if (!scan.querySplit) {
                PathSegments.Split split = PathSegments.splitPipe(scan.queryRest);
                if (split != null) {
                    scan.queryRest = split.left();
                    walk.pipeTo(split.right());
                }
                scan.querySplit = true;
            }
            selected = query.getIn(element, scan.queryRest);
        }
        if (!predicate.all()) {
            walk.result = selected;
            return true;
        }
        String raw = selected.raw().isEmpty() ? selected.toString() : selected.raw();
        if (!raw.isEmpty()) {
            if (scan.matches.length() > 1) {
                scan.matches.append(',');
            }
            scan.matches.append(raw);
            scan.matchOffsets.add(selected.origin());
        }
        return false;
    }

    private Outcome closeArray(Walk walk, PathSegments.ArraySegment segment, ArrayScan scan, int count, int i) {
        if (segment.counting() && segment.part().equals("#")) {
            if (segment.collectKey() != null) {
                walk.result = collect(walk, segment.collectKey(), scan.elementStarts);
                return new Outcome(i + 1, true);
            }
            walk.result = Value.count(count);
            return new Outcome(i + 1, true);
        }
        if (!walk.result.exists()) {
            if (scan.matches != null && scan.matches.length() > 0) {
                walk.result = Value.json(scan.matches.append(']').toString()).withMatchOffsets(scan.matchOffsets);
            } else if (segment.query() != null && segment.query().all()) {
                walk.result = Value.json("[]");
            }
        }
        return new Outcome(i + 1, false);
    }

    /** Evaluates {@code #.key}: the key's value in every element, collected into an array. */
    private Value collect(Walk walk, String key, List<Integer> elementStarts) {
        PathSegments.Split split = PathSegments.splitPipe(key);
        if (split != null) {
            key = split.left();
            walk.pipeTo(split.right());
        }
        String json = walk.json;
        StringBuilder out = new StringBuilder().append('[');
        List<Integer> offsets = new ArrayList<>();
        for (int start : elementStarts) {
            int at = JsonScanner.skipSpace(json, start);
            if (at >= json.length() || json.charAt(at) == ']') {
                continue;
            }
            Value element = JsonScanner.next(json, at).value();
            if (!element.exists()) {
                continue;
            }
            Value found = query.getIn(element, key);
            if (found.exists()) {
                if (!offsets.isEmpty()) {
                    out.append(',');
                }
                out.append(found.raw().isEmpty() ? found.toString() : found.raw());
                offsets.add(found.origin());
            }
        }
        return Value.json(out.append(']').toString()).withMatchOffsets(offsets);
    }
}
