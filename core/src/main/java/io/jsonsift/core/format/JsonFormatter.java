package io.jsonsift.core.format;

import io.jsonsift.core.engine.JsonStrings;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Whitespace reformatting of JSON text. Both directions copy strings and numbers verbatim and
 * never validate: malformed input is reformatted as far as it can be scanned.
 */
public final class JsonFormatter {

    private JsonFormatter() {}

    /** Removes every whitespace character outside of strings. */
    public static String ugly(String json) {
        StringBuilder out = new StringBuilder(json.length());
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (c <= ' ') {
                continue;
            }
            out.append(c);
            if (c == '"') {
                for (i++; i < json.length(); i++) {
                    char s = json.charAt(i);
                    out.append(s);
                    if (s == '"' && !escaped(json, i)) {
                        break;
                    }
                }
            }
        }
        return out.toString();
    }

    /**
     * Pretty-prints {@code json}: one member per line, {@code "key": value} separators, arrays on a
     * single line when they fit in {@link PrettyOptions#width()} and contain no objects. The result
     * ends with a newline unless it is empty.
     */
    public static String pretty(String json, PrettyOptions options) {
        StringBuilder out = new StringBuilder(json.length() + json.length() / 2);
        out.append(options.prefix());
        new Printer(json, out, options).print(options.indent());
        if (out.length() > 0) {
            out.append('\n');
        }
        return out.toString();
    }

    public static String pretty(String json) {
        return pretty(json, PrettyOptions.DEFAULT);
    }

    private static boolean escaped(String json, int quote) {
        int backslashes = 0;
        for (int j = quote - 1; j >= 0 && json.charAt(j) == '\\'; j--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    /** Result of printing one value: next input offset and whether it fit the inline budget. */
    private record Step(int index, boolean ok) {}

    /** An object member as printed: key span in the input, line span in the output. */
    private static final class Member {

        int keyStart;
        int keyEnd;
        int lineStart;
        int lineEnd;
    }

    /** An open object or array whose members are still being printed. */
    private static final class Frame {

        final char open;
        final char close;
        final boolean pretty;
        final String indent;
        final int tabs;
        final int max;
        /** Pretty layout to print instead when this single-line attempt does not fit. */
        final Frame fallback;
        int mark;
        int i;
        int count;
        boolean sorting;
        List<Member> members;
        Member member;

        Frame(int start, char open, boolean pretty, String indent, int tabs, int max, boolean sortKeys, Frame fallback) {
            this.open = open;
            this.close = open == '{' ? '}' : ']';
            this.pretty = pretty;
            this.indent = indent;
            this.tabs = tabs;
            this.max = max;
            this.fallback = fallback;
            this.i = start + 1;
            this.sorting = open == '{' && sortKeys && pretty;
            this.members = sorting ? new ArrayList<>() : null;
        }
    }

    /**
     * Prints with an explicit stack of open composites, so nesting depth is bounded by the heap.
     * A {@link Step} is always delivered to the frame on top of the stack: a finished frame is
     * popped before its own step is handed to its parent.
     */
    private static final class Printer {

        private final String json;
        private final StringBuilder out;
        private final int width;
        private final String prefix;
        private final boolean sortKeys;
        private final Deque<Frame> stack = new ArrayDeque<>();
        /** Output offset of the most recent line break. */
        private int newline;
        /** Output length past which the running single-line attempt has failed, or -1. */
        private int inlineLimit = -1;

        Printer(String json, StringBuilder out, PrettyOptions options) {
            this.json = json;
            this.out = out;
            this.width = options.width();
            this.prefix = options.prefix();
            this.sortKeys = options.sortKeys();
        }

        void print(String indent) {
            Step step = value(0, true, indent, 0, -1);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                step = step == null ? scan(frame) : accept(frame, step);
            }
        }

        /** Prints the value at or after {@code i}; returns null when it opened a frame instead. */
        private Step value(int i, boolean pretty, String indent, int tabs, int max) {
            for (; i < json.length(); i++) {
                char c = json.charAt(i);
                if (c <= ' ') {
                    continue;
                }
                if (c == '"') {
                    return new Step(string(i), true);
                }
                if ((c >= '0' && c <= '9') || c == '-' || isNanOrInf(i)) {
                    return new Step(number(i), true);
                }
                if (c == '{' || c == '[') {
                    return open(i, c, pretty, indent, tabs, max);
                }
                switch (c) {
                    case 't':
                        out.append("true");
                        return new Step(i + 4, true);
                    case 'f':
                        out.append("false");
                        return new Step(i + 5, true);
                    case 'n':
                        out.append("null");
                        return new Step(i + 4, true);
                    default:
                        break;
                }
            }
            return new Step(i, true);
        }

        private Step open(int i, char open, boolean pretty, String indent, int tabs, int max) {
            Frame frame = new Frame(i, open, pretty, indent, tabs, max, sortKeys, null);
            if (width > 0) {
                if (pretty && open == '[' && max == -1) {
                    int room = width - (out.length() - newline);
                    if (room > 3) {
                        Frame attempt = new Frame(i, '[', false, "", 0, room, sortKeys, frame);
                        attempt.mark = out.length();
                        inlineLimit = attempt.mark + room;
                        frame = attempt;
                    }
                } else if (max != -1 && open == '{') {
                    return new Step(i, false);
                }
            }
            stack.push(frame);
            out.append(open);
            return null;
        }

        /** Takes the step of the member value just printed inside {@code frame}. */
        private Step accept(Frame frame, Step step) {
            frame.i = step.index();
            if (frame.max != -1 && !step.ok()) {
                return finish(frame, new Step(frame.i, false));
            }
            Member member = frame.member;
            if (member != null) {
                member.lineEnd = out.length();
                if (member.keyStart > member.keyEnd || member.lineStart > member.lineEnd) {
                    frame.sorting = false;
                } else {
                    frame.members.add(member);
                }
                frame.member = null;
            }
            frame.count++;
            return null;
        }

        /** Advances {@code frame} to its next member or its closing bracket. */
        private Step scan(Frame frame) {
            int i = frame.i;
            if (inlineLimit >= 0 && out.length() > inlineLimit) {
                return finish(frame, new Step(i, false));
            }
            for (; i < json.length(); i++) {
                char c = json.charAt(i);
                if (c <= ' ') {
                    continue;
                }
                if (c == frame.close) {
                    if (frame.pretty) {
                        if (frame.sorting) {
                            sortMembers(frame.members);
                        }
                        if (frame.count > 0) {
                            newline = out.length();
                            lineBreak();
                        }
                        if (out.charAt(out.length() - 1) != frame.open) {
                            tabs(frame.indent, frame.tabs);
                        }
                    }
                    out.append(frame.close);
                    return finish(frame, new Step(i + 1, frame.open != '{'));
                }
                if (frame.open == '[' || c == '"') {
                    if (frame.count > 0) {
                        out.append(',');
                        if (frame.open == '[') {
                            out.append(' ');
                        }
                    }
                    if (frame.pretty) {
                        newline = out.length();
                        lineBreak();
                        if (frame.sorting) {
                            frame.member = new Member();
                            frame.member.keyStart = i;
                            frame.member.lineStart = out.length();
                        }
                        tabs(frame.indent, frame.tabs + 1);
                    }
                    if (frame.open == '{') {
                        i = string(i);
                        if (frame.member != null) {
                            frame.member.keyEnd = i;
                        }
                        out.append(':');
                        if (frame.pretty) {
                            out.append(' ');
                        }
                    }
                    frame.i = i;
                    return value(i, frame.pretty, frame.indent, frame.tabs + 1, frame.max);
                }
            }
            return finish(frame, new Step(i, frame.open != '{'));
        }

        /** Pops {@code frame}; a failed single-line attempt is replaced by its pretty layout. */
        private Step finish(Frame frame, Step step) {
            stack.pop();
            Frame fallback = frame.fallback;
            if (fallback == null) {
                return step;
            }
            inlineLimit = -1;
            if (step.ok() && out.length() - frame.mark <= frame.max) {
                return new Step(step.index(), true);
            }
            out.setLength(frame.mark);
            stack.push(fallback);
            out.append(fallback.open);
            return null;
        }

        private boolean isNanOrInf(int i) {
            char c = json.charAt(i);
            return c == 'i' || c == 'I' || c == 'N' || (c == 'n' && i + 1 < json.length() && json.charAt(i + 1) == 'a');
        }

        private int string(int i) {
            int start = i;
            for (i++; i < json.length(); i++) {
                if (json.charAt(i) == '"' && !escaped(json, i)) {
                    i++;
                    break;
                }
            }
            out.append(json, start, Math.min(i, json.length()));
            return i;
        }

        private int number(int i) {
            int start = i;
            for (i++; i < json.length(); i++) {
                char c = json.charAt(i);
                if (c <= ' ' || c == ',' || c == ':' || c == ']' || c == '}') {
                    break;
                }
            }
            out.append(json, start, i);
            return i;
        }

        /** Turns a trailing space into a newline, or appends one. */
        private void lineBreak() {
            int last = out.length() - 1;
            if (last >= 0 && out.charAt(last) == ' ') {
                out.setCharAt(last, '\n');
            } else {
                out.append('\n');
            }
        }

        private void tabs(String indent, int tabs) {
            out.append(prefix);
            for (int n = 0; n < tabs; n++) {
                out.append(indent);
            }
        }

        private void sortMembers(List<Member> members) {
            if (members.isEmpty()) {
                return;
            }
            int start = members.get(0).lineStart;
            List<Member> sorted = new ArrayList<>(members);
            sorted.sort((a, b) -> {
                int order = key(a).compareTo(key(b));
                if (order != 0) {
                    return order;
                }
                return line(a).trim().compareTo(line(b).trim());
            });
            if (sorted.equals(members)) {
                return;
            }
            StringBuilder reordered = new StringBuilder(out.length() - start);
            for (int n = 0; n < sorted.size(); n++) {
                reordered.append(line(sorted.get(n)));
                if (n < sorted.size() - 1) {
                    reordered.append(",\n");
                }
            }
            out.setLength(start);
            out.append(reordered);
        }

        private String key(Member member) {
            return JsonStrings.decodeToken(json.substring(member.keyStart, member.keyEnd));
        }

        private String line(Member member) {
            return out.substring(member.lineStart, member.lineEnd);
        }
    }
}
