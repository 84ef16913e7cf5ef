package io.jsonsift.core.engine;

/**
 * Glob matcher for object keys and {@code %} query operands. {@code *} matches any run of
 * characters, {@code ?} exactly one character (a surrogate pair counts as one) and a backslash
 * makes the next pattern character literal.
 *
 * <p>Every star expansion costs one step against a complexity limit. A match that needs more
 * steps than the limit is abandoned and reported as no match.
 */
public final class WildcardMatcher {

    /** Step limit used when none is configured. */
    public static final int DEFAULT_LIMIT = 10_000;

    private enum Result {
        MATCH,
        NO_MATCH,
        STOP
    }

    private final int[] text;
    private final int[] pattern;
    private final int limit;
    private int steps;

    private WildcardMatcher(int[] text, int[] pattern, int limit) {
        this.text = text;
        this.pattern = pattern;
        this.limit = limit;
    }

    /** Matches with {@link #DEFAULT_LIMIT}. */
    public static boolean matches(String text, String pattern) {
        return matches(text, pattern, DEFAULT_LIMIT);
    }

    /**
     * Matches {@code text} against {@code pattern}; a negative {@code limit} disables the
     * complexity check.
     */
    public static boolean matches(String text, String pattern, int limit) {
        if (pattern.equals("*")) {
            return true;
        }
        var matcher = new WildcardMatcher(text.codePoints().toArray(), pattern.codePoints().toArray(), limit);
        return matcher.match(0, matcher.text.length, 0, matcher.pattern.length) == Result.MATCH;
    }

    /** True when the pattern contains an unescaped {@code *} or {@code ?}. */
    public static boolean isPattern(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '*' || c == '?') {
                return true;
            }
        }
        return false;
    }

    private Result match(int s, int sEnd, int p, int pEnd) {
        if (limit > -1) {
            if (steps > limit) {
                return Result.STOP;
            }
            steps++;
        }
        while (p < pEnd) {
            boolean wild = false;
            int pc = pattern[p];
            boolean hasText = s < sEnd;
            if (pc == '?') {
                if (!hasText) {
                    return Result.NO_MATCH;
                }
            } else if (pc == '*') {
                while (p + 1 < pEnd && pattern[p + 1] == '*') {
                    p++;
                }
                if (p + 1 == pEnd) {
                    return Result.MATCH;
                }
                long trimmed = trimLiteralSuffix(s, sEnd, p, pEnd);
                if (trimmed < 0) {
                    return Result.NO_MATCH;
                }
                sEnd = (int) (trimmed >>> 32);
                pEnd = (int) trimmed;
                if (p + 1 == pEnd) {
                    return Result.MATCH;
                }
                Result rest = match(s, sEnd, p + 1, pEnd);
                if (rest != Result.NO_MATCH) {
                    return rest;
                }
                if (s >= sEnd) {
                    return Result.NO_MATCH;
                }
                wild = true;
            } else {
                if (!hasText) {
                    return Result.NO_MATCH;
                }
                if (pc == '\\') {
                    p++;
                    if (p >= pEnd) {
                        return Result.NO_MATCH;
                    }
                    pc = pattern[p];
                }
                if (text[s] != pc) {
                    return Result.NO_MATCH;
                }
            }
            s++;
            if (!wild) {
                p++;
            }
        }
        return s >= sEnd ? Result.MATCH : Result.NO_MATCH;
    }

    /**
     * Matches the literal tail of a star pattern against the end of the text. Returns the new
     * text and pattern ends packed into one long, or -1 on mismatch.
     */
    private long trimLiteralSuffix(int s, int sEnd, int p, int pEnd) {
        while (sEnd > s && pEnd - p > 1) {
            int pc = pattern[pEnd - 1];
            int width = 1;
            boolean escaped = false;
            int backslashes = 0;
            while (pEnd - 2 - backslashes >= p && pattern[pEnd - 2 - backslashes] == '\\') {
                backslashes++;
            }
            if (backslashes % 2 == 1) {
                escaped = true;
                width = 2;
            }
            if (pc == '*' && !escaped) {
                break;
            }
            if (!((pc == '?' && !escaped) || pc == text[sEnd - 1])) {
                return -1;
            }
            sEnd--;
            pEnd -= width;
        }
        return ((long) sEnd << 32) | (pEnd & 0xffffffffL);
    }
}
