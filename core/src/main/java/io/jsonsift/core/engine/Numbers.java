package io.jsonsift.core.engine;

import java.math.BigDecimal;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/** Number decoding and rendering helpers. Nothing in here throws on malformed text. */
public final class Numbers {

    /** Largest integer a double represents exactly, {@code 2^53 - 1}. */
    public static final double MAX_SAFE_INTEGER = 9007199254740991d;

    private Numbers() {}

    /**
     * Decodes a number token using its longest valid numeric prefix. Accepts an optional sign,
     * digits, fraction and exponent, plus the {@code inf}, {@code infinity} and {@code nan}
     * spellings in any case. Returns 0 when no prefix is numeric.
     */
    public static double decode(String token) {
        int end = numericPrefix(token);
        if (end > 0) {
            return Double.parseDouble(token.substring(0, end));
        }
        return special(token, false).orElse(0d);
    }

    /** Parses the whole of {@code s} as a number, or returns empty. */
    public static OptionalDouble parseStrict(String s) {
        int end = numericPrefix(s);
        if (end > 0 && end == s.length()) {
            return OptionalDouble.of(Double.parseDouble(s));
        }
        return special(s, true);
    }

    /** Parses an optionally negative run of ASCII digits; empty on anything else or overflow. */
    public static OptionalLong parseLong(String s) {
        int i = 0;
        boolean negative = false;
        if (!s.isEmpty() && s.charAt(0) == '-') {
            negative = true;
            i++;
        }
        if (i == s.length()) {
            return OptionalLong.empty();
        }
        long n = 0;
        for (; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return OptionalLong.empty();
            }
            int digit = c - '0';
            // accumulate negatively so that Long.MIN_VALUE fits
            if (n < (Long.MIN_VALUE + digit) / 10) {
                return OptionalLong.empty();
            }
            n = n * 10 - digit;
        }
        if (!negative) {
            if (n == Long.MIN_VALUE) {
                return OptionalLong.empty();
            }
            n = -n;
        }
        return OptionalLong.of(n);
    }

    /** Parses a run of ASCII digits as an unsigned 64-bit integer; empty on anything else. */
    public static OptionalLong parseUnsignedLong(String s) {
        if (s.isEmpty()) {
            return OptionalLong.empty();
        }
        long n = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return OptionalLong.empty();
            }
            if (Long.compareUnsigned(n, Long.divideUnsigned(-1L, 10)) > 0) {
                return OptionalLong.empty();
            }
            long next = n * 10 + (c - '0');
            if (Long.compareUnsigned(next, n * 10) < 0) {
                return OptionalLong.empty();
            }
            n = next;
        }
        return OptionalLong.of(n);
    }

    /** Converts a double to a long when it lies within the exactly representable integer range. */
    public static OptionalLong safeLong(double d) {
        if (d < -MAX_SAFE_INTEGER || d > MAX_SAFE_INTEGER) {
            return OptionalLong.empty();
        }
        return OptionalLong.of((long) d);
    }

    /**
     * Renders a double as the shortest plain decimal without exponent, e.g. {@code 1.5},
     * {@code 100}, {@code 0.0001}. Specials render as {@code NaN}, {@code +Inf} and {@code -Inf}.
     */
    public static String format(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "+Inf" : "-Inf";
        }
        if (d == 0) {
            return 1 / d < 0 ? "-0" : "0";
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    /** True when {@code s} is an optional minus sign followed by one or more ASCII digits. */
    public static boolean isIntegerText(String s) {
        int i = !s.isEmpty() && s.charAt(0) == '-' ? 1 : 0;
        if (i == s.length()) {
            return false;
        }
        for (; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /** Returns the length of the longest prefix of {@code s} that is a decimal number, or 0. */
    static int numericPrefix(String s) {
        int i = 0;
        int n = s.length();
        if (i < n && (s.charAt(i) == '-' || s.charAt(i) == '+')) {
            i++;
        }
        int intDigits = 0;
        while (i < n && isDigit(s.charAt(i))) {
            i++;
            intDigits++;
        }
        int end = intDigits > 0 ? i : 0;
        if (i < n && s.charAt(i) == '.') {
            int j = i + 1;
            int fracDigits = 0;
            while (j < n && isDigit(s.charAt(j))) {
                j++;
                fracDigits++;
            }
            if (intDigits + fracDigits == 0) {
                return 0;
            }
            if (fracDigits > 0 || intDigits > 0) {
                end = j;
                i = j;
            }
        }
        if (end == 0) {
            return 0;
        }
        if (i < n && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < n && (s.charAt(j) == '-' || s.charAt(j) == '+')) {
                j++;
            }
            int expStart = j;
            while (j < n && isDigit(s.charAt(j))) {
                j++;
            }
            if (j > expStart) {
                end = j;
            }
        }
        return end;
    }

    private static OptionalDouble special(String s, boolean whole) {
        int i = 0;
        double sign = 1;
        if (!s.isEmpty() && (s.charAt(0) == '-' || s.charAt(0) == '+')) {
            sign = s.charAt(0) == '-' ? -1 : 1;
            i++;
        }
        String rest = s.substring(i);
        if (startsWithIgnoreCase(rest, "infinity")) {
            return whole && rest.length() != 8 ? OptionalDouble.empty() : OptionalDouble.of(sign * Double.POSITIVE_INFINITY);
        }
        if (startsWithIgnoreCase(rest, "inf")) {
            return whole && rest.length() != 3 ? OptionalDouble.empty() : OptionalDouble.of(sign * Double.POSITIVE_INFINITY);
        }
        if (startsWithIgnoreCase(rest, "nan")) {
            return whole && rest.length() != 3 ? OptionalDouble.empty() : OptionalDouble.of(Double.NaN);
        }
        return OptionalDouble.empty();
    }

    private static boolean startsWithIgnoreCase(String s, String prefix) {
        return s.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
