package io.jsonsift.core.engine;

/**
 * String codec for JSON text: decoding of quoted payloads, JSON string encoding and escaping of
 * path components. All methods are total and never throw for malformed input.
 */
public final class JsonStrings {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private JsonStrings() {}

    /**
     * Decodes the payload of a raw string token including its surrounding quotes, e.g.
     * {@code "a\"b"} becomes {@code a"b}. A missing closing quote is tolerated.
     */
    public static String decodeToken(String raw) {
        if (raw.isEmpty() || raw.charAt(0) != '"') {
            return raw;
        }
        int end = raw.length();
        if (end > 1 && raw.charAt(end - 1) == '"' && !isEscapedQuote(raw, end - 1)) {
            end--;
        }
        String payload = raw.substring(1, end);
        return payload.indexOf('\\') < 0 ? payload : unescape(payload);
    }

    /**
     * Resolves escape sequences. Decoding stops at the first raw control character or invalid
     * escape; {@code \\u} surrogate pairs are combined, a lone surrogate becomes U+FFFD.
     */
    public static String unescape(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < ' ') {
                return out.toString();
            }
            if (c != '\\') {
                out.append(c);
                continue;
            }
            i++;
            if (i >= s.length()) {
                return out.toString();
            }
            switch (s.charAt(i)) {
                case '\\':
                    out.append('\\');
                    break;
                case '/':
                    out.append('/');
                    break;
                case 'b':
                    out.append('\b');
                    break;
                case 'f':
                    out.append('\f');
                    break;
                case 'n':
                    out.append('\n');
                    break;
                case 'r':
                    out.append('\r');
                    break;
                case 't':
                    out.append('\t');
                    break;
                case '"':
                    out.append('"');
                    break;
                case 'u':
                    int unit = hex4(s, i + 1);
                    if (unit < 0) {
                        return out.toString();
                    }
                    i += 4;
                    char ch = (char) unit;
                    if (Character.isHighSurrogate(ch)) {
                        int low = i + 2 < s.length() && s.charAt(i + 1) == '\\' && s.charAt(i + 2) == 'u'
                                ? hex4(s, i + 3)
                                : -1;
                        if (low >= 0 && Character.isLowSurrogate((char) low)) {
                            out.append(ch).append((char) low);
                            i += 6;
                        } else {
                            out.append('\ufffd');
                        }
                    } else if (Character.isLowSurrogate(ch)) {
                        out.append('\ufffd');
                    } else {
                        out.append(ch);
                    }
                    break;
                default:
                    return out.toString();
            }
        }
        return out.toString();
    }

    /**
     * Encodes text as a JSON string literal. Control characters, {@code <}, {@code >},
     * {@code &}, U+2028 and U+2029 are written as escapes; unpaired surrogates become
     * {@code \\ufffd}.
     */
    public static String encode(String s) {
        StringBuilder out = new StringBuilder(s.length() + 2);
        appendEncoded(out, s);
        return out.toString();
    }

    /** Appends the JSON string literal for {@code s} to {@code out}. */
    public static void appendEncoded(StringBuilder out, String s) {
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < ' ') {
                out.append('\\');
                switch (c) {
                    case '\n':
                        out.append('n');
                        break;
                    case '\r':
                        out.append('r');
                        break;
                    case '\t':
                        out.append('t');
                        break;
                    default:
                        out.append('u');
                        appendHex4(out, c);
                }
            } else if (c == '<' || c == '>' || c == '&') {
                out.append("\\u");
                appendHex4(out, c);
            } else if (c == '\\') {
                out.append("\\\\");
            } else if (c == '"') {
                out.append("\\\"");
            } else if (c == '\u2028' || c == '\u2029') {
                out.append("\\u");
                appendHex4(out, c);
            } else if (Character.isHighSurrogate(c)
                    && i + 1 < s.length()
                    && Character.isLowSurrogate(s.charAt(i + 1))) {
                out.append(c).append(s.charAt(i + 1));
                i++;
            } else if (Character.isSurrogate(c)) {
                out.append("\\ufffd");
            } else {
                out.append(c);
            }
        }
        out.append('"');
    }

    /**
     * Escapes a recovered key so that it can be used as a path component: a backslash is placed
     * before every character that is not a letter, digit, {@code _}, {@code -} or {@code :}.
     * Whitespace, control characters and non-ASCII characters are kept as they are.
     */
    public static String escapePathComponent(String component) {
        for (int i = 0; i < component.length(); i++) {
            if (!isSafeKeyChar(component.charAt(i))) {
                StringBuilder out = new StringBuilder(component.length() + 4);
                out.append(component, 0, i);
                for (; i < component.length(); i++) {
                    char c = component.charAt(i);
                    if (!isSafeKeyChar(c)) {
                        out.append('\\');
                    }
                    out.append(c);
                }
                return out.toString();
            }
        }
        return component;
    }

    static boolean isSafeKeyChar(char c) {
        return c <= ' '
                || c > '~'
                || c == '_'
                || c == '-'
                || c == ':'
                || (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9');
    }

    private static boolean isEscapedQuote(String s, int quote) {
        int backslashes = 0;
        for (int j = quote - 1; j > 0 && s.charAt(j) == '\\'; j--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private static int hex4(String s, int start) {
        if (start + 4 > s.length()) {
            return -1;
        }
        int value = 0;
        for (int i = start; i < start + 4; i++) {
            int digit = hexDigit(s.charAt(i));
            if (digit < 0) {
                return -1;
            }
            value = (value << 4) | digit;
        }
        return value;
    }

    static int hexDigit(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private static void appendHex4(StringBuilder out, char c) {
        out.append(HEX[(c >> 12) & 0xF])
                .append(HEX[(c >> 8) & 0xF])
                .append(HEX[(c >> 4) & 0xF])
                .append(HEX[c & 0xF]);
    }
}
