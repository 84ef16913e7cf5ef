package io.jsonsift.core.engine;

/**
 * Strict well-formedness check (RFC 8259): exactly one value, optionally surrounded by
 * whitespace. Nesting is tracked on an explicit stack, so arbitrarily deep input is checked
 * without recursion.
 */
public final class JsonValidator {

    private JsonValidator() {}

    public static boolean isValid(String json) {
        StringBuilder open = new StringBuilder();
        int i = 0;
        value:
        while (true) {
            i = skipWhitespace(json, i);
            if (i >= json.length()) {
                return false;
            }
            char c = json.charAt(i);
            if (c == '{' || c == '[') {
                i = skipWhitespace(json, i + 1);
                char close = c == '{' ? '}' : ']';
                if (i < json.length() && json.charAt(i) == close) {
                    i++;
                } else {
                    open.append(c);
                    if (c == '{') {
                        i = member(json, i);
                        if (i < 0) {
                            return false;
                        }
                    }
                    continue;
                }
            } else {
                i = scalar(json, i);
                if (i < 0) {
                    return false;
                }
            }
            // after a complete value: close containers or move to the next element
            while (true) {
                i = skipWhitespace(json, i);
                if (open.length() == 0) {
                    return i == json.length();
                }
                if (i >= json.length()) {
                    return false;
                }
                char container = open.charAt(open.length() - 1);
                char c2 = json.charAt(i);
                if (c2 == ',') {
                    i++;
                    if (container == '{') {
                        i = member(json, skipWhitespace(json, i));
                        if (i < 0) {
                            return false;
                        }
                    }
                    continue value;
                }
                if ((container == '{' && c2 == '}') || (container == '[' && c2 == ']')) {
                    open.setLength(open.length() - 1);
                    i++;
                    continue;
                }
                return false;
            }
        }
    }

    /** Checks {@code "key" :} at {@code i}; returns the offset after the colon or -1. */
    private static int member(String json, int i) {
        if (i >= json.length() || json.charAt(i) != '"') {
            return -1;
        }
        i = string(json, i + 1);
        if (i < 0) {
            return -1;
        }
        i = skipWhitespace(json, i);
        if (i >= json.length() || json.charAt(i) != ':') {
            return -1;
        }
        return i + 1;
    }

    private static int scalar(String json, int i) {
        char c = json.charAt(i);
        switch (c) {
            case '"':
                return string(json, i + 1);
            case 't':
                return json.startsWith("true", i) ? i + 4 : -1;
            case 'f':
                return json.startsWith("false", i) ? i + 5 : -1;
            case 'n':
                return json.startsWith("null", i) ? i + 4 : -1;
            default:
                return number(json, i);
        }
    }

    private static int string(String json, int i) {
        for (; i < json.length(); i++) {
            char c = json.charAt(i);
            if (c < ' ') {
                return -1;
            }
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\') {
                i++;
                if (i >= json.length()) {
                    return -1;
                }
                switch (json.charAt(i)) {
                    case '"':
                    case '\\':
                    case '/':
                    case 'b':
                    case 'f':
                    case 'n':
                    case 'r':
                    case 't':
                        break;
                    case 'u':
                        for (int n = 0; n < 4; n++) {
                            i++;
                            if (i >= json.length() || JsonStrings.hexDigit(json.charAt(i)) < 0) {
                                return -1;
                            }
                        }
                        break;
                    default:
                        return -1;
                }
            }
        }
        return -1;
    }

    private static int number(String json, int i) {
        if (json.charAt(i) == '-') {
            i++;
        }
        if (i >= json.length()) {
            return -1;
        }
        if (json.charAt(i) == '0') {
            i++;
        } else if (isDigit(json, i)) {
            i = digits(json, i);
        } else {
            return -1;
        }
        if (i < json.length() && json.charAt(i) == '.') {
            i++;
            if (!isDigit(json, i)) {
                return -1;
            }
            i = digits(json, i);
        }
        if (i < json.length() && (json.charAt(i) == 'e' || json.charAt(i) == 'E')) {
            i++;
            if (i < json.length() && (json.charAt(i) == '+' || json.charAt(i) == '-')) {
                i++;
            }
            if (!isDigit(json, i)) {
                return -1;
            }
            i = digits(json, i);
        }
        return i;
    }

    private static boolean isDigit(String json, int i) {
        return i < json.length() && json.charAt(i) >= '0' && json.charAt(i) <= '9';
    }

    private static int digits(String json, int i) {
        while (isDigit(json, i)) {
            i++;
        }
        return i;
    }

    private static int skipWhitespace(String json, int i) {
        while (i < json.length()) {
            char c = json.charAt(i);
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                break;
            }
            i++;
        }
        return i;
    }
}
