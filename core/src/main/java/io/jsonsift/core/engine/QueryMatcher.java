package io.jsonsift.core.engine;

import io.jsonsift.core.model.Kind;
import io.jsonsift.core.model.Value;
import java.util.Locale;

/**
 * Evaluates {@code #(...)} predicates against candidate values. The comparison is chosen by the
 * candidate's kind: strings compare lexically or by wildcard, numbers numerically against the
 * operand parsed as a number, booleans against the operand text {@code true}/{@code false}.
 * Every other pairing is false.
 *
 * <p>Operands starting with {@code ~} coerce the candidate first: {@code ~true} (truthy),
 * {@code ~false} (falsy), {@code ~null} (null or missing) and {@code ~*} (exists).
 */
final class QueryMatcher {

    private static final Value TRUE = Value.literal(Kind.TRUE, "true");
    private static final Value FALSE = Value.literal(Kind.FALSE, "false");

    private QueryMatcher() {}

    static boolean matches(PathSegments.Query query, Value candidate, int wildcardLimit) {
        if (!query.valid()) {
            return false;
        }
        String operand = query.value();
        Value value = candidate;
        if (!operand.isEmpty() && operand.charAt(0) == '~') {
            Boolean coerced = coerce(operand.substring(1), candidate);
            if (coerced == null) {
                return false;
            }
            operand = "true";
            value = coerced ? TRUE : FALSE;
        }
        if (!value.exists()) {
            return false;
        }
        String op = query.op();
        if (op.isEmpty()) {
            return true;
        }
        switch (value.kind()) {
            case STRING:
                return compareStrings(op, value.text(), operand, wildcardLimit);
            case NUMBER:
                return compareNumbers(op, value.number(), Numbers.parseStrict(operand).orElse(0));
            case TRUE:
                switch (op) {
                    case "=":
                        return operand.equals("true");
                    case "!=":
                        return !operand.equals("true");
                    case ">":
                        return operand.equals("false");
                    case ">=":
                        return true;
                    default:
                        return false;
                }
            case FALSE:
                switch (op) {
                    case "=":
                        return operand.equals("false");
                    case "!=":
                        return !operand.equals("false");
                    case "<":
                        return operand.equals("true");
                    case "<=":
                        return true;
                    default:
                        return false;
                }
            default:
                return false;
        }
    }

    private static boolean compareStrings(String op, String text, String operand, int wildcardLimit) {
        int order = text.compareTo(operand);
        switch (op) {
            case "=":
                return order == 0;
            case "!=":
                return order != 0;
            case "<":
                return order < 0;
            case "<=":
                return order <= 0;
            case ">":
                return order > 0;
            case ">=":
                return order >= 0;
            case "%":
                return WildcardMatcher.matches(text, operand, wildcardLimit);
            case "!%":
                return !WildcardMatcher.matches(text, operand, wildcardLimit);
            default:
                return false;
        }
    }

    private static boolean compareNumbers(String op, double number, double operand) {
        switch (op) {
            case "=":
                return number == operand;
            case "!=":
                return number != operand;
            case "<":
                return number < operand;
            case "<=":
                return number <= operand;
            case ">":
                return number > operand;
            case ">=":
                return number >= operand;
            default:
                return false;
        }
    }

    // null for an unknown coercion
    private static Boolean coerce(String name, Value value) {
        switch (name) {
            case "*":
                return value.exists();
            case "null":
                return value.kind() == Kind.NULL;
            case "true":
                return truthy(value);
            case "false":
                return falsy(value);
            default:
                return null;
        }
    }

    private static boolean truthy(Value value) {
        switch (value.kind()) {
            case TRUE:
                return true;
            case NUMBER:
                return value.number() != 0;
            case STRING:
                return parseBool(value.text()) == Boolean.TRUE;
            default:
                return false;
        }
    }

    private static boolean falsy(Value value) {
        switch (value.kind()) {
            case NULL:
            case FALSE:
                return true;
            case NUMBER:
                return value.number() == 0;
            case STRING:
                return parseBool(value.text()) == Boolean.FALSE;
            default:
                return false;
        }
    }

    private static Boolean parseBool(String s) {
        switch (s.toLowerCase(Locale.ROOT)) {
            case "1":
            case "t":
            case "true":
                return Boolean.TRUE;
            case "0":
            case "f":
            case "false":
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
