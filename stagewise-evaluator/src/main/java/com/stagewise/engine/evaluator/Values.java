package com.stagewise.engine.evaluator;

import com.stagewise.engine.compiler.expression.ComparisonOperator;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Loose value semantics used by rule evaluation.
 *
 * <p>A number compared with a numeric-looking string sees the string as a
 * number. Two strings compare case-insensitively. Ordering two values that
 * have no common order yields {@code false}.
 */
final class Values {

    private static final int INCOMPARABLE = Integer.MIN_VALUE;

    private Values() {
    }

    static boolean compare(Object left, ComparisonOperator operator, Object right) {
        Object l = coerce(left, right);
        Object r = coerce(right, left);
        if (l instanceof String ls && r instanceof String rs) {
            l = ls.toLowerCase(Locale.ROOT);
            r = rs.toLowerCase(Locale.ROOT);
        }
        if (operator == ComparisonOperator.EQ) {
            return same(l, r);
        }
        if (operator == ComparisonOperator.NE) {
            return !same(l, r);
        }
        int order = order(l, r);
        if (order == INCOMPARABLE) {
            return false;
        }
        return switch (operator) {
            case GT -> order > 0;
            case LT -> order < 0;
            case GE -> order >= 0;
            case LE -> order <= 0;
            case EQ, NE -> false;
        };
    }

    /**
     * Equality as {@code ==} sees it, used for list membership as well.
     */
    static boolean looselyEqual(Object a, Object b) {
        return compare(a, ComparisonOperator.EQ, b);
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    /**
     * Parses a numeric-looking string: decimals when it contains a dot,
     * integers otherwise. Returns {@code null} when it is not a number.
     */
    static Number parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return trimmed.contains(".") ? (Number) Double.parseDouble(trimmed) : (Number) Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Object coerce(Object value, Object other) {
        if (value instanceof String s && other instanceof Number) {
            Number parsed = parseNumber(s);
            return parsed == null ? value : parsed;
        }
        return value;
    }

    private static boolean same(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return compareNumbers(na, nb) == 0;
        }
        return Objects.equals(a, b);
    }

    private static int order(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return Integer.signum(compareNumbers(na, nb));
        }
        if (a instanceof String sa && b instanceof String sb) {
            return Integer.signum(sa.compareTo(sb));
        }
        if (a instanceof Boolean ba && b instanceof Boolean bb) {
            return Boolean.compare(ba, bb);
        }
        return INCOMPARABLE;
    }

    private static int compareNumbers(Number a, Number b) {
        if (isFloating(a) || isFloating(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (a instanceof BigDecimal || b instanceof BigDecimal) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
        }
        return Long.compare(a.longValue(), b.longValue());
    }

    private static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float;
    }
}
