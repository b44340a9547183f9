package com.stagewise.engine.compiler.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Parses visibility expressions into an {@link Expression} tree.
 *
 * <p>Grammar, loosest binding first:
 * <pre>
 *   expr       := and
 *   and        := or (("AND" | "&amp;&amp;") or)*
 *   or         := unary (("OR" | "||") unary)*
 *   unary      := ("NOT" | "!") unary | "(" expr ")" | membership | comparison | operand
 *   membership := operand ("in" | "not_in" | "contains") operand
 *   comparison := operand ("==" | "!=" | "&gt;=" | "&lt;=" | "&gt;" | "&lt;") operand
 *   operand    := 'string' | "string" | number | true | false | null | [list] | path
 * </pre>
 * Keywords are case-insensitive. Operators are only recognized outside quotes
 * and at parenthesis depth zero. AND binds loosest, so {@code a OR b AND c}
 * reads as {@code (a OR b) AND c}; parentheses override it as written.
 *
 * <p>The parser is stateless and thread-safe.
 */
public final class ExpressionParser {

    private static final Logger logger = Logger.getLogger(ExpressionParser.class.getName());

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern PATH = Pattern.compile("[A-Za-z_][A-Za-z0-9_\\-]*(\\.[A-Za-z0-9_\\-]+)*");

    private static final MembershipOperator[] MEMBERSHIP_SCAN_ORDER = {
            MembershipOperator.NOT_IN, MembershipOperator.CONTAINS, MembershipOperator.IN
    };
    private static final ComparisonOperator[] COMPARISON_SCAN_ORDER = {
            ComparisonOperator.EQ, ComparisonOperator.NE, ComparisonOperator.GE,
            ComparisonOperator.LE, ComparisonOperator.GT, ComparisonOperator.LT
    };

    /**
     * Parses {@code source}. A null or blank expression is an absent rule and
     * parses to {@link Literal#TRUE}.
     *
     * @throws ExpressionSyntaxException on malformed input
     */
    public Expression parse(String source) {
        if (source == null || source.isBlank()) {
            return Literal.TRUE;
        }
        checkBalanced(source);
        return parseExpression(source.trim(), source);
    }

    /**
     * Like {@link #parse(String)} but never throws: malformed input becomes an
     * {@link Invalid} node, which evaluates as visible.
     */
    public Expression parseLenient(String source) {
        try {
            return parse(source);
        } catch (ExpressionSyntaxException e) {
            logger.warning("Malformed visibility expression, treating as visible: " + e.getMessage());
            return new Invalid(source, e.getMessage());
        }
    }

    private Expression parseExpression(String s, String source) {
        if (s.isEmpty()) {
            throw new ExpressionSyntaxException("Missing operand", source);
        }
        if (s.equalsIgnoreCase("true")) {
            return Literal.TRUE;
        }
        if (s.equalsIgnoreCase("false")) {
            return Literal.FALSE;
        }

        List<String> parts = splitTopLevel(s, "AND", "&&");
        if (parts.size() > 1) {
            return new Logical(Logical.Kind.AND, parseAll(parts, source));
        }
        parts = splitTopLevel(s, "OR", "||");
        if (parts.size() > 1) {
            return new Logical(Logical.Kind.OR, parseAll(parts, source));
        }

        String negated = stripNotKeyword(s);
        if (negated != null) {
            return new Not(parseExpression(negated, source));
        }
        if (s.startsWith("!") && !s.startsWith("!=")) {
            return new Not(parseExpression(s.substring(1).trim(), source));
        }
        if (s.charAt(0) == '(' && closingIndex(s, 0) == s.length() - 1) {
            return parseExpression(s.substring(1, s.length() - 1).trim(), source);
        }

        for (MembershipOperator operator : MEMBERSHIP_SCAN_ORDER) {
            int[] match = findWord(s, operator.keyword());
            if (match != null) {
                return new Membership(
                        parseOperand(s.substring(0, match[0]).trim(), source),
                        operator,
                        parseOperand(s.substring(match[1]).trim(), source));
            }
        }

        int[] comparison = findComparison(s);
        if (comparison != null) {
            ComparisonOperator operator = COMPARISON_SCAN_ORDER[comparison[2]];
            return new Comparison(
                    parseOperand(s.substring(0, comparison[0]).trim(), source),
                    operator,
                    parseOperand(s.substring(comparison[1]).trim(), source));
        }

        return new Truthy(parseOperand(s, source));
    }

    private List<Expression> parseAll(List<String> parts, String source) {
        List<Expression> parsed = new ArrayList<>(parts.size());
        for (String part : parts) {
            parsed.add(parseExpression(part.trim(), source));
        }
        return parsed;
    }

    private Expression parseOperand(String s, String source) {
        if (s.isEmpty()) {
            throw new ExpressionSyntaxException("Missing operand", source);
        }
        char first = s.charAt(0);
        char last = s.charAt(s.length() - 1);
        if (s.length() >= 2 && (first == '\'' || first == '"') && last == first
                && s.indexOf(first, 1) == s.length() - 1) {
            return new Literal(s.substring(1, s.length() - 1));
        }
        if (first == '[' && last == ']' && closingIndex(s, 0) == s.length() - 1) {
            String inner = s.substring(1, s.length() - 1).trim();
            List<Expression> items = new ArrayList<>();
            if (!inner.isEmpty()) {
                for (String item : splitOnCommas(inner)) {
                    items.add(parseOperand(item.trim(), source));
                }
            }
            return new ListLiteral(items);
        }
        if (first == '(' && closingIndex(s, 0) == s.length() - 1) {
            return parseOperand(s.substring(1, s.length() - 1).trim(), source);
        }
        if (NUMBER.matcher(s).matches()) {
            return s.indexOf('.') >= 0 ? new Literal(Double.parseDouble(s)) : new Literal(Long.parseLong(s));
        }
        switch (s.toLowerCase(Locale.ROOT)) {
            case "true":
                return Literal.TRUE;
            case "false":
                return Literal.FALSE;
            case "null":
            case "none":
                return Literal.NULL;
            default:
                break;
        }
        if (PATH.matcher(s).matches()) {
            return PathRef.of(s);
        }
        throw new ExpressionSyntaxException("Unrecognized operand '" + s + "'", source);
    }

    // ==================== Scanning helpers ====================

    /**
     * Splits on a keyword (surrounded by whitespace) or a symbol, at depth zero
     * and outside quotes.
     */
    private static List<String> splitTopLevel(String s, String keyword, String symbol) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int depth = 0;
        char quote = 0;
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                i++;
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (depth == 0) {
                if (s.startsWith(symbol, i)) {
                    parts.add(s.substring(start, i));
                    i += symbol.length();
                    start = i;
                    continue;
                }
                int end = matchWordAt(s, i, keyword);
                if (end > 0) {
                    parts.add(s.substring(start, i));
                    i = end;
                    start = i;
                    continue;
                }
            }
            i++;
        }
        parts.add(s.substring(start));
        return parts;
    }

    private static int[] findWord(String s, String keyword) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (depth == 0) {
                int end = matchWordAt(s, i, keyword);
                if (end > 0) {
                    return new int[]{i, end};
                }
            }
        }
        return null;
    }

    /**
     * @return {start, end, index into COMPARISON_SCAN_ORDER} of the first
     *         top-level comparison operator, or null
     */
    private static int[] findComparison(String s) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (depth == 0) {
                for (int op = 0; op < COMPARISON_SCAN_ORDER.length; op++) {
                    String symbol = COMPARISON_SCAN_ORDER[op].symbol();
                    if (s.startsWith(symbol, i)) {
                        return new int[]{i, i + symbol.length(), op};
                    }
                }
            }
        }
        return null;
    }

    /**
     * If position {@code i} is whitespace followed by {@code keyword} and more
     * whitespace, returns the index just after that trailing whitespace.
     */
    private static int matchWordAt(String s, int i, String keyword) {
        if (!Character.isWhitespace(s.charAt(i))) {
            return -1;
        }
        int k = i;
        while (k < s.length() && Character.isWhitespace(s.charAt(k))) {
            k++;
        }
        int after = k + keyword.length();
        if (after >= s.length() || !s.regionMatches(true, k, keyword, 0, keyword.length())
                || !Character.isWhitespace(s.charAt(after))) {
            return -1;
        }
        while (after < s.length() && Character.isWhitespace(s.charAt(after))) {
            after++;
        }
        return after;
    }

    private static String stripNotKeyword(String s) {
        if (s.length() > 4 && s.regionMatches(true, 0, "NOT", 0, 3)) {
            char next = s.charAt(3);
            if (Character.isWhitespace(next) || next == '(') {
                return s.substring(3).trim();
            }
        }
        return null;
    }

    private static int closingIndex(String s, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static List<String> splitOnCommas(String s) {
        List<String> items = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                items.add(s.substring(start, i));
                start = i + 1;
            }
        }
        items.add(s.substring(start));
        return items;
    }

    private static void checkBalanced(String source) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
                if (depth < 0) {
                    throw new ExpressionSyntaxException("Unbalanced closing bracket", source);
                }
            }
        }
        if (quote != 0) {
            throw new ExpressionSyntaxException("Unbalanced quotes", source);
        }
        if (depth != 0) {
            throw new ExpressionSyntaxException("Unbalanced parentheses", source);
        }
    }
}
