package org.pyken.translator;

import org.pyken.UnsupportedOperatorException;
import org.pyken.diagnostic.SourceLocation;

import java.util.Map;
import java.util.Set;

/**
 * Fixed Python to Aiken operator spellings. Membership tests ({@code in},
 * {@code not in}) are rewritten to {@code list.has} calls by the translator and
 * only checked for presence here.
 */
public final class OperatorTable {

    public static final String LIST_MODULE = "aiken/collection/list";

    private static final Map<String, String> BINARY_OPERATORS = Map.ofEntries(
            Map.entry("+", "+"),
            Map.entry("-", "-"),
            Map.entry("*", "*"),
            Map.entry("%", "%"),
            Map.entry("/", "/"),
            Map.entry("//", "/"),
            Map.entry("==", "=="),
            Map.entry("!=", "!="),
            Map.entry("<", "<"),
            Map.entry("<=", "<="),
            Map.entry(">", ">"),
            Map.entry(">=", ">="),
            Map.entry("is", "=="),
            Map.entry("is not", "!="),
            Map.entry("and", "&&"),
            Map.entry("or", "||")
    );

    private static final Map<String, String> UNARY_OPERATORS = Map.of(
            "-", "-",
            "not", "!"
    );

    private static final Set<String> MEMBERSHIP_OPERATORS = Set.of("in", "not in");

    private OperatorTable() {
    }

    /**
     * @throws UnsupportedOperatorException if {@code operator} has no entry
     */
    public static String binary(String operator, SourceLocation location) {
        String aiken = BINARY_OPERATORS.get(operator);
        if (aiken == null) {
            throw new UnsupportedOperatorException(operator, location.line(), location.column());
        }
        return aiken;
    }

    /**
     * @throws UnsupportedOperatorException if {@code operator} has no entry
     */
    public static String unary(String operator, SourceLocation location) {
        String aiken = UNARY_OPERATORS.get(operator);
        if (aiken == null) {
            throw new UnsupportedOperatorException("unary " + operator, location.line(), location.column());
        }
        return aiken;
    }

    public static boolean isMembership(String operator) {
        return MEMBERSHIP_OPERATORS.contains(operator);
    }

    public static Map<String, String> binaryOperators() {
        return BINARY_OPERATORS;
    }
}
