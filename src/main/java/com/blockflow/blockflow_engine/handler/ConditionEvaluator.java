package com.blockflow.blockflow_engine.handler;

import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Evaluates condition expressions after references have been resolved into them, e.g.
 * {@code "750 > 500 && gold == gold"}.
 *
 * Grammar: clauses joined by {@code ||}, each a conjunction of {@code &&} comparisons.
 * A comparison is {@code left op right} with op in == != <= >= < > or the word
 * {@code contains}; numeric comparison if both sides parse as numbers, else boolean, else
 * string. A bare value is tested for truthiness.
 */
@Component
public class ConditionEvaluator {

    private static final String[] OPERATORS = { "==", "!=", "<=", ">=", "<", ">" };

    public boolean evaluate(String expression) {
        if (expression == null || expression.isBlank()) return false;
        for (String clause : expression.split("\\|\\|")) {
            if (evaluateConjunction(clause)) return true;
        }
        return false;
    }

    private boolean evaluateConjunction(String clause) {
        for (String part : clause.split("&&")) {
            if (!evaluateComparison(part.trim())) return false;
        }
        return true;
    }

    private boolean evaluateComparison(String comparison) {
        int contains = comparison.indexOf(" contains ");
        if (contains >= 0) {
            String left = unquote(comparison.substring(0, contains));
            String right = unquote(comparison.substring(contains + " contains ".length()));
            return left.contains(right);
        }
        for (String op : OPERATORS) {
            int i = comparison.indexOf(op);
            if (i >= 0) {
                String left = unquote(comparison.substring(0, i));
                String right = unquote(comparison.substring(i + op.length()));
                return compare(left, right, op);
            }
        }
        return toBoolean(unquote(comparison));
    }

    private boolean compare(String leftStr, String rightStr, String op) {
        Double lNum = parseDouble(leftStr);
        Double rNum = parseDouble(rightStr);
        if (lNum != null && rNum != null) {
            return switch (op) {
                case "==" -> lNum.equals(rNum);
                case "!=" -> !lNum.equals(rNum);
                case "<"  -> lNum < rNum;
                case ">"  -> lNum > rNum;
                case "<=" -> lNum <= rNum;
                case ">=" -> lNum >= rNum;
                default   -> false;
            };
        }
        if ("true".equalsIgnoreCase(leftStr) || "false".equalsIgnoreCase(leftStr)) {
            boolean l = Boolean.parseBoolean(leftStr);
            boolean r = Boolean.parseBoolean(rightStr);
            return switch (op) {
                case "==" -> l == r;
                case "!=" -> l != r;
                default   -> false;
            };
        }
        int cmp = Objects.equals(leftStr, rightStr) ? 0 : leftStr.compareTo(rightStr);
        return switch (op) {
            case "==" -> cmp == 0;
            case "!=" -> cmp != 0;
            case "<"  -> cmp < 0;
            case ">"  -> cmp > 0;
            case "<=" -> cmp <= 0;
            case ">=" -> cmp >= 0;
            default   -> false;
        };
    }

    /** Truthiness of a resolved value: false, 0, blank and "null" are false. */
    public static boolean toBoolean(Object value) {
        if (value == null)                  return false;
        if (value instanceof Boolean b)     return b;
        if (value instanceof Number n)      return n.doubleValue() != 0;
        if (value instanceof String s) {
            String v = s.trim();
            if (v.isEmpty() || "false".equalsIgnoreCase(v) || "null".equals(v)) return false;
            Double num = parseDouble(v);
            return num == null || num != 0;
        }
        return true;
    }

    private static String unquote(String s) {
        String v = s.trim();
        if (v.length() >= 2
                && ((v.startsWith("\"") && v.endsWith("\"")) || (v.startsWith("'") && v.endsWith("'")))) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }

    private static Double parseDouble(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
