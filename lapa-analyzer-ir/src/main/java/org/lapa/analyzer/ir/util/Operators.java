package org.lapa.analyzer.ir.util;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/*
Static evaluation of the operators that constant folding and constant propagation understand.

Numbers are normalised first: byte, short, int and long become Long, float and double become Double. Integer
arithmetic is exact; an overflow, like a division by zero or an operator applied to operands it does not accept,
means "not a constant", and is reported as an empty Optional.
 */
public final class Operators {

    public static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/");
    public static final Set<String> COMPARISON = Set.of("==", "!=", "<", "<=", ">", ">=");

    private Operators() {
    }

    public static boolean isArithmetic(String operator) {
        return operator != null && ARITHMETIC.contains(operator);
    }

    public static boolean isComparison(String operator) {
        return operator != null && COMPARISON.contains(operator);
    }

    public static Optional<Object> evaluateBinary(String operator, Object left, Object right) {
        if (operator == null) return Optional.empty();
        Object l = normalize(left);
        Object r = normalize(right);
        try {
            Object result = switch (operator) {
                case "+" -> plus(l, r);
                case "-" -> arithmetic(l, r, Math::subtractExact, (a, b) -> a - b);
                case "*" -> arithmetic(l, r, Math::multiplyExact, (a, b) -> a * b);
                case "/" -> divide(l, r);
                case "%" -> modulo(l, r);
                case "**" -> power(l, r);
                case "and" -> truthy(l) ? r : l;
                case "or" -> truthy(l) ? l : r;
                case "==" -> equal(l, r);
                case "!=" -> !equal(l, r);
                case "<" -> compare(l, r, c -> c < 0);
                case "<=" -> compare(l, r, c -> c <= 0);
                case ">" -> compare(l, r, c -> c > 0);
                case ">=" -> compare(l, r, c -> c >= 0);
                default -> null;
            };
            return Optional.ofNullable(result);
        } catch (ArithmeticException ae) {
            return Optional.empty();
        }
    }

    public static Optional<Object> evaluateUnary(String operator, Object operand) {
        if (operator == null) return Optional.empty();
        Object o = normalize(operand);
        try {
            Object result = switch (operator) {
                case "+" -> o instanceof Number ? o : null;
                case "-" -> negate(o);
                case "not" -> !truthy(o);
                default -> null;
            };
            return Optional.ofNullable(result);
        } catch (ArithmeticException ae) {
            return Optional.empty();
        }
    }

    private static Object negate(Object o) {
        if (o instanceof Long l) return Math.negateExact(l);
        if (o instanceof Double d) return -d;
        return null;
    }

    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) return f.doubleValue();
        return value;
    }

    /**
     * Truth value with the usual dynamic-language conventions: null, false, zero and empty strings are false.
     */
    public static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Long l) return l != 0L;
        if (value instanceof Double d) return d != 0.0;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        if (value instanceof String s) return !s.isEmpty();
        if (value instanceof Collection<?> c) return !c.isEmpty();
        return true;
    }

    private interface LongOp {
        long apply(long a, long b);
    }

    private interface DoubleOp {
        double apply(double a, double b);
    }

    private interface ComparisonResult {
        boolean test(int comparison);
    }

    private static boolean isNumber(Object o) {
        return o instanceof Long || o instanceof Double;
    }

    private static Object plus(Object l, Object r) {
        if (l instanceof String s1 && r instanceof String s2) return s1 + s2;
        return arithmetic(l, r, Math::addExact, Double::sum);
    }

    private static Object arithmetic(Object l, Object r, LongOp longOp, DoubleOp doubleOp) {
        if (l instanceof Long a && r instanceof Long b) return longOp.apply(a, b);
        if (isNumber(l) && isNumber(r)) {
            return doubleOp.apply(((Number) l).doubleValue(), ((Number) r).doubleValue());
        }
        return null;
    }

    // true division: the result is always a floating point value
    private static Object divide(Object l, Object r) {
        if (!isNumber(l) || !isNumber(r)) return null;
        double divisor = ((Number) r).doubleValue();
        if (divisor == 0.0) return null;
        return ((Number) l).doubleValue() / divisor;
    }

    // the sign of the result follows the divisor
    private static Object modulo(Object l, Object r) {
        if (l instanceof Long a && r instanceof Long b) {
            if (b == 0L) return null;
            return Math.floorMod(a, b);
        }
        if (isNumber(l) && isNumber(r)) {
            double a = ((Number) l).doubleValue();
            double b = ((Number) r).doubleValue();
            if (b == 0.0) return null;
            double m = a % b;
            return m != 0.0 && (m < 0) != (b < 0) ? m + b : m;
        }
        return null;
    }

    private static Object power(Object l, Object r) {
        if (l instanceof Long base && r instanceof Long exponent && exponent >= 0) {
            long result = 1L;
            long b = base;
            long e = exponent;
            while (e > 0) {
                if ((e & 1L) == 1L) result = Math.multiplyExact(result, b);
                e >>= 1;
                if (e > 0) b = Math.multiplyExact(b, b);
            }
            return result;
        }
        if (isNumber(l) && isNumber(r)) {
            double result = Math.pow(((Number) l).doubleValue(), ((Number) r).doubleValue());
            return Double.isNaN(result) ? null : result;
        }
        return null;
    }

    private static boolean equal(Object l, Object r) {
        if (isNumber(l) && isNumber(r)) {
            return ((Number) l).doubleValue() == ((Number) r).doubleValue();
        }
        return Objects.equals(l, r);
    }

    private static Object compare(Object l, Object r, ComparisonResult result) {
        if (l instanceof Long a && r instanceof Long b) return result.test(Long.compare(a, b));
        if (isNumber(l) && isNumber(r)) {
            return result.test(Double.compare(((Number) l).doubleValue(), ((Number) r).doubleValue()));
        }
        if (l instanceof String s1 && r instanceof String s2) return result.test(s1.compareTo(s2));
        return null;
    }
}
