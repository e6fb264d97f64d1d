package com.github.salilvnair.statefuzzer.engine.expression.helper;

import com.github.salilvnair.statefuzzer.engine.exception.StateFuzzerErrorCode;
import com.github.salilvnair.statefuzzer.engine.exception.StateFuzzerException;
import com.github.salilvnair.statefuzzer.engine.expression.ast.ArithmeticOperator;
import com.github.salilvnair.statefuzzer.engine.expression.ast.ComparisonOperator;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Value semantics shared by the expression evaluator and the state update resolvers.
 * Numbers are carried as {@link Long} or {@link Double}; {@code null} is the absent value.
 */
public final class ValueOperations {

    private static final Long ZERO = 0L;

    private ValueOperations() {}

    public static Object normalize(Object value) {
        if (value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? (Object) big.longValue() : (Object) big.doubleValue();
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof CharSequence cs && !(value instanceof String)) {
            return cs.toString();
        }
        return value;
    }

    public static Map<String, Object> normalizeAll(Map<String, ?> values) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((k, v) -> out.put(k, normalize(v)));
        }
        return out;
    }

    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Long l) return l != 0L;
        if (value instanceof Number n) return n.doubleValue() != 0.0d;
        if (value instanceof String s) return !s.isEmpty();
        return true;
    }

    public static Object arithmetic(ArithmeticOperator operator, Object left, Object right) {
        return operator == ArithmeticOperator.ADD ? add(left, right) : subtract(left, right);
    }

    public static Object add(Object left, Object right) {
        Object l = normalize(left);
        Object r = normalize(right);
        if (l instanceof String ls && r instanceof String rs) {
            return ls + rs;
        }
        l = numericOrZero(l, "+");
        r = numericOrZero(r, "+");
        if (l instanceof Long a && r instanceof Long b) {
            try {
                return Math.addExact(a, b);
            } catch (ArithmeticException overflow) {
                return a.doubleValue() + b.doubleValue();
            }
        }
        return ((Number) l).doubleValue() + ((Number) r).doubleValue();
    }

    public static Object subtract(Object left, Object right) {
        Object l = numericOrZero(normalize(left), "-");
        Object r = numericOrZero(normalize(right), "-");
        if (l instanceof Long a && r instanceof Long b) {
            try {
                return Math.subtractExact(a, b);
            } catch (ArithmeticException overflow) {
                return a.doubleValue() - b.doubleValue();
            }
        }
        return ((Number) l).doubleValue() - ((Number) r).doubleValue();
    }

    public static boolean compare(ComparisonOperator operator, Object left, Object right) {
        Object l = normalize(left);
        Object r = normalize(right);
        switch (operator) {
            case EQ:
                return valuesEqual(l, r);
            case NE:
                return !valuesEqual(l, r);
            default:
                Integer order = order(l, r);
                if (order == null) {
                    return false;
                }
                return switch (operator) {
                    case GT -> order > 0;
                    case LT -> order < 0;
                    case GTE -> order >= 0;
                    case LTE -> order <= 0;
                    default -> false;
                };
        }
    }

    public static boolean valuesEqual(Object left, Object right) {
        if (isNumeric(left) && isNumeric(right)) {
            Integer order = numericOrder(asNumber(left), asNumber(right));
            return order != null && order == 0;
        }
        return Objects.equals(left, right);
    }

    private static Integer order(Object left, Object right) {
        if (isNumeric(left) && isNumeric(right)) {
            return numericOrder(asNumber(left), asNumber(right));
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        return null;
    }

    /**
     * Exact order of two numbers, or {@code null} when either is NaN. Mixed integer and
     * decimal operands are compared as {@link BigDecimal}, so -0.0 equals 0 and longs
     * beyond 2^53 keep their precision.
     */
    private static Integer numericOrder(Number left, Number right) {
        if (left instanceof Long a && right instanceof Long b) {
            return Long.compare(a, b);
        }
        double a = left.doubleValue();
        double b = right.doubleValue();
        if (Double.isNaN(a) || Double.isNaN(b)) {
            return null;
        }
        if (Double.isInfinite(a) || Double.isInfinite(b)) {
            return a < b ? -1 : (a > b ? 1 : 0);
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static BigDecimal toBigDecimal(Number value) {
        if (value instanceof Long l) {
            return BigDecimal.valueOf(l);
        }
        return new BigDecimal(value.doubleValue());
    }

    // booleans take part in arithmetic and numeric comparison as 0 and 1
    private static boolean isNumeric(Object value) {
        return value instanceof Number || value instanceof Boolean;
    }

    private static Number asNumber(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        return (Number) value;
    }

    private static Object numericOrZero(Object value, String operator) {
        if (value == null) {
            return ZERO;
        }
        if (isNumeric(value)) {
            return asNumber(value);
        }
        throw new StateFuzzerException(
                StateFuzzerErrorCode.EXPRESSION_TYPE_MISMATCH,
                "Operator '" + operator + "' is not defined for value '" + value + "' of type "
                        + value.getClass().getSimpleName());
    }
}
