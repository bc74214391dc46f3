package com.skillflow.composer.condition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed form of a step condition.
 *
 * Evaluation only ever reads from the results namespace it is given
 * (step_id → stored result). There is no node type that can call out of
 * the expression, so a parsed condition cannot reach the process,
 * filesystem or network.
 */
public interface ConditionExpression {

    Object evaluate(Map<String, Object> results);

    // ------------------------------------------------------------------
    // Node types
    // ------------------------------------------------------------------

    record Literal(Object value) implements ConditionExpression {
        @Override
        public Object evaluate(Map<String, Object> results) { return value; }
    }

    /**
     * One lookup applied to the current value.
     *
     * @param key          Map key to read.
     * @param defaultValue Returned when the key is absent or the value is not a map.
     */
    record Accessor(String key, Object defaultValue) {}

    /** {@code stepA}, {@code stepA.get('k')}, {@code stepA.get('k', 0)}, {@code stepA.k}, {@code stepA['k']}. */
    record Reference(String stepId, List<Accessor> path) implements ConditionExpression {
        public Reference {
            path = List.copyOf(path);
        }

        @Override
        public Object evaluate(Map<String, Object> results) {
            Object current = results.get(stepId);
            for (Accessor accessor : path) {
                if (current instanceof Map<?, ?> map && map.containsKey(accessor.key())) {
                    current = map.get(accessor.key());
                } else {
                    current = accessor.defaultValue();
                }
            }
            return current;
        }

        /** Source-like rendering for log messages, e.g. {@code fetch['count']}. */
        public String text() {
            StringBuilder sb = new StringBuilder(stepId);
            path.forEach(a -> sb.append("['").append(a.key()).append("']"));
            return sb.toString();
        }
    }

    record Not(ConditionExpression operand) implements ConditionExpression {
        @Override
        public Object evaluate(Map<String, Object> results) {
            return !isTruthy(operand.evaluate(results));
        }
    }

    /** Short-circuit AND. */
    record And(List<ConditionExpression> operands) implements ConditionExpression {
        @Override
        public Object evaluate(Map<String, Object> results) {
            for (ConditionExpression operand : operands) {
                if (!isTruthy(operand.evaluate(results))) return false;
            }
            return true;
        }
    }

    /** Short-circuit OR. */
    record Or(List<ConditionExpression> operands) implements ConditionExpression {
        @Override
        public Object evaluate(Map<String, Object> results) {
            for (ConditionExpression operand : operands) {
                if (isTruthy(operand.evaluate(results))) return true;
            }
            return false;
        }
    }

    enum Operator { EQ, NE, LT, LE, GT, GE }

    record Comparison(Operator operator, ConditionExpression left, ConditionExpression right,
                      String source) implements ConditionExpression {
        @Override
        public Object evaluate(Map<String, Object> results) {
            Object l = left.evaluate(results);
            Object r = right.evaluate(results);
            return switch (operator) {
                case EQ -> valuesEqual(l, r);
                case NE -> !valuesEqual(l, r);
                case LT -> l != null && r != null && compare(l, r, source) < 0;
                case LE -> l != null && r != null && compare(l, r, source) <= 0;
                case GT -> l != null && r != null && compare(l, r, source) > 0;
                case GE -> l != null && r != null && compare(l, r, source) >= 0;
            };
        }
    }

    /** Every step reference in the expression, in source order. */
    static List<Reference> references(ConditionExpression expr) {
        List<Reference> found = new ArrayList<>();
        collectReferences(expr, found);
        return found;
    }

    private static void collectReferences(ConditionExpression expr, List<Reference> found) {
        if (expr instanceof Reference ref) {
            found.add(ref);
        } else if (expr instanceof Not not) {
            collectReferences(not.operand(), found);
        } else if (expr instanceof And and) {
            and.operands().forEach(o -> collectReferences(o, found));
        } else if (expr instanceof Or or) {
            or.operands().forEach(o -> collectReferences(o, found));
        } else if (expr instanceof Comparison cmp) {
            collectReferences(cmp.left(), found);
            collectReferences(cmp.right(), found);
        }
    }

    // ------------------------------------------------------------------
    // Value semantics
    // ------------------------------------------------------------------

    /** null, false, zero, "" and empty collections are false; everything else is true. */
    static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return toDecimal(n, null).signum() != 0;
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    private static boolean valuesEqual(Object l, Object r) {
        if (l instanceof Number ln && r instanceof Number rn) {
            return toDecimal(ln, null).compareTo(toDecimal(rn, null)) == 0;
        }
        return Objects.equals(l, r);
    }

    private static int compare(Object l, Object r, String source) {
        if (l instanceof Number ln && r instanceof Number rn) {
            return toDecimal(ln, source).compareTo(toDecimal(rn, source));
        }
        if (l instanceof String ls && r instanceof String rs) {
            return ls.compareTo(rs);
        }
        if (l instanceof Boolean lb && r instanceof Boolean rb) {
            return Boolean.compare(lb, rb);
        }
        throw new ConditionException(source, "Cannot order "
                + l.getClass().getSimpleName() + " against " + r.getClass().getSimpleName());
    }

    private static BigDecimal toDecimal(Number n, String source) {
        if (n instanceof BigDecimal d) return d;
        if (n instanceof BigInteger i) return new BigDecimal(i);
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ConditionException(String.valueOf(source), "Non-finite number " + d);
            }
            return BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(n.longValue());
    }
}
