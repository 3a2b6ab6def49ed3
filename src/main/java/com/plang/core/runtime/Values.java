package com.plang.core.runtime;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Value semantics shared by the expression evaluator and the built-in functions.
 */
final class Values {

    private Values() {}

    static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    static boolean equal(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Number x && b instanceof Number y) {
            if (isIntegral(x) && isIntegral(y)) return x.longValue() == y.longValue();
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            if (x.size() != y.size()) return false;
            for (int i = 0; i < x.size(); i++) {
                if (!equal(x.get(i), y.get(i))) return false;
            }
            return true;
        }
        return a.equals(b);
    }

    /**
     * Orders two non-null values of the same kind.
     *
     * @throws EvaluationException for mixed or unordered types
     */
    static int compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (isIntegral(x) && isIntegral(y)) return Long.compare(x.longValue(), y.longValue());
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        throw new EvaluationException("Cannot compare " + typeName(a) + " with " + typeName(b));
    }

    static boolean contains(Object container, Object item) {
        if (container == null) return false;
        if (container instanceof Collection<?> c) {
            for (Object element : c) {
                if (equal(element, item)) return true;
            }
            return false;
        }
        if (container instanceof Map<?, ?> m) {
            return m.containsKey(item);
        }
        if (container instanceof String s) {
            if (item == null) return false;
            if (!(item instanceof String sub)) {
                throw new EvaluationException("Cannot search for " + typeName(item) + " in a string");
            }
            return s.contains(sub);
        }
        throw new EvaluationException("Cannot test membership in " + typeName(container));
    }

    static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof Boolean) return "bool";
        if (isIntegral(value)) return "int";
        if (value instanceof Number) return "float";
        if (value instanceof String) return "string";
        if (value instanceof Collection<?>) return "list";
        if (value instanceof Map<?, ?>) return "map";
        return value.getClass().getSimpleName();
    }
}
