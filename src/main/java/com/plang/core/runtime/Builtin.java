package com.plang.core.runtime;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * The closed set of functions callable from PLang expressions.
 */
public enum Builtin {
    LEN("len", 1, 1, args -> {
        Object v = args.get(0);
        if (v == null) return 0L;
        if (v instanceof String s) return (long) s.length();
        if (v instanceof Collection<?> c) return (long) c.size();
        if (v instanceof Map<?, ?> m) return (long) m.size();
        throw new EvaluationException("len() not defined for " + Values.typeName(v));
    }),
    CONTAINS("contains", 2, 2, args -> Values.contains(args.get(0), args.get(1))),
    LOWER("lower", 1, 1, args -> mapString(args.get(0), s -> s.toLowerCase(Locale.ROOT))),
    UPPER("upper", 1, 1, args -> mapString(args.get(0), s -> s.toUpperCase(Locale.ROOT))),
    STARTS_WITH("starts_with", 2, 2, args -> {
        String s = requireString("starts_with", args.get(0));
        String prefix = requireString("starts_with", args.get(1));
        return s != null && prefix != null && s.startsWith(prefix);
    }),
    ENDS_WITH("ends_with", 2, 2, args -> {
        String s = requireString("ends_with", args.get(0));
        String suffix = requireString("ends_with", args.get(1));
        return s != null && suffix != null && s.endsWith(suffix);
    }),
    EXISTS("exists", 1, 1, args -> args.get(0) != null),
    ABS("abs", 1, 1, args -> {
        Number n = requireNumber("abs", args.get(0));
        return Values.isIntegral(n) ? (Object) absExact(n.longValue()) : (Object) Math.abs(n.doubleValue());
    }),
    MIN("min", 1, Integer.MAX_VALUE, args -> extreme("min", args, -1)),
    MAX("max", 1, Integer.MAX_VALUE, args -> extreme("max", args, 1)),
    COALESCE("coalesce", 1, Integer.MAX_VALUE, args -> {
        for (Object arg : args) {
            if (arg != null) return arg;
        }
        return null;
    });

    private final String functionName;
    private final int minArgs;
    private final int maxArgs;
    private final Function<List<Object>, Object> body;

    Builtin(String functionName, int minArgs, int maxArgs, Function<List<Object>, Object> body) {
        this.functionName = functionName;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.body = body;
    }

    public String functionName() {
        return functionName;
    }

    public static Optional<Builtin> lookup(String name) {
        if (name == null) return Optional.empty();
        String key = name.toLowerCase(Locale.ROOT);
        for (Builtin builtin : values()) {
            if (builtin.functionName.equals(key)) {
                return Optional.of(builtin);
            }
        }
        return Optional.empty();
    }

    /**
     * @throws EvaluationException on wrong arity or argument types
     */
    public Object apply(List<Object> args) {
        if (args.size() < minArgs || args.size() > maxArgs) {
            String expected = minArgs == maxArgs ? String.valueOf(minArgs)
                    : maxArgs == Integer.MAX_VALUE ? "at least " + minArgs
                    : minArgs + ".." + maxArgs;
            throw new EvaluationException(functionName + "() expects " + expected
                    + " argument(s), got " + args.size());
        }
        return body.apply(args);
    }

    private static Object mapString(Object value, Function<String, String> f) {
        String s = requireString("string function", value);
        return s == null ? null : f.apply(s);
    }

    private static String requireString(String fn, Object value) {
        if (value == null || value instanceof String) return (String) value;
        throw new EvaluationException(fn + "() expects a string, got " + Values.typeName(value));
    }

    private static long absExact(long value) {
        try {
            return Math.absExact(value);
        } catch (ArithmeticException e) {
            throw new EvaluationException("abs() overflows for " + value, e);
        }
    }

    private static Number requireNumber(String fn, Object value) {
        if (value instanceof Number n) return n;
        throw new EvaluationException(fn + "() expects a number, got " + Values.typeName(value));
    }

    /**
     * min/max over the arguments, or over a single list argument. Nulls are skipped.
     */
    private static Object extreme(String fn, List<Object> args, int sign) {
        List<?> items = args.size() == 1 && args.get(0) instanceof List<?> list ? list : args;
        Object best = null;
        for (Object item : items) {
            if (item == null) continue;
            if (best == null || sign * Values.compare(item, best) > 0) {
                best = item;
            }
        }
        return best;
    }
}
