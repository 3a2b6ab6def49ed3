package com.plang.core.runtime;

import com.plang.core.ast.AttrAccess;
import com.plang.core.ast.BaseVisitor;
import com.plang.core.ast.BinaryOp;
import com.plang.core.ast.BinaryOperator;
import com.plang.core.ast.Expr;
import com.plang.core.ast.FuncCall;
import com.plang.core.ast.Ident;
import com.plang.core.ast.Literal;
import com.plang.core.ast.UnaryOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates condition expressions against an {@link EvaluationContext}. Every visited
 * node costs one step on the {@link StepMeter}.
 *
 * <p>Identifiers resolve from context variables, then policy outcomes
 * ({@code policies}), then cached facts, then the {@link FactResolver}; an identifier
 * nobody knows evaluates to null.
 */
public class ExpressionEvaluator extends BaseVisitor<Object> {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final EvaluationContext context;
    private final FactResolver resolver;
    private final StepMeter meter;

    public ExpressionEvaluator(EvaluationContext context, FactResolver resolver, StepMeter meter) {
        this.context = context;
        this.resolver = resolver != null ? resolver : FactResolver.NONE;
        this.meter = meter;
    }

    public Object evaluate(Expr expr) {
        if (expr == null) {
            return null;
        }
        return expr.accept(this);
    }

    public boolean test(Expr expr) {
        return Values.truthy(evaluate(expr));
    }

    @Override
    public Object visitLiteral(Literal node) {
        meter.tick();
        return node.value();
    }

    @Override
    public Object visitIdent(Ident node) {
        meter.tick();
        String name = node.name();
        if (context.hasVariable(name)) {
            return context.variable(name);
        }
        if (EvaluationContext.POLICIES.equals(name)) {
            return context.policyOutcomes();
        }
        return fact(name);
    }

    @Override
    public Object visitAttrAccess(AttrAccess node) {
        meter.tick();
        Object target = evaluate(node.target());
        if (target instanceof Map<?, ?> map && map.containsKey(node.attribute())) {
            return map.get(node.attribute());
        }
        Optional<String> path = node.dottedPath();
        if (path.isPresent() && !(target instanceof Map<?, ?>)) {
            return fact(path.get());
        }
        return null;
    }

    @Override
    public Object visitUnaryOp(UnaryOp node) {
        meter.tick();
        Object operand = evaluate(node.operand());
        return switch (node.operator()) {
            case NOT -> !Values.truthy(operand);
            case NEGATE -> {
                if (!Values.isNumber(operand)) {
                    throw new EvaluationException("Cannot negate " + Values.typeName(operand));
                }
                Number n = (Number) operand;
                yield Values.isIntegral(n) ? (Object) Math.negateExact(n.longValue()) : (Object) (-n.doubleValue());
            }
        };
    }

    @Override
    public Object visitBinaryOp(BinaryOp node) {
        meter.tick();
        BinaryOperator op = node.operator();
        if (op == BinaryOperator.AND) {
            return Values.truthy(evaluate(node.left())) && Values.truthy(evaluate(node.right()));
        }
        if (op == BinaryOperator.OR) {
            return Values.truthy(evaluate(node.left())) || Values.truthy(evaluate(node.right()));
        }

        Object left = evaluate(node.left());
        Object right = evaluate(node.right());
        return switch (op) {
            case EQ -> Values.equal(left, right);
            case NEQ -> !Values.equal(left, right);
            case LT -> left != null && right != null && Values.compare(left, right) < 0;
            case LTE -> left != null && right != null && Values.compare(left, right) <= 0;
            case GT -> left != null && right != null && Values.compare(left, right) > 0;
            case GTE -> left != null && right != null && Values.compare(left, right) >= 0;
            case IN -> Values.contains(right, left);
            case ADD, SUB, MUL, DIV, MOD -> arithmetic(op, left, right);
            case AND, OR -> throw new IllegalStateException("unreachable");
        };
    }

    @Override
    public Object visitFuncCall(FuncCall node) {
        meter.tick();
        Builtin builtin = Builtin.lookup(node.function())
                .orElseThrow(() -> new EvaluationException("Unknown function: " + node.function()));
        var args = new ArrayList<Object>(node.arguments().size());
        for (Expr arg : node.arguments()) {
            args.add(evaluate(arg));
        }
        return builtin.apply(args);
    }

    private Object fact(String key) {
        if (context.hasFact(key)) {
            return context.fact(key);
        }
        Optional<Object> resolved = resolver.resolve(key, context);
        if (resolved.isPresent()) {
            log.debug("Resolved fact {}", key);
            context.cacheFact(key, resolved.get());
            return resolved.get();
        }
        return null;
    }

    private static Object arithmetic(BinaryOperator op, Object left, Object right) {
        if (!(left instanceof Number a) || !(right instanceof Number b)) {
            throw new EvaluationException("Operator '" + op.symbol() + "' not defined for "
                    + Values.typeName(left) + " and " + Values.typeName(right));
        }
        boolean integral = Values.isIntegral(a) && Values.isIntegral(b);
        try {
            return switch (op) {
                case ADD -> integral ? (Object) Math.addExact(a.longValue(), b.longValue())
                        : (Object) (a.doubleValue() + b.doubleValue());
                case SUB -> integral ? (Object) Math.subtractExact(a.longValue(), b.longValue())
                        : (Object) (a.doubleValue() - b.doubleValue());
                case MUL -> integral ? (Object) Math.multiplyExact(a.longValue(), b.longValue())
                        : (Object) (a.doubleValue() * b.doubleValue());
                case DIV -> divide(a, b, integral);
                case MOD -> {
                    if (b.doubleValue() == 0.0) throw new EvaluationException("Modulo by zero");
                    yield integral ? (Object) (a.longValue() % b.longValue())
                            : (Object) (a.doubleValue() % b.doubleValue());
                }
                default -> throw new IllegalStateException("Not arithmetic: " + op);
            };
        } catch (ArithmeticException e) {
            throw new EvaluationException("Arithmetic overflow in '" + op.symbol() + "'", e);
        }
    }

    // Integer division stays integral only when exact, e.g. 10 / 4 == 2.5.
    private static Object divide(Number a, Number b, boolean integral) {
        if (b.doubleValue() == 0.0) {
            throw new EvaluationException("Division by zero");
        }
        if (integral && a.longValue() == Long.MIN_VALUE && b.longValue() == -1) {
            throw new EvaluationException("Arithmetic overflow in '/'");
        }
        if (integral && a.longValue() % b.longValue() == 0) {
            return a.longValue() / b.longValue();
        }
        return a.doubleValue() / b.doubleValue();
    }
}
