package com.plang.core.visitor;

import com.plang.core.ast.*;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders an AST back to canonical PLang source: two-space indentation, upper-case
 * categories and actions, minimal parentheses. Printing the re-parsed output yields
 * the same text again.
 */
public class PrettyPrinter implements AstVisitor<String> {

    private static final String INDENT = "  ";

    private int depth;

    public static String print(Node node) {
        return node == null ? "" : node.accept(new PrettyPrinter());
    }

    @Override
    public String visitProgram(Program node) {
        return node.statements().stream()
                .map(s -> s.accept(this))
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String visitPolicyDecl(PolicyDecl node) {
        return declaration("policy", node.name(), node.category() != null ? node.category().name() : null, node.body());
    }

    @Override
    public String visitRuleDecl(RuleDecl node) {
        return declaration("rule", node.name(), node.category() != null ? node.category().name() : null, node.body());
    }

    private String declaration(String keyword, String name, String category, List<Node> body) {
        var sb = new StringBuilder();
        sb.append(indent()).append(keyword).append(' ').append(name);
        if (category != null) {
            sb.append(" : ").append(category);
        }
        sb.append(" {\n");
        depth++;
        for (Node child : body) {
            if (child instanceof RuleDecl) {
                sb.append(child.accept(this));
            } else {
                sb.append(indent()).append(child.accept(this)).append('\n');
            }
        }
        depth--;
        sb.append(indent()).append("}\n");
        return sb.toString();
    }

    @Override
    public String visitImport(Import node) {
        return "import " + quote(node.path()) + "\n";
    }

    @Override
    public String visitRuleRef(RuleRef node) {
        return "use " + node.ruleName();
    }

    @Override
    public String visitPriority(Priority node) {
        return "priority " + node.value();
    }

    @Override
    public String visitConditionBlock(ConditionBlock node) {
        String condition = node.condition() != null ? node.condition().accept(this) : "<missing>";
        String action = node.action() != null ? node.action().accept(this) : "<missing>";
        return "when " + condition + " then " + action;
    }

    @Override
    public String visitActionBlock(ActionBlock node) {
        var sb = new StringBuilder(node.kind() != null ? node.kind().name() : "<missing>");
        if (node.routeTarget() != null) {
            sb.append(' ').append(node.routeTarget().accept(this));
        }
        if (node.reason() != null) {
            sb.append(' ').append(quote(node.reason()));
        }
        return sb.toString();
    }

    @Override
    public String visitRouteTarget(RouteTarget node) {
        return "to " + node.targetName();
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        int precedence = node.operator().precedence();
        // comparisons do not chain, so both operands of a comparison need parentheses at equal precedence
        String left = operand(node.left(), node.operator().isComparison() ? precedence + 1 : precedence);
        String right = operand(node.right(), precedence + 1);
        return left + " " + node.operator().symbol() + " " + right;
    }

    private String operand(Expr expr, int minPrecedence) {
        if (expr == null) {
            return "<missing>";
        }
        String text = expr.accept(this);
        if (expr instanceof BinaryOp op && op.operator().precedence() < minPrecedence) {
            return "(" + text + ")";
        }
        if (expr instanceof UnaryOp unary && unary.operator() == UnaryOperator.NOT && minPrecedence > 2) {
            return "(" + text + ")";
        }
        return text;
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        Expr operand = node.operand();
        String text = operand != null ? operand.accept(this) : "<missing>";
        boolean wrap = operand instanceof BinaryOp op
                && (node.operator() == UnaryOperator.NEGATE || op.operator().precedence() < 3);
        if (wrap) {
            text = "(" + text + ")";
        }
        return node.operator() == UnaryOperator.NOT ? "not " + text : "-" + text;
    }

    @Override
    public String visitIdent(Ident node) {
        return node.name();
    }

    @Override
    public String visitLiteral(Literal node) {
        return literal(node.value());
    }

    private static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Boolean b) {
            return b.toString().toLowerCase(Locale.ROOT);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(PrettyPrinter::literal).collect(Collectors.joining(", ", "[", "]"));
        }
        return value.toString();
    }

    @Override
    public String visitFuncCall(FuncCall node) {
        return node.function() + node.arguments().stream()
                .map(a -> a.accept(this))
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String visitAttrAccess(AttrAccess node) {
        String target = node.target() != null ? node.target().accept(this) : "<missing>";
        if (node.target() instanceof BinaryOp || node.target() instanceof UnaryOp) {
            target = "(" + target + ")";
        }
        return target + "." + node.attribute();
    }

    private String indent() {
        return INDENT.repeat(depth);
    }

    private static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"")
                .replace("\n", "\\n").replace("\t", "\\t") + "\"";
    }
}
