package com.plang.core.grammar;

import com.plang.core.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for PLang.
 *
 * <pre>
 * program  := (import | policy | rule)*
 * policy   := 'policy' IDENT (':' CATEGORY)? '{' (priority | when | rule | use)* '}'
 * rule     := 'rule' IDENT (':' CATEGORY)? '{' (priority | when)* '}'
 * when     := 'when' expr 'then' ACTION ('to' IDENT)? STRING?
 * </pre>
 *
 * Expression precedence, loosest first: or, and, not, comparison/in, + -, * / %, unary minus.
 */
public class Parser {

    private final List<Token> tokens;
    private int current;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a complete PLang program.
     *
     * @throws ParseException on the first syntax error
     */
    public static Program parse(String source) {
        return new Parser(new Lexer(source).tokenize()).program();
    }

    /**
     * Parses a standalone condition expression, e.g. {@code risk_score > 0.8 and not trusted}.
     */
    public static Expr parseExpression(String source) {
        Parser parser = new Parser(new Lexer(source).tokenize());
        Expr expr = parser.expression();
        parser.expect(TokenType.EOF, "end of expression");
        return expr;
    }

    public Program program() {
        Position start = peek().position();
        var statements = new ArrayList<Node>();
        while (!check(TokenType.EOF)) {
            if (check(TokenType.IMPORT)) {
                statements.add(importStatement());
            } else if (check(TokenType.POLICY)) {
                statements.add(policy());
            } else if (check(TokenType.RULE)) {
                statements.add(rule(null));
            } else {
                throw error("'import', 'policy' or 'rule'");
            }
        }
        return new Program(statements, start);
    }

    private Import importStatement() {
        Token keyword = advance();
        Token path = expect(TokenType.STRING, "import path string");
        return new Import(path.text(), keyword.position());
    }

    private PolicyDecl policy() {
        Token keyword = advance();
        String name = expect(TokenType.IDENT, "policy name").text();
        GovernanceCategory category = optionalCategory();
        expect(TokenType.LBRACE, "'{'");
        var body = new ArrayList<Node>();
        while (!check(TokenType.RBRACE)) {
            if (check(TokenType.PRIORITY)) {
                body.add(priority());
            } else if (check(TokenType.WHEN)) {
                body.add(conditionBlock());
            } else if (check(TokenType.RULE)) {
                body.add(rule(name));
            } else if (check(TokenType.USE)) {
                Token use = advance();
                body.add(new RuleRef(expect(TokenType.IDENT, "rule name").text(), use.position()));
            } else {
                throw error("'priority', 'when', 'rule', 'use' or '}'");
            }
        }
        advance();
        return new PolicyDecl(name, category, body, keyword.position());
    }

    private RuleDecl rule(String parentPolicy) {
        Token keyword = advance();
        String name = expect(TokenType.IDENT, "rule name").text();
        GovernanceCategory category = optionalCategory();
        expect(TokenType.LBRACE, "'{'");
        var body = new ArrayList<Node>();
        while (!check(TokenType.RBRACE)) {
            if (check(TokenType.PRIORITY)) {
                body.add(priority());
            } else if (check(TokenType.WHEN)) {
                body.add(conditionBlock());
            } else {
                throw error("'priority', 'when' or '}'");
            }
        }
        advance();
        return new RuleDecl(name, category, parentPolicy, body, keyword.position());
    }

    private GovernanceCategory optionalCategory() {
        if (!match(TokenType.COLON)) {
            return null;
        }
        Token token = expect(TokenType.IDENT, "governance category");
        return GovernanceCategory.fromKeyword(token.text())
                .orElseThrow(() -> new ParseException(Diagnostic.syntax(token.position(),
                        "one of SAFETY, PRIVACY, OPERATIONAL, ROUTING, CUSTOM", token.describe())));
    }

    private Priority priority() {
        Token keyword = advance();
        boolean negative = match(TokenType.MINUS);
        Token value = expect(TokenType.INT, "integer priority");
        long raw = (Long) value.value();
        if (raw > Integer.MAX_VALUE) {
            throw new ParseException(Diagnostic.syntax(value.position(), "priority within int range", value.text()));
        }
        return new Priority(negative ? -(int) raw : (int) raw, keyword.position());
    }

    private ConditionBlock conditionBlock() {
        Token keyword = advance();
        Expr condition = expression();
        expect(TokenType.THEN, "'then'");
        return new ConditionBlock(condition, action(), keyword.position());
    }

    private ActionBlock action() {
        Token token = expect(TokenType.IDENT, "action (ALLOW, DENY, ESCALATE, ROUTE)");
        ActionKind kind = ActionKind.fromKeyword(token.text())
                .orElseThrow(() -> new ParseException(Diagnostic.syntax(token.position(),
                        "action (ALLOW, DENY, ESCALATE, ROUTE)", token.describe())));
        RouteTarget target = null;
        if (match(TokenType.TO)) {
            Token name = expect(TokenType.IDENT, "route target name");
            target = new RouteTarget(name.text(), name.position());
        }
        if (kind == ActionKind.ROUTE && target == null) {
            throw error("'to' with a route target");
        }
        if (kind != ActionKind.ROUTE && target != null) {
            throw new ParseException(Diagnostic.syntax(target.position(),
                    "route target only on ROUTE", "target on " + kind));
        }
        String reason = check(TokenType.STRING) ? advance().text() : null;
        return new ActionBlock(kind, target, reason, token.position());
    }

    // -- expressions --

    Expr expression() {
        return or();
    }

    private Expr or() {
        Expr left = and();
        while (check(TokenType.OR)) {
            Token op = advance();
            left = new BinaryOp(BinaryOperator.OR, left, and(), op.position());
        }
        return left;
    }

    private Expr and() {
        Expr left = not();
        while (check(TokenType.AND)) {
            Token op = advance();
            left = new BinaryOp(BinaryOperator.AND, left, not(), op.position());
        }
        return left;
    }

    private Expr not() {
        if (check(TokenType.NOT)) {
            Token op = advance();
            return new UnaryOp(UnaryOperator.NOT, not(), op.position());
        }
        return comparison();
    }

    private Expr comparison() {
        Expr left = additive();
        BinaryOperator op = comparisonOperator(peek().type());
        if (op != null) {
            Token token = advance();
            return new BinaryOp(op, left, additive(), token.position());
        }
        return left;
    }

    private static BinaryOperator comparisonOperator(TokenType type) {
        return switch (type) {
            case EQ -> BinaryOperator.EQ;
            case NEQ -> BinaryOperator.NEQ;
            case LT -> BinaryOperator.LT;
            case LTE -> BinaryOperator.LTE;
            case GT -> BinaryOperator.GT;
            case GTE -> BinaryOperator.GTE;
            case IN -> BinaryOperator.IN;
            default -> null;
        };
    }

    private Expr additive() {
        Expr left = multiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token op = advance();
            BinaryOperator operator = op.type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB;
            left = new BinaryOp(operator, left, multiplicative(), op.position());
        }
        return left;
    }

    private Expr multiplicative() {
        Expr left = unary();
        while (check(TokenType.STAR) || check(TokenType.SLASH) || check(TokenType.PERCENT)) {
            Token op = advance();
            BinaryOperator operator = switch (op.type()) {
                case STAR -> BinaryOperator.MUL;
                case SLASH -> BinaryOperator.DIV;
                default -> BinaryOperator.MOD;
            };
            left = new BinaryOp(operator, left, unary(), op.position());
        }
        return left;
    }

    private Expr unary() {
        if (check(TokenType.MINUS)) {
            Token op = advance();
            Expr operand = unary();
            // fold negative numeric literals so "-3" round-trips as a literal
            if (operand instanceof Literal literal && literal.value() instanceof Long l) {
                return new Literal(-l, op.position());
            }
            if (operand instanceof Literal literal && literal.value() instanceof Double d) {
                return new Literal(-d, op.position());
            }
            return new UnaryOp(UnaryOperator.NEGATE, operand, op.position());
        }
        return postfix();
    }

    private Expr postfix() {
        Token token = peek();
        if (token.type() == TokenType.IDENT && peekNext().type() == TokenType.LPAREN) {
            advance();
            advance();
            var args = new ArrayList<Expr>();
            if (!check(TokenType.RPAREN)) {
                do {
                    args.add(expression());
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RPAREN, "')'");
            return new FuncCall(token.text(), args, token.position());
        }
        Expr expr = primary();
        while (check(TokenType.DOT)) {
            advance();
            Token attr = expect(TokenType.IDENT, "attribute name");
            expr = new AttrAccess(expr, attr.text(), attr.position());
        }
        return expr;
    }

    private Expr primary() {
        Token token = peek();
        switch (token.type()) {
            case INT:
            case FLOAT:
            case STRING:
            case TRUE:
            case FALSE:
                advance();
                return new Literal(token.value(), token.position());
            case NULL:
                advance();
                return new Literal(null, token.position());
            case IDENT:
                advance();
                return new Ident(token.text(), token.position());
            case LPAREN:
                advance();
                Expr inner = expression();
                expect(TokenType.RPAREN, "')'");
                return inner;
            case LBRACKET:
                return listLiteral();
            default:
                throw error("an expression");
        }
    }

    private Literal listLiteral() {
        Token open = advance();
        var values = new ArrayList<Object>();
        if (!check(TokenType.RBRACKET)) {
            do {
                Expr element = unary();
                if (!(element instanceof Literal literal) || literal.value() instanceof List) {
                    throw new ParseException(Diagnostic.syntax(element.position(),
                            "a constant list element", "non-constant expression"));
                }
                values.add(literal.value());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RBRACKET, "']'");
        return new Literal(values, open.position());
    }

    // -- token helpers --

    private Token expect(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        throw error(expected);
    }

    private ParseException error(String expected) {
        Token found = peek();
        return new ParseException(Diagnostic.syntax(found.position(), expected, found.describe()));
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.EOF) {
            current++;
        }
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return current + 1 < tokens.size() ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
    }
}
