package com.plang.core.grammar;

import com.plang.core.ast.ActionBlock;
import com.plang.core.ast.AttrAccess;
import com.plang.core.ast.BinaryOp;
import com.plang.core.ast.BinaryOperator;
import com.plang.core.ast.ConditionBlock;
import com.plang.core.ast.Expr;
import com.plang.core.ast.FuncCall;
import com.plang.core.ast.Ident;
import com.plang.core.ast.Import;
import com.plang.core.ast.Literal;
import com.plang.core.ast.PolicyDecl;
import com.plang.core.ast.Priority;
import com.plang.core.ast.RuleDecl;
import com.plang.core.ast.RuleRef;
import com.plang.core.ast.UnaryOp;
import com.plang.core.ast.UnaryOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    @Nested
    @DisplayName("declarations")
    class Declarations {

        @Test
        @DisplayName("policy with category, priority, condition, nested rule and use")
        void fullPolicy() {
            var program = Parser.parse("""
                    import "common.plang"
                    policy pii_guard : privacy {
                      priority 10
                      when contains(text, "ssn") then DENY "pii"
                      rule redact {
                        when len(text) > 100 then ESCALATE
                      }
                      use shared
                    }
                    rule shared : safety {
                      when true then ALLOW
                    }
                    """);

            assertEquals(3, program.statements().size());
            assertEquals("common.plang", assertInstanceOf(Import.class, program.statements().get(0)).path());

            var policy = assertInstanceOf(PolicyDecl.class, program.statements().get(1));
            assertEquals("pii_guard", policy.name());
            assertEquals(GovernanceCategory.PRIVACY, policy.category());
            assertEquals(4, policy.body().size());
            assertEquals(10, assertInstanceOf(Priority.class, policy.body().get(0)).value());

            var block = assertInstanceOf(ConditionBlock.class, policy.body().get(1));
            assertEquals(ActionKind.DENY, block.action().kind());
            assertEquals("pii", block.action().reason());

            var nested = assertInstanceOf(RuleDecl.class, policy.body().get(2));
            assertEquals("redact", nested.name());
            assertEquals("pii_guard", nested.parentPolicy());
            assertNull(nested.category());

            assertEquals("shared", assertInstanceOf(RuleRef.class, policy.body().get(3)).ruleName());

            var rule = assertInstanceOf(RuleDecl.class, program.statements().get(2));
            assertNull(rule.parentPolicy());
            assertEquals(GovernanceCategory.SAFETY, rule.category());
        }

        @Test
        @DisplayName("ROUTE carries its target")
        void routeTarget() {
            var program = Parser.parse("policy p { when x then route to review }");
            var policy = (PolicyDecl) program.statements().get(0);
            ActionBlock action = ((ConditionBlock) policy.body().get(0)).action();
            assertEquals(ActionKind.ROUTE, action.kind());
            assertEquals("review", action.routeTarget().targetName());
        }

        @Test
        @DisplayName("negative priority is accepted")
        void negativePriority() {
            var policy = (PolicyDecl) Parser.parse("policy p { priority -5 }").statements().get(0);
            assertEquals(-5, ((Priority) policy.body().get(0)).value());
        }

        @Test
        @DisplayName("empty source is an empty program")
        void emptySource() {
            assertTrue(Parser.parse("  # nothing here\n").statements().isEmpty());
        }
    }

    @Nested
    @DisplayName("expressions")
    class Expressions {

        @Test
        @DisplayName("and binds tighter than or")
        void andOverOr() {
            var expr = assertInstanceOf(BinaryOp.class, Parser.parseExpression("a or b and c"));
            assertEquals(BinaryOperator.OR, expr.operator());
            assertEquals(BinaryOperator.AND, assertInstanceOf(BinaryOp.class, expr.right()).operator());
        }

        @Test
        @DisplayName("multiplication binds tighter than addition, which binds tighter than comparison")
        void arithmeticPrecedence() {
            var cmp = assertInstanceOf(BinaryOp.class, Parser.parseExpression("1 + 2 * 3 > 6"));
            assertEquals(BinaryOperator.GT, cmp.operator());
            var add = assertInstanceOf(BinaryOp.class, cmp.left());
            assertEquals(BinaryOperator.ADD, add.operator());
            assertEquals(BinaryOperator.MUL, assertInstanceOf(BinaryOp.class, add.right()).operator());
        }

        @Test
        @DisplayName("subtraction is left-associative")
        void leftAssociative() {
            var expr = assertInstanceOf(BinaryOp.class, Parser.parseExpression("10 - 3 - 2"));
            assertEquals(BinaryOperator.SUB, assertInstanceOf(BinaryOp.class, expr.left()).operator());
            assertEquals(2L, assertInstanceOf(Literal.class, expr.right()).value());
        }

        @Test
        @DisplayName("not applies to a whole comparison")
        void notOverComparison() {
            var expr = assertInstanceOf(UnaryOp.class, Parser.parseExpression("not a == b"));
            assertEquals(UnaryOperator.NOT, expr.operator());
            assertInstanceOf(BinaryOp.class, expr.operand());
        }

        @Test
        @DisplayName("negative numeric literals are folded")
        void negativeLiteral() {
            assertEquals(-3L, assertInstanceOf(Literal.class, Parser.parseExpression("-3")).value());
            assertInstanceOf(UnaryOp.class, Parser.parseExpression("-x"));
        }

        @Test
        @DisplayName("attribute chains and function calls")
        void postfix() {
            var attr = assertInstanceOf(AttrAccess.class, Parser.parseExpression("request.user.role"));
            assertEquals("request.user.role", attr.dottedPath().orElseThrow());

            var call = assertInstanceOf(FuncCall.class, Parser.parseExpression("max(a, 2, b.c)"));
            assertEquals("max", call.function());
            assertEquals(3, call.arguments().size());
        }

        @Test
        @DisplayName("list literals hold constants, including null")
        void listLiteral() {
            Expr expr = Parser.parseExpression("role in [\"admin\", -1, null, true]");
            var in = assertInstanceOf(BinaryOp.class, expr);
            assertEquals(BinaryOperator.IN, in.operator());
            assertInstanceOf(Ident.class, in.left());
            var list = assertInstanceOf(Literal.class, in.right());
            assertEquals(Arrays.asList("admin", -1L, null, true), list.value());
        }

        @Test
        @DisplayName("non-constant list elements are rejected")
        void nonConstantList() {
            assertThrows(ParseException.class, () -> Parser.parseExpression("[a, 1]"));
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("ROUTE without 'to' is a syntax error")
        void routeWithoutTarget() {
            var ex = assertThrows(ParseException.class,
                    () -> Parser.parse("policy p { when x then ROUTE }"));
            assertEquals("'to' with a route target", ex.getDiagnostic().expected());
        }

        @Test
        @DisplayName("target on a non-ROUTE action is a syntax error")
        void targetOnDeny() {
            assertThrows(ParseException.class, () -> Parser.parse("policy p { when x then DENY to q }"));
        }

        @Test
        @DisplayName("unknown category is reported with its position")
        void unknownCategory() {
            var ex = assertThrows(ParseException.class, () -> Parser.parse("policy p : finance { }"));
            assertEquals(1, ex.getDiagnostic().position().line());
            assertEquals(12, ex.getDiagnostic().position().column());
            assertEquals("identifier 'finance'", ex.getDiagnostic().found());
        }

        @Test
        @DisplayName("unknown action is rejected")
        void unknownAction() {
            assertThrows(ParseException.class, () -> Parser.parse("policy p { when x then BLOCK }"));
        }

        @Test
        @DisplayName("missing closing brace reports end of input")
        void missingBrace() {
            var ex = assertThrows(ParseException.class, () -> Parser.parse("policy p { when x then DENY"));
            assertEquals("end of input", ex.getDiagnostic().found());
        }

        @Test
        @DisplayName("rules cannot nest rules")
        void nestedRuleInRule() {
            assertThrows(ParseException.class, () -> Parser.parse("rule a { rule b { } }"));
        }

        @Test
        @DisplayName("trailing tokens after an expression are rejected")
        void trailingTokens() {
            var ex = assertThrows(ParseException.class, () -> Parser.parseExpression("a b"));
            assertEquals("end of expression", ex.getDiagnostic().expected());
        }

        @Test
        @DisplayName("comparisons do not chain")
        void comparisonsDoNotChain() {
            assertThrows(ParseException.class, () -> Parser.parseExpression("1 < 2 < 3"));
        }
    }

    @Test
    @DisplayName("literal values keep their types")
    void literalTypes() {
        assertEquals(List.of(1L, 2.5, "s", true, false),
                List.of(
                        ((Literal) Parser.parseExpression("1")).value(),
                        ((Literal) Parser.parseExpression("2.5")).value(),
                        ((Literal) Parser.parseExpression("\"s\"")).value(),
                        ((Literal) Parser.parseExpression("true")).value(),
                        ((Literal) Parser.parseExpression("FALSE")).value()));
        assertNull(((Literal) Parser.parseExpression("null")).value());
    }
}
