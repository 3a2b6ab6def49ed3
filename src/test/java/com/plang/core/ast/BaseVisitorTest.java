package com.plang.core.ast;

import com.plang.core.grammar.ActionKind;
import com.plang.core.grammar.GovernanceCategory;
import com.plang.core.grammar.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BaseVisitorTest {

    /** Records the simple name of every node visited. */
    static class Recorder extends BaseVisitor<Void> {
        final List<String> visited = new ArrayList<>();

        @Override
        public Void visitIdent(Ident node) {
            visited.add("Ident:" + node.name());
            return null;
        }

        @Override
        public Void visitLiteral(Literal node) {
            visited.add("Literal:" + node.value());
            return null;
        }

        @Override
        public Void visitRouteTarget(RouteTarget node) {
            visited.add("Route:" + node.targetName());
            return null;
        }
    }

    @Test
    @DisplayName("visits every leaf in source order")
    void visitsAllLeaves() {
        var program = Parser.parse("""
                policy p {
                  when a > 1 and f(b, "x") then ROUTE to q
                  rule r { when c.d then DENY }
                }
                """);
        var recorder = new Recorder();
        program.accept(recorder);
        assertEquals(List.of("Ident:a", "Literal:1", "Ident:b", "Literal:x", "Route:q", "Ident:c"),
                recorder.visited);
    }

    @Test
    @DisplayName("missing children are skipped without failing")
    void toleratesNulls() {
        var broken = new Program(List.of(
                new PolicyDecl("p", GovernanceCategory.SAFETY, List.of(
                        new ConditionBlock(null, new ActionBlock(ActionKind.DENY), null),
                        new ConditionBlock(new BinaryOp(BinaryOperator.AND, null, new Ident("x")), null, null)),
                        null),
                new RuleDecl("r", null, null, null, null)), null);
        var recorder = new Recorder();
        assertDoesNotThrow(() -> broken.accept(recorder));
        assertEquals(List.of("Ident:x"), recorder.visited);
    }
}
