package com.plang.core.runtime;

import com.plang.core.grammar.ActionKind;
import com.plang.core.grammar.GovernanceCategory;
import com.plang.core.grammar.Parser;
import com.plang.core.ir.IRFunction;
import com.plang.core.ir.IrLowering;
import com.plang.core.visitor.RuleExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PolicyEvaluatorTest {

    private final PolicyEvaluator evaluator = new PolicyEvaluator(FactResolver.NONE);

    private static IRFunction function(String source, String name) {
        return new IrLowering().lower(RuleExtractor.extract(Parser.parse(source)), "m")
                .function(name).orElseThrow();
    }

    private static EvaluationContext context(Map<String, ?> vars) {
        return EvaluationContext.builder().variables(vars).build();
    }

    @Test
    @DisplayName("every firing block emits an intent, action is the most restrictive")
    void allFiringBlocks() {
        var fn = function("""
                policy content : safety {
                  when score > 0.5 then ROUTE to review "borderline"
                  when score > 0.8 then ESCALATE
                  when score > 0.95 then DENY
                }
                """, "content");

        PolicyResult result = evaluator.evaluate(fn, context(Map.of("score", 0.9)), 1_000);

        assertTrue(result.passed());
        assertEquals(ActionKind.ESCALATE, result.action());
        assertEquals(GovernanceCategory.SAFETY, result.category());
        assertEquals(List.of("content#0", "content#1"),
                result.intents().stream().map(Intent::block).toList());
        Intent route = result.intents().get(0);
        assertEquals("review", route.target());
        assertEquals("borderline", route.reason());
        assertTrue(result.steps() > 0);
    }

    @Test
    @DisplayName("no block firing passes with a null action")
    void nothingFires() {
        var fn = function("policy p { when false then DENY }", "p");
        PolicyResult result = evaluator.evaluate(fn, context(Map.of()), 100);
        assertTrue(result.passed());
        assertFalse(result.fired());
        assertTrue(result.intents().isEmpty());
    }

    @Test
    @DisplayName("runtime errors fail the policy with the error message")
    void runtimeError() {
        var fn = function("policy p { when 1 / zero == 1 then DENY }", "p");
        PolicyResult result = evaluator.evaluate(fn, context(Map.of("zero", 0L)), 100);
        assertFalse(result.passed());
        assertNull(result.action());
        assertEquals("Division by zero", result.error());
        assertFalse(result.budgetExceeded());
    }

    @Test
    @DisplayName("budget exhaustion keeps intents fired so far")
    void budgetExhaustion() {
        var fn = function("""
                policy p {
                  when true then ROUTE to a
                  when 1 + 2 + 3 + 4 > 0 then DENY
                }
                """, "p");
        PolicyResult result = evaluator.evaluate(fn, context(Map.of()), 4);
        assertFalse(result.passed());
        assertTrue(result.budgetExceeded());
        assertEquals(ActionKind.ROUTE, result.action());
        assertEquals(1, result.intents().size());
        assertEquals(4, result.steps());
    }

    @Test
    @DisplayName("cancellation propagates")
    void cancellation() {
        var context = context(Map.of());
        context.token().cancel();
        var fn = function("policy p { when true then ALLOW }", "p");
        assertThrows(EvaluationCancelledException.class, () -> evaluator.evaluate(fn, context, 100));
    }

    @Test
    @DisplayName("facts resolved during evaluation are reported")
    void resolvedFacts() {
        var withResolver = new PolicyEvaluator((key, ctx) -> Optional.of(7L));
        var fn = function("policy p { when usage > 5 then ESCALATE }", "p");
        PolicyResult result = withResolver.evaluate(fn, context(Map.of()), 100);
        assertEquals(Map.of("usage", 7L), result.resolvedFacts());
        assertEquals(ActionKind.ESCALATE, result.action());
    }
}
