package com.plang.core.runtime;

import com.plang.core.grammar.ActionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationContextTest {

    @Test
    @DisplayName("defaults: generated id, default step budget, fresh token")
    void defaults() {
        var context = EvaluationContext.builder().build();
        assertNotNull(context.executionId());
        assertEquals(EvaluationContext.DEFAULT_MAX_STEPS, context.maxSteps());
        assertFalse(context.token().isCancelled());
        assertTrue(context.variables().isEmpty());
    }

    @Test
    @DisplayName("rejects oversize variable bags, the reserved name and negative budgets")
    void validation() {
        var vars = new HashMap<String, Object>();
        for (int i = 0; i < 3; i++) vars.put("v" + i, i);
        assertThrows(IllegalArgumentException.class,
                () -> EvaluationContext.builder().variables(vars).maxVariables(2).build());
        assertThrows(IllegalArgumentException.class,
                () -> EvaluationContext.builder().variable("policies", 1).build());
        assertThrows(IllegalArgumentException.class,
                () -> EvaluationContext.builder().maxSteps(-1).build());
    }

    @Test
    @DisplayName("copy shares variables and token but isolates facts and outcomes")
    void copyIsolation() {
        var context = EvaluationContext.builder().variable("x", 1L).facts(Map.of("f", "a")).build();
        context.recordOutcome("first", ActionKind.ALLOW, true);

        var copy = context.copy();
        copy.cacheFact("g", "b");
        copy.recordOutcome("second", null, false);

        assertSame(context.token(), copy.token());
        assertEquals(1L, copy.variable("x"));
        assertTrue(copy.hasFact("f"));
        assertFalse(context.hasFact("g"));
        assertFalse(context.policyOutcomes().containsKey("second"));
        assertEquals(Map.of("g", "b"), copy.resolvedFacts());
        assertTrue(context.resolvedFacts().isEmpty());

        context.mergeFacts(copy.resolvedFacts());
        assertEquals("b", context.fact("g"));
    }

    @Test
    @DisplayName("outcome records action name and passed flag")
    void outcomeShape() {
        var context = EvaluationContext.builder().build();
        context.recordOutcome("p", ActionKind.ROUTE, true);
        context.recordOutcome("q", null, false);
        assertEquals("ROUTE", context.policyOutcomes().get("p").get("action"));
        assertEquals(true, context.policyOutcomes().get("p").get("passed"));
        assertNull(context.policyOutcomes().get("q").get("action"));
    }
}
