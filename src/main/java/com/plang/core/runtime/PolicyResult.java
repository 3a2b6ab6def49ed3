package com.plang.core.runtime;

import com.plang.core.grammar.ActionKind;
import com.plang.core.grammar.GovernanceCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of evaluating one IR function.
 *
 * @param policy         function name
 * @param category       governance category
 * @param passed         true if evaluation completed without error
 * @param action         most restrictive action fired, or null if no block fired
 * @param intents        intents of fired blocks, in block order
 * @param steps          steps consumed
 * @param error          error message when {@code passed} is false
 * @param budgetExceeded true if evaluation stopped because the step budget ran out
 * @param resolvedFacts  facts fetched through the resolver during this evaluation
 * @param elapsedMs      wall-clock evaluation time
 */
public record PolicyResult(
    String policy,
    GovernanceCategory category,
    boolean passed,
    ActionKind action,
    List<Intent> intents,
    long steps,
    String error,
    boolean budgetExceeded,
    Map<String, Object> resolvedFacts,
    long elapsedMs
) {
    public PolicyResult {
        intents = intents == null ? List.of() : List.copyOf(intents);
        resolvedFacts = resolvedFacts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(resolvedFacts));
    }

    public static PolicyResult failed(String policy, GovernanceCategory category, String error, long steps) {
        return new PolicyResult(policy, category, false, null, List.of(), steps, error, false, Map.of(), 0);
    }

    public boolean fired() {
        return action != null;
    }
}
