package com.plang.core.runtime;

import com.plang.core.grammar.ActionKind;
import com.plang.core.grammar.GovernanceCategory;

import java.util.List;

/**
 * Outcome of one executed stage. Results are in plan member order.
 *
 * @param netAction most restrictive action across members, or null if none fired
 * @param steps     max steps consumed by any member
 */
public record StageResult(
    int index,
    GovernanceCategory phase,
    List<PolicyResult> results,
    ActionKind netAction,
    long steps
) {
    public StageResult {
        results = List.copyOf(results);
    }

    public List<String> policies() {
        return results.stream().map(PolicyResult::policy).toList();
    }

    public boolean budgetExceeded() {
        return results.stream().anyMatch(PolicyResult::budgetExceeded);
    }
}
