package com.plang.core.dag;

import com.plang.core.grammar.GovernanceCategory;

import java.util.List;

/**
 * Set of policies of one phase that may run concurrently, in deterministic member order.
 *
 * @param index    position in the plan
 * @param phase    phase shared by all members (phase of the first member for a fallback stage)
 * @param policies member function names
 * @param fallback true for the best-effort stage emitted when a cycle was tolerated
 */
public record ExecutionStage(int index, GovernanceCategory phase, List<String> policies, boolean fallback) {

    public ExecutionStage {
        policies = List.copyOf(policies);
    }

    public boolean isParallel() {
        return policies.size() > 1;
    }

    public int size() {
        return policies.size();
    }
}
