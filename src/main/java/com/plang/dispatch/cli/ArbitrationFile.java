package com.plang.dispatch.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.plang.core.arbitration.ArbitrationInput;
import com.plang.core.arbitration.BreachAction;
import com.plang.core.arbitration.ConflictStrategy;
import com.plang.core.arbitration.PolicyContribution;

import java.util.List;

/**
 * JSON input of {@code plang arbitrate}.
 * <pre>
 * {
 *   "policies": ["p1", "p2"],
 *   "precedence": [{"policy_id": "p1", "precedence": 1, "strategy": "MOST_RESTRICTIVE"}],
 *   "contributions": [{"policy_id": "p1", "token_limit": 100, "breach_action": "pause"}]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ArbitrationFile(
    @JsonProperty("policies") List<String> policies,
    @JsonProperty("precedence") List<Precedence> precedence,
    @JsonProperty("contributions") List<Contribution> contributions
) {
    ArbitrationFile {
        policies = policies == null ? List.of() : List.copyOf(policies);
        precedence = precedence == null ? List.of() : List.copyOf(precedence);
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
    }

    ArbitrationInput toInput() {
        return new ArbitrationInput(contributions.stream()
                .map(c -> new PolicyContribution(c.policyId(), c.tokenLimit(), c.costLimit(),
                        c.burnRateLimit(), c.breachAction()))
                .toList());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Precedence(
        @JsonProperty("policy_id") String policyId,
        @JsonProperty("precedence") int precedence,
        @JsonProperty("strategy") ConflictStrategy strategy
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Contribution(
        @JsonProperty("policy_id") String policyId,
        @JsonProperty("token_limit") Long tokenLimit,
        @JsonProperty("cost_limit") Double costLimit,
        @JsonProperty("burn_rate_limit") Double burnRateLimit,
        @JsonProperty("breach_action") BreachAction breachAction
    ) {}
}
