package com.plang.core.runtime;

import com.plang.core.grammar.ActionKind;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Inputs to one execution: caller variables, cached facts, and the outcomes of
 * policies already executed. Outcomes are readable from expressions through the
 * {@code policies} identifier, e.g. {@code policies.pii_filter.action == "DENY"}.
 *
 * <p>A context is not thread-safe. The executor gives every concurrently evaluated
 * policy its own {@link #copy()} and merges results back on a single thread.
 */
public final class EvaluationContext {

    public static final String POLICIES = "policies";
    public static final long DEFAULT_MAX_STEPS = 10_000;
    public static final int DEFAULT_MAX_VARIABLES = 1024;

    private final String executionId;
    private final String tenantId;
    private final Map<String, Object> variables;
    private final long maxSteps;
    private final Map<String, Object> facts;
    private final Map<String, Object> resolvedFacts = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> outcomes;
    private final CancellationToken token;

    private EvaluationContext(String executionId, String tenantId, Map<String, Object> variables, long maxSteps,
                              Map<String, Object> facts, Map<String, Map<String, Object>> outcomes,
                              CancellationToken token) {
        this.executionId = executionId;
        this.tenantId = tenantId;
        this.variables = variables;
        this.maxSteps = maxSteps;
        this.facts = facts;
        this.outcomes = outcomes;
        this.token = token;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String executionId() {
        return executionId;
    }

    public String tenantId() {
        return tenantId;
    }

    public long maxSteps() {
        return maxSteps;
    }

    public CancellationToken token() {
        return token;
    }

    public Map<String, Object> variables() {
        return variables;
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public Object variable(String name) {
        return variables.get(name);
    }

    public boolean hasFact(String key) {
        return facts.containsKey(key);
    }

    public Object fact(String key) {
        return facts.get(key);
    }

    /**
     * Caches a fact fetched from the {@link FactResolver} and records it as newly
     * resolved by this context.
     */
    public void cacheFact(String key, Object value) {
        facts.put(key, value);
        resolvedFacts.put(key, value);
    }

    /** Facts resolved through this context since it was created or copied. */
    public Map<String, Object> resolvedFacts() {
        return Collections.unmodifiableMap(resolvedFacts);
    }

    public Map<String, Map<String, Object>> policyOutcomes() {
        return Collections.unmodifiableMap(outcomes);
    }

    /**
     * Records a policy's outcome so later stages can read it.
     *
     * @param action emitted action, or null if nothing fired
     */
    public void recordOutcome(String policy, ActionKind action, boolean passed) {
        var outcome = new LinkedHashMap<String, Object>();
        outcome.put("action", action != null ? action.name() : null);
        outcome.put("passed", passed);
        outcomes.put(policy, Collections.unmodifiableMap(outcome));
    }

    /**
     * Merges facts resolved by another context into this one's cache.
     */
    public void mergeFacts(Map<String, Object> resolved) {
        facts.putAll(resolved);
    }

    /**
     * Isolated copy for one policy evaluation: same variables and cancellation token,
     * a snapshot of facts and outcomes, and an empty resolved-facts record.
     */
    public EvaluationContext copy() {
        return new EvaluationContext(executionId, tenantId, variables, maxSteps,
                new HashMap<>(facts), new LinkedHashMap<>(outcomes), token);
    }

    public static final class Builder {
        private String executionId;
        private String tenantId;
        private Map<String, Object> variables = Map.of();
        private Map<String, Object> facts = Map.of();
        private long maxSteps = DEFAULT_MAX_STEPS;
        private int maxVariables = DEFAULT_MAX_VARIABLES;
        private CancellationToken token;

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder variables(Map<String, ?> variables) {
            this.variables = variables == null ? Map.of() : new LinkedHashMap<>(variables);
            return this;
        }

        public Builder variable(String name, Object value) {
            var copy = new LinkedHashMap<String, Object>(variables);
            copy.put(name, value);
            this.variables = copy;
            return this;
        }

        public Builder facts(Map<String, ?> facts) {
            this.facts = facts == null ? Map.of() : new HashMap<>(facts);
            return this;
        }

        public Builder maxSteps(long maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder maxVariables(int maxVariables) {
            this.maxVariables = maxVariables;
            return this;
        }

        public Builder token(CancellationToken token) {
            this.token = token;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the variable bag is larger than allowed,
         *                                  a variable is named {@code policies}, or max steps is negative
         */
        public EvaluationContext build() {
            if (variables.size() > maxVariables) {
                throw new IllegalArgumentException(
                        "Too many variables: " + variables.size() + " (max " + maxVariables + ")");
            }
            if (variables.containsKey(POLICIES)) {
                throw new IllegalArgumentException("'" + POLICIES + "' is reserved for policy outcomes");
            }
            if (maxSteps < 0) {
                throw new IllegalArgumentException("maxSteps must be >= 0");
            }
            return new EvaluationContext(
                    executionId != null ? executionId : UUID.randomUUID().toString(),
                    tenantId,
                    Collections.unmodifiableMap(new LinkedHashMap<>(variables)),
                    maxSteps,
                    new HashMap<>(facts),
                    new LinkedHashMap<>(),
                    Objects.requireNonNullElseGet(token, CancellationToken::new));
        }
    }
}
