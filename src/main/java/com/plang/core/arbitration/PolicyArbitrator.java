package com.plang.core.arbitration;

import com.plang.config.PlangProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Deterministic arbitrator for limits and breach actions proposed by several policies
 * of one tenant.
 *
 * <p>Policies are ranked by stored precedence (lower first, ties keep the caller's
 * order). The strategy comes from the highest-ranked policy that declares one. Each
 * limit dimension and the breach action are then resolved independently: a single
 * contributor wins outright; several are resolved by the strategy. The result carries
 * a hash of the decision so identical decisions can be recognised across runs.
 */
@Service
public class PolicyArbitrator {

    private static final Logger log = LoggerFactory.getLogger(PolicyArbitrator.class);

    private final PrecedenceStore store;
    private final int defaultPrecedence;
    private final SnapshotHasher hasher;
    private final Clock clock;

    @Autowired
    public PolicyArbitrator(PrecedenceStore store, PlangProperties properties, SnapshotHasher hasher, Clock clock) {
        this(store, properties.getDefaultPrecedence(), hasher, clock);
    }

    public PolicyArbitrator(PrecedenceStore store, int defaultPrecedence, SnapshotHasher hasher, Clock clock) {
        this.store = store;
        this.defaultPrecedence = defaultPrecedence;
        this.hasher = hasher;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if {@code policyIds} is empty
     */
    public ArbitrationResult arbitrate(List<String> policyIds, String tenantId, ArbitrationInput input) {
        if (policyIds == null || policyIds.isEmpty()) {
            throw new IllegalArgumentException("At least one policy id is required");
        }

        List<Ranked> ranked = rank(new ArrayList<>(new LinkedHashSet<>(policyIds)), tenantId);
        ConflictStrategy strategy = ranked.stream()
                .map(Ranked::strategy)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(ConflictStrategy.MOST_RESTRICTIVE);

        List<PolicyContribution> contributions = orderContributions(ranked, input);

        int conflicts = 0;
        var limits = new LinkedHashMap<LimitDimension, Number>();
        for (LimitDimension dimension : LimitDimension.values()) {
            List<Number> values = new ArrayList<>();
            for (PolicyContribution c : contributions) {
                if (c.limit(dimension) != null) {
                    values.add(c.limit(dimension));
                }
            }
            if (values.size() > 1) {
                conflicts += values.size() - 1;
                log.debug("Resolving {} conflicting {} values with {}", values.size(), dimension, strategy);
            }
            limits.put(dimension, resolveLimit(values, strategy));
        }

        List<BreachAction> actions = new ArrayList<>();
        for (PolicyContribution c : contributions) {
            if (c.breachAction() != null) {
                actions.add(c.breachAction());
            }
        }
        if (actions.size() > 1) {
            conflicts += actions.size() - 1;
        }
        BreachAction action = resolveAction(actions, strategy);

        Long tokenLimit = limits.get(LimitDimension.TOKEN) != null ? limits.get(LimitDimension.TOKEN).longValue() : null;
        Double costLimit = limits.get(LimitDimension.COST) != null ? limits.get(LimitDimension.COST).doubleValue() : null;
        Double burnRate = limits.get(LimitDimension.BURN_RATE) != null
                ? limits.get(LimitDimension.BURN_RATE).doubleValue() : null;

        var snapshot = new TreeMap<String, Object>();
        snapshot.put("policy_ids", ranked.stream().map(Ranked::policyId).sorted().toList());
        snapshot.put(LimitDimension.TOKEN.key(), tokenLimit);
        snapshot.put(LimitDimension.COST.key(), costLimit);
        snapshot.put(LimitDimension.BURN_RATE.key(), burnRate);
        snapshot.put("breach_action", action.value());
        snapshot.put("strategy", strategy.name());

        var result = new ArbitrationResult(
                tenantId,
                ranked.stream().map(Ranked::policyId).toList(),
                ranked.stream().map(Ranked::precedence).toList(),
                tokenLimit, costLimit, burnRate, action, conflicts, strategy,
                clock.instant(), hasher.hash(snapshot));

        log.info("Arbitrated {} policies for tenant {}: strategy={}, action={}, conflicts={}",
                ranked.size(), tenantId, strategy, action.value(), conflicts);
        return result;
    }

    private List<Ranked> rank(List<String> policyIds, String tenantId) {
        var ranked = new ArrayList<Ranked>(policyIds.size());
        for (String id : policyIds) {
            Optional<PolicyPrecedence> stored = store.find(id, tenantId);
            if (stored.isEmpty()) {
                log.debug("No precedence stored for {} (tenant {}); using {}", id, tenantId, defaultPrecedence);
            }
            ranked.add(new Ranked(id,
                    stored.map(PolicyPrecedence::precedence).orElse(defaultPrecedence),
                    stored.map(PolicyPrecedence::strategy).orElse(null)));
        }
        // List.sort is stable, so equal precedence keeps the caller's order
        ranked.sort(Comparator.comparingInt(Ranked::precedence));
        return ranked;
    }

    private List<PolicyContribution> orderContributions(List<Ranked> ranked, ArbitrationInput input) {
        Map<String, PolicyContribution> byPolicy = new LinkedHashMap<>();
        for (PolicyContribution c : input.contributions()) {
            boolean known = ranked.stream().anyMatch(r -> r.policyId().equals(c.policyId()));
            if (!known) {
                log.warn("Ignoring contribution from {}: not among the arbitrated policies", c.policyId());
            } else if (byPolicy.putIfAbsent(c.policyId(), c) != null) {
                log.warn("Ignoring duplicate contribution from {}", c.policyId());
            }
        }
        var ordered = new ArrayList<PolicyContribution>();
        for (Ranked r : ranked) {
            PolicyContribution c = byPolicy.get(r.policyId());
            if (c != null) {
                ordered.add(c);
            }
        }
        return ordered;
    }

    // values arrive in precedence order
    private static Number resolveLimit(List<Number> values, ConflictStrategy strategy) {
        if (values.isEmpty()) {
            return null;
        }
        if (values.size() == 1 || strategy == ConflictStrategy.EXPLICIT_PRIORITY) {
            return values.get(0);
        }
        Number min = values.get(0);
        for (Number v : values) {
            if (Double.compare(v.doubleValue(), min.doubleValue()) < 0) {
                min = v;
            }
        }
        return min;
    }

    private static BreachAction resolveAction(List<BreachAction> actions, ConflictStrategy strategy) {
        if (actions.isEmpty()) {
            return BreachAction.DEFAULT;
        }
        if (actions.size() == 1 || strategy == ConflictStrategy.EXPLICIT_PRIORITY) {
            return actions.get(0);
        }
        BreachAction worst = null;
        for (BreachAction a : actions) {
            worst = BreachAction.mostSevere(worst, a);
        }
        return worst;
    }

    private record Ranked(String policyId, int precedence, ConflictStrategy strategy) {}
}
