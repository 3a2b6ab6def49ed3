package com.plang.core.arbitration;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link PolicyArbitrator#arbitrate}. Limits are null when no policy
 * constrained the dimension.
 *
 * @param policyIds     ids in precedence order
 * @param precedences   precedence value of each id, same order
 * @param snapshotHash  SHA-256 hex of the canonical decision snapshot
 */
public record ArbitrationResult(
    String tenantId,
    List<String> policyIds,
    List<Integer> precedences,
    Long effectiveTokenLimit,
    Double effectiveCostLimit,
    Double effectiveBurnRateLimit,
    BreachAction effectiveBreachAction,
    int conflictsResolved,
    ConflictStrategy strategy,
    Instant arbitratedAt,
    String snapshotHash
) {
    public ArbitrationResult {
        policyIds = List.copyOf(policyIds);
        precedences = List.copyOf(precedences);
    }

    /**
     * Flat key/value form for audit sinks and the CLI.
     */
    public Map<String, Object> toRecord() {
        var record = new LinkedHashMap<String, Object>();
        record.put("tenant_id", tenantId);
        record.put("policy_ids", String.join(",", policyIds));
        record.put("precedences", precedences.stream().map(String::valueOf).reduce((a, b) -> a + "," + b).orElse(""));
        record.put(LimitDimension.TOKEN.key(), effectiveTokenLimit);
        record.put(LimitDimension.COST.key(), effectiveCostLimit);
        record.put(LimitDimension.BURN_RATE.key(), effectiveBurnRateLimit);
        record.put("breach_action", effectiveBreachAction.value());
        record.put("conflicts_resolved", conflictsResolved);
        record.put("strategy", strategy.name());
        record.put("arbitrated_at", arbitratedAt.toString());
        record.put("snapshot_hash", snapshotHash);
        return record;
    }
}
