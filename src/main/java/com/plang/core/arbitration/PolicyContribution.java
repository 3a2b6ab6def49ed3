package com.plang.core.arbitration;

/**
 * Limits and breach action one policy proposes. Any field may be null, meaning the
 * policy does not constrain that dimension.
 */
public record PolicyContribution(
    String policyId,
    Long tokenLimit,
    Double costLimit,
    Double burnRateLimit,
    BreachAction breachAction
) {
    public static PolicyContribution tokens(String policyId, long tokenLimit, BreachAction action) {
        return new PolicyContribution(policyId, tokenLimit, null, null, action);
    }

    /** The contributed value for a dimension, or null. */
    public Number limit(LimitDimension dimension) {
        return switch (dimension) {
            case TOKEN -> tokenLimit;
            case COST -> costLimit;
            case BURN_RATE -> burnRateLimit;
        };
    }
}
