package com.plang.core.arbitration;

/**
 * Numeric limits a policy can contribute.
 */
public enum LimitDimension {
    TOKEN("token_limit"),
    COST("cost_limit"),
    BURN_RATE("burn_rate_limit");

    private final String key;

    LimitDimension(String key) {
        this.key = key;
    }

    /** Key used in records and the snapshot hash. */
    public String key() {
        return key;
    }
}
