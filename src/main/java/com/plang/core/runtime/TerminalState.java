package com.plang.core.runtime;

/**
 * How a run ended.
 */
public enum TerminalState {
    /** Every stage ran. */
    COMPLETED,
    /** A stage's net action was DENY; later stages were skipped. */
    DENIED,
    /** The global step budget ran out. */
    BUDGET_EXHAUSTED,
    /** The run was interrupted. */
    CANCELLED
}
