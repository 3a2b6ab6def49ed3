package com.plang.core.arbitration;

/**
 * How conflicting limits and breach actions from several policies are resolved.
 */
public enum ConflictStrategy {
    /** Smallest limit and most severe breach action win. */
    MOST_RESTRICTIVE,
    /** The highest-precedence contributor wins each dimension. */
    EXPLICIT_PRIORITY,
    /** Resolves like MOST_RESTRICTIVE; marks the tenant as failing closed. */
    FAIL_CLOSED
}
