package com.plang.core.dag;

/**
 * Behaviour of {@link DagSorter} when the dependency graph cannot be fully ordered.
 * <p>
 * FAIL: raise {@link CyclicDependencyException} at plan-build time.
 * FALLBACK: emit the remaining nodes as one final best-effort stage and log the anomaly.
 */
public enum CycleHandling {
    FAIL,
    FALLBACK
}
