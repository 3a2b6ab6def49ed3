package com.plang.core.dag;

import java.util.List;

/**
 * Thrown when an execution DAG contains a cycle and so has no valid execution plan.
 */
public class CyclicDependencyException extends RuntimeException {

    private final List<String> unresolved;

    public CyclicDependencyException(List<String> unresolved) {
        super("Cyclic dependency among policies: " + unresolved);
        this.unresolved = List.copyOf(unresolved);
    }

    /** Nodes that could not be scheduled. */
    public List<String> getUnresolved() {
        return unresolved;
    }
}
