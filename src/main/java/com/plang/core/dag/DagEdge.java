package com.plang.core.dag;

/**
 * Dependency edge: {@code from} depends on {@code to}, so {@code to} is scheduled first.
 */
public record DagEdge(String from, String to, EdgeKind kind) {

    public enum EdgeKind {
        PHASE,
        ROUTE
    }
}
