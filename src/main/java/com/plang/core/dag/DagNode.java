package com.plang.core.dag;

import com.plang.core.grammar.GovernanceCategory;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Node of an {@link ExecutionDag}, addressed by a dense integer id. Dependency and
 * dependent sets hold ids of other nodes of the same graph.
 */
public final class DagNode {

    private final int id;
    private final String name;
    private final GovernanceCategory phase;
    private final int priority;
    private final TreeSet<Integer> dependencies = new TreeSet<>();
    private final TreeSet<Integer> dependents = new TreeSet<>();

    DagNode(int id, String name, GovernanceCategory phase, int priority) {
        this.id = id;
        this.name = name;
        this.phase = phase;
        this.priority = priority;
    }

    public int id() { return id; }

    public String name() { return name; }

    public GovernanceCategory phase() { return phase; }

    public int priority() { return priority; }

    public Set<Integer> dependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public Set<Integer> dependents() {
        return Collections.unmodifiableSet(dependents);
    }

    boolean addDependency(int otherId) {
        return dependencies.add(otherId);
    }

    void addDependent(int otherId) {
        dependents.add(otherId);
    }

    @Override
    public String toString() {
        return name + "[" + phase + ", priority=" + priority + "]";
    }
}
