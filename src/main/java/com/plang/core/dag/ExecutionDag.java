package com.plang.core.dag;

import com.plang.core.grammar.GovernanceCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Index-based dependency graph over IR functions. Nodes are stored densely by id and
 * looked up by name through a single table; edges reference nodes by id, so the graph
 * holds no object cycles.
 */
public final class ExecutionDag {

    private final List<DagNode> nodes = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();
    private final List<DagEdge> edges = new ArrayList<>();

    /**
     * @return id of the new node
     * @throws IllegalArgumentException if the name is already present
     */
    public int addNode(String name, GovernanceCategory phase, int priority) {
        if (index.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate DAG node: " + name);
        }
        int id = nodes.size();
        nodes.add(new DagNode(id, name, GovernanceCategory.orDefault(phase), priority));
        index.put(name, id);
        return id;
    }

    /**
     * Wires {@code from} to depend on {@code to}. Self edges and duplicates are ignored.
     *
     * @return true if a new edge was added
     */
    public boolean addEdge(String from, String to, DagEdge.EdgeKind kind) {
        Integer fromId = index.get(from);
        Integer toId = index.get(to);
        if (fromId == null || toId == null) {
            throw new IllegalArgumentException("Unknown DAG node in edge " + from + " -> " + to);
        }
        if (fromId.equals(toId)) {
            return false;
        }
        if (!nodes.get(fromId).addDependency(toId)) {
            return false;
        }
        nodes.get(toId).addDependent(fromId);
        edges.add(new DagEdge(from, to, kind));
        return true;
    }

    public Optional<DagNode> node(String name) {
        Integer id = index.get(name);
        return id == null ? Optional.empty() : Optional.of(nodes.get(id));
    }

    public DagNode node(int id) {
        return nodes.get(id);
    }

    public boolean contains(String name) {
        return index.containsKey(name);
    }

    public List<DagNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<DagEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<String> dependenciesOf(String name) {
        return node(name)
                .map(n -> n.dependencies().stream().map(id -> nodes.get(id).name()).sorted().toList())
                .orElse(List.of());
    }

    public int size() {
        return nodes.size();
    }
}
