package com.plang.core.dag;

import com.plang.config.PlangProperties;
import com.plang.core.grammar.GovernanceCategory;
import com.plang.core.ir.IRFunction;
import com.plang.core.ir.IRModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the dependency DAG of an {@link IRModule} and orders it into stages.
 *
 * <p>Each function depends on every function of an earlier governance phase, and a
 * function that routes to another depends on its target. Stages are computed by
 * repeatedly taking the ready frontier (all dependencies scheduled), sorting it by
 * phase, priority (lower value first) and name, and peeling off the leading run of
 * one phase. Members of a stage never depend on each other.
 *
 * <p>The sorter holds no per-module state; the same input always yields the same plan.
 */
@Service
public class DagSorter {

    private static final Logger log = LoggerFactory.getLogger(DagSorter.class);

    static final Comparator<DagNode> READY_ORDER = Comparator
            .comparingInt((DagNode n) -> n.phase().phase())
            .thenComparingInt(DagNode::priority)
            .thenComparing(DagNode::name);

    private final CycleHandling cycleHandling;

    @Autowired
    public DagSorter(PlangProperties properties) {
        this(properties.getCycleHandling());
    }

    public DagSorter(CycleHandling cycleHandling) {
        this.cycleHandling = cycleHandling != null ? cycleHandling : CycleHandling.FAIL;
    }

    public CycleHandling cycleHandling() {
        return cycleHandling;
    }

    public ExecutionDag build(IRModule module) {
        var dag = new ExecutionDag();
        for (IRFunction fn : module.functions()) {
            dag.addNode(fn.name(), fn.governance().category(), fn.governance().priority());
        }

        int phaseEdges = 0;
        for (DagNode later : dag.nodes()) {
            for (DagNode earlier : dag.nodes()) {
                if (earlier.phase().precedes(later.phase())
                        && dag.addEdge(later.name(), earlier.name(), DagEdge.EdgeKind.PHASE)) {
                    phaseEdges++;
                }
            }
        }

        int routeEdges = 0;
        for (IRFunction fn : module.functions()) {
            for (String target : fn.routeTargets()) {
                if (!dag.contains(target)) {
                    log.debug("Route target '{}' of {} is not in module {}; no edge", target, fn.name(), module.name());
                    continue;
                }
                if (dag.addEdge(fn.name(), target, DagEdge.EdgeKind.ROUTE)) {
                    routeEdges++;
                }
            }
        }

        log.debug("Built DAG for module {}: {} nodes, {} phase edges, {} route edges",
                module.name(), dag.size(), phaseEdges, routeEdges);
        return dag;
    }

    /**
     * @throws CyclicDependencyException if the graph has a cycle and cycle handling is FAIL
     */
    public ExecutionPlan sort(ExecutionDag dag) {
        int n = dag.size();
        boolean[] visited = new boolean[n];
        int remaining = n;
        var stages = new ArrayList<ExecutionStage>();

        while (remaining > 0) {
            var ready = new ArrayList<DagNode>();
            for (DagNode node : dag.nodes()) {
                if (!visited[node.id()] && allVisited(node, visited)) {
                    ready.add(node);
                }
            }

            if (ready.isEmpty()) {
                var stuck = new ArrayList<DagNode>();
                for (DagNode node : dag.nodes()) {
                    if (!visited[node.id()]) stuck.add(node);
                }
                stuck.sort(READY_ORDER);
                List<String> names = stuck.stream().map(DagNode::name).toList();
                if (cycleHandling == CycleHandling.FAIL) {
                    throw new CyclicDependencyException(names);
                }
                log.warn("Cycle detected among {}; scheduling them as a final fallback stage", names);
                stages.add(new ExecutionStage(stages.size(), stuck.get(0).phase(), names, true));
                break;
            }

            ready.sort(READY_ORDER);
            GovernanceCategory phase = ready.get(0).phase();
            var members = new ArrayList<String>();
            for (DagNode node : ready) {
                if (node.phase() != phase) break;
                members.add(node.name());
                visited[node.id()] = true;
                remaining--;
            }
            stages.add(new ExecutionStage(stages.size(), phase, members, false));
        }

        var plan = new ExecutionPlan(stages, n);
        log.debug("Planned {} policies into {} stages ({} parallel)",
                plan.totalPolicies(), plan.stageCount(), plan.parallelStages());
        return plan;
    }

    public ExecutionPlan plan(IRModule module) {
        return sort(build(module));
    }

    public List<String> getExecutionOrder(IRModule module) {
        return plan(module).executionOrder();
    }

    /**
     * Text rendering of the graph: one line per node with its dependencies.
     */
    public String visualize(ExecutionDag dag) {
        var sb = new StringBuilder();
        sb.append("DAG (").append(dag.size()).append(" nodes, ")
                .append(dag.edges().size()).append(" edges)\n");
        var nodes = new ArrayList<>(dag.nodes());
        nodes.sort(READY_ORDER);
        for (DagNode node : nodes) {
            sb.append("  ").append(node.name())
                    .append(" [").append(node.phase()).append(", priority=").append(node.priority()).append(']');
            List<String> deps = dag.dependenciesOf(node.name());
            if (!deps.isEmpty()) {
                sb.append(" <- ").append(String.join(", ", deps));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Text rendering of the graph followed by its stages.
     */
    public String visualize(ExecutionDag dag, ExecutionPlan plan) {
        var sb = new StringBuilder(visualize(dag));
        sb.append("Plan (").append(plan.totalPolicies()).append(" policies, ")
                .append(plan.stageCount()).append(" stages, ")
                .append(plan.parallelStages()).append(" parallel)\n");
        for (ExecutionStage stage : plan.stages()) {
            sb.append("  stage ").append(stage.index())
                    .append(" [").append(stage.phase()).append("]");
            if (stage.fallback()) sb.append(" (fallback)");
            else if (stage.isParallel()) sb.append(" (parallel)");
            sb.append(": ").append(String.join(", ", stage.policies())).append('\n');
        }
        return sb.toString();
    }

    private static boolean allVisited(DagNode node, boolean[] visited) {
        for (int dep : node.dependencies()) {
            if (!visited[dep]) return false;
        }
        return true;
    }
}
