package com.plang.core.dag;

import java.util.List;

/**
 * Ordered stages produced by {@link DagSorter}. For every DAG edge (from, to),
 * the stage of {@code to} comes strictly before the stage of {@code from}.
 */
public record ExecutionPlan(List<ExecutionStage> stages, int totalPolicies) {

    public ExecutionPlan {
        stages = List.copyOf(stages);
    }

    public static ExecutionPlan empty() {
        return new ExecutionPlan(List.of(), 0);
    }

    /** Number of stages with more than one member. */
    public int parallelStages() {
        return (int) stages.stream().filter(ExecutionStage::isParallel).count();
    }

    public int stageCount() {
        return stages.size();
    }

    /** Stages flattened in execution order. */
    public List<String> executionOrder() {
        return stages.stream().flatMap(s -> s.policies().stream()).toList();
    }

    /** @return index of the stage containing {@code policy}, or -1 */
    public int stageIndexOf(String policy) {
        for (ExecutionStage stage : stages) {
            if (stage.policies().contains(policy)) {
                return stage.index();
            }
        }
        return -1;
    }

    public boolean fallbackApplied() {
        return stages.stream().anyMatch(ExecutionStage::fallback);
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }
}
