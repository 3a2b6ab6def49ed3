package com.plang.core.runtime;

import com.plang.core.dag.DagSorter;
import com.plang.core.dag.ExecutionPlan;
import com.plang.core.dag.ExecutionStage;
import com.plang.core.events.EventBus;
import com.plang.core.events.PlangEvent;
import com.plang.core.grammar.ActionKind;
import com.plang.core.grammar.GovernanceCategory;
import com.plang.core.ir.IRFunction;
import com.plang.core.ir.IRModule;
import com.plang.core.logging.MdcContext;
import com.plang.core.metrics.PlangMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs an {@link ExecutionPlan} stage by stage.
 *
 * <p>A single-member stage is evaluated on the calling thread. Members of a wider stage
 * are evaluated concurrently on the policy worker pool, each against its own copy of
 * the pre-stage context, and joined before the next stage starts. After the join the
 * calling thread merges outcomes and resolved facts back into the run context in plan
 * member order, so later stages see them and intent order never depends on completion
 * order.
 *
 * <p>A net DENY ends the run. So does running out of the global step budget, which is
 * charged per stage as the largest member's step count. Interrupting the calling thread
 * cancels in-flight members and ends the run as {@link TerminalState#CANCELLED}.
 */
@Service
public class DagExecutor {

    private static final Logger log = LoggerFactory.getLogger(DagExecutor.class);

    private final DagSorter sorter;
    private final PolicyEvaluator evaluator;
    private final ExecutorService pool;
    private final EventBus eventBus;
    private final PlangMetrics metrics;

    @Autowired
    public DagExecutor(DagSorter sorter, PolicyEvaluator evaluator,
                       @Qualifier("policyExecutor") ExecutorService pool,
                       EventBus eventBus, PlangMetrics metrics) {
        this.sorter = sorter;
        this.evaluator = evaluator;
        this.pool = pool;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    DagExecutor(DagSorter sorter, PolicyEvaluator evaluator, ExecutorService pool) {
        this(sorter, evaluator, pool, new EventBus(), null);
    }

    public ExecutionTrace execute(IRModule module, EvaluationContext context) {
        return execute(module, context, sorter.plan(module));
    }

    public ExecutionTrace execute(IRModule module, EvaluationContext context, ExecutionPlan plan) {
        MdcContext.setExecution(context.executionId(), context.tenantId());
        try {
            return run(module, context, plan);
        } finally {
            MdcContext.clear();
        }
    }

    private ExecutionTrace run(IRModule module, EvaluationContext context, ExecutionPlan plan) {
        Instant startedAt = Instant.now();
        String executionId = context.executionId();

        log.info("Starting run: {} policies in {} stages (max steps {})",
                plan.totalPolicies(), plan.stageCount(), context.maxSteps());
        publish("run.started", executionId, null, Map.of(
                "module", module.name(),
                "stages", plan.stageCount(),
                "policies", plan.totalPolicies()));

        var counters = new EnumMap<GovernanceCategory, Integer>(GovernanceCategory.class);
        var stageResults = new ArrayList<StageResult>();
        var intents = new ArrayList<Intent>();
        long totalSteps = 0;
        ActionKind finalAction = null;
        TerminalState state = TerminalState.COMPLETED;

        try {
            for (ExecutionStage stage : plan.stages()) {
                if (context.token().isCancelled() || Thread.currentThread().isInterrupted()) {
                    state = TerminalState.CANCELLED;
                    break;
                }
                MdcContext.setStage(executionId, stage.index());
                long remaining = context.maxSteps() - totalSteps;

                List<PolicyResult> results = stage.isParallel()
                        ? runParallel(module, stage, context, remaining)
                        : List.of(runInline(module, stage, context, remaining));

                ActionKind net = null;
                long stageSteps = 0;
                boolean exhausted = false;
                for (PolicyResult result : results) {
                    net = ActionKind.mostRestrictive(net, result.action());
                    stageSteps = Math.max(stageSteps, result.steps());
                    exhausted |= result.budgetExceeded();
                    if (result.passed()) {
                        counters.merge(result.category(), 1, Integer::sum);
                    } else {
                        onFailure(executionId, stage, result);
                    }
                    if (metrics != null) {
                        metrics.recordPolicyEvaluation(result.category().name(), result.elapsedMs());
                    }
                    intents.addAll(result.intents());
                    context.mergeFacts(result.resolvedFacts());
                    context.recordOutcome(result.policy(), result.action(), result.passed());
                }
                totalSteps += stageSteps;
                finalAction = ActionKind.mostRestrictive(finalAction, net);
                stageResults.add(new StageResult(stage.index(), stage.phase(), results, net, stageSteps));

                log.info("Stage {} [{}] complete: {} member(s), net action {}, {} steps",
                        stage.index(), stage.phase(), results.size(), net, stageSteps);
                var payload = new HashMap<String, Object>();
                payload.put("stage", stage.index());
                payload.put("phase", stage.phase().name());
                payload.put("policies", stage.policies());
                payload.put("netAction", net != null ? net.name() : "NONE");
                payload.put("steps", stageSteps);
                publish("stage.completed", executionId, null, payload);
                if (metrics != null) {
                    metrics.recordStageWidth(results.size());
                }

                if (net == ActionKind.DENY) {
                    state = TerminalState.DENIED;
                    break;
                }
                if (exhausted) {
                    log.warn("Step budget of {} exhausted in stage {}", context.maxSteps(), stage.index());
                    state = TerminalState.BUDGET_EXHAUSTED;
                    break;
                }
            }
        } catch (EvaluationCancelledException e) {
            log.warn("Run cancelled: {}", e.getMessage());
            state = TerminalState.CANCELLED;
        }

        if (finalAction == null) {
            finalAction = ActionKind.ALLOW;
        }
        var trace = new ExecutionTrace(executionId, context.tenantId(), plan.stageCount(), stageResults,
                finalAction, state, counters, totalSteps, intents, startedAt, Instant.now());

        log.info("Run finished: {} with {} after {}/{} stages, {} steps",
                state, finalAction, trace.stagesExecuted(), plan.stageCount(), totalSteps);
        publish("run.completed", executionId, null, Map.of(
                "terminalState", state.name(),
                "finalAction", finalAction.name(),
                "stagesExecuted", trace.stagesExecuted(),
                "totalSteps", totalSteps));
        if (metrics != null) {
            metrics.recordRun(state.name(), finalAction.name(), trace.durationMs());
        }
        return trace;
    }

    private PolicyResult runInline(IRModule module, ExecutionStage stage, EvaluationContext context, long budget) {
        String name = stage.policies().get(0);
        MdcContext.setPolicy(context.executionId(), stage.index(), name);
        try {
            return evaluateMember(module, name, context.copy(), budget);
        } finally {
            MdcContext.clearPolicy();
        }
    }

    private List<PolicyResult> runParallel(IRModule module, ExecutionStage stage, EvaluationContext context,
                                           long budget) {
        String executionId = context.executionId();
        var futures = new ArrayList<CompletableFuture<PolicyResult>>();
        for (String name : stage.policies()) {
            EvaluationContext isolated = context.copy();
            futures.add(CompletableFuture.supplyAsync(() -> {
                MdcContext.setExecution(executionId, isolated.tenantId());
                MdcContext.setPolicy(executionId, stage.index(), name);
                try {
                    return evaluateMember(module, name, isolated, budget);
                } finally {
                    MdcContext.clear();
                }
            }, pool));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get();
        } catch (InterruptedException e) {
            context.token().cancel();
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new EvaluationCancelledException("Interrupted while waiting for stage " + stage.index());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof EvaluationCancelledException cancelled) {
                context.token().cancel();
                throw cancelled;
            }
            throw new IllegalStateException("Unexpected failure in stage " + stage.index(), e.getCause());
        }

        var results = new ArrayList<PolicyResult>(futures.size());
        for (CompletableFuture<PolicyResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private PolicyResult evaluateMember(IRModule module, String name, EvaluationContext isolated, long budget) {
        Optional<IRFunction> function = module.function(name);
        if (function.isEmpty()) {
            log.warn("Planned policy {} is not in module {}", name, module.name());
            return PolicyResult.failed(name, GovernanceCategory.DEFAULT, "Unknown policy: " + name, 0);
        }
        GovernanceCategory category = function.get().governance().category();
        try {
            return evaluator.evaluate(function.get(), isolated, budget);
        } catch (EvaluationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error evaluating {}: {}", name, e.getMessage(), e);
            return PolicyResult.failed(name, category, e.getMessage(), 0);
        }
    }

    private void onFailure(String executionId, ExecutionStage stage, PolicyResult result) {
        var payload = new HashMap<String, Object>();
        payload.put("stage", stage.index());
        payload.put("error", result.error() != null ? result.error() : "unknown");
        payload.put("budgetExceeded", result.budgetExceeded());
        publish("policy.failed", executionId, result.policy(), payload);
        if (metrics != null) {
            metrics.recordPolicyFailure(result.category().name());
        }
    }

    private void publish(String type, String executionId, String policy, Map<String, Object> payload) {
        eventBus.publish(new PlangEvent(type, executionId, policy, payload, Instant.now()));
    }
}
