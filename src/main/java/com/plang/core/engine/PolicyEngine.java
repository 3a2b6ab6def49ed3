package com.plang.core.engine;

import com.plang.config.PlangProperties;
import com.plang.core.arbitration.ArbitrationInput;
import com.plang.core.arbitration.ArbitrationResult;
import com.plang.core.arbitration.PolicyArbitrator;
import com.plang.core.events.EventBus;
import com.plang.core.events.PlangEvent;
import com.plang.core.logging.MdcContext;
import com.plang.core.metrics.PlangMetrics;
import com.plang.core.runtime.DagExecutor;
import com.plang.core.runtime.EvaluationContext;
import com.plang.core.runtime.ExecutionTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for callers: compile policy sources, evaluate them against a request
 * context and arbitrate limits across policies. Every evaluation and arbitration is
 * published on the {@link EventBus} as a flat audit record.
 */
@Service
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final PolicyCompiler compiler;
    private final DagExecutor executor;
    private final PolicyArbitrator arbitrator;
    private final EventBus eventBus;
    private final PlangProperties properties;
    private final PlangMetrics metrics;

    public PolicyEngine(PolicyCompiler compiler, DagExecutor executor, PolicyArbitrator arbitrator,
                        EventBus eventBus, PlangProperties properties, PlangMetrics metrics) {
        this.compiler = compiler;
        this.executor = executor;
        this.arbitrator = arbitrator;
        this.eventBus = eventBus;
        this.properties = properties;
        this.metrics = metrics;
    }

    public CompiledPolicySet compile(String source, String name) {
        return compiler.compile(source, name);
    }

    public CompiledPolicySet compileFile(Path file) {
        return compiler.compileFile(file);
    }

    /**
     * New context with a fresh execution id and the configured limits.
     *
     * @throws IllegalArgumentException if {@code variables} exceeds the configured maximum
     */
    public EvaluationContext newContext(String tenantId, Map<String, ?> variables) {
        return newContext(tenantId, variables, properties.getMaxSteps());
    }

    public EvaluationContext newContext(String tenantId, Map<String, ?> variables, long maxSteps) {
        return EvaluationContext.builder()
                .executionId(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .variables(variables)
                .maxSteps(maxSteps)
                .maxVariables(properties.getMaxVariables())
                .build();
    }

    public ExecutionTrace evaluate(CompiledPolicySet policies, EvaluationContext context) {
        ExecutionTrace trace = executor.execute(policies.module(), context, policies.plan());
        eventBus.publish(new PlangEvent("trace.recorded", trace.executionId(), null,
                trace.toRecord(), Instant.now()));
        return trace;
    }

    public ExecutionTrace evaluate(CompiledPolicySet policies, String tenantId, Map<String, ?> variables) {
        return evaluate(policies, newContext(tenantId, variables));
    }

    public ArbitrationResult arbitrate(List<String> policyIds, String tenantId, ArbitrationInput input) {
        MdcContext.setTenant(tenantId);
        try {
            ArbitrationResult result = arbitrator.arbitrate(policyIds, tenantId, input);
            eventBus.publish(new PlangEvent("arbitration.recorded", null, null,
                    result.toRecord(), result.arbitratedAt()));
            if (metrics != null) {
                metrics.recordArbitration(result.strategy().name(), result.conflictsResolved());
            }
            log.debug("Arbitration snapshot {}", result.snapshotHash());
            return result;
        } finally {
            MdcContext.clear();
        }
    }
}
