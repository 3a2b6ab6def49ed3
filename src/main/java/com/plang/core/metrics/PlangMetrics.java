package com.plang.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for policy compilation, execution and arbitration.
 */
@Service
public class PlangMetrics {

    private final MeterRegistry registry;

    public PlangMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCompilation(int functions, long ms) {
        Timer.builder("plang.compile.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("plang.compile.functions")
                .description("IR functions per compiled module")
                .register(registry)
                .record(functions);
    }

    public void recordRun(String terminalState, String finalAction, long ms) {
        Counter.builder("plang.runs.total")
                .tag("state", terminalState)
                .tag("action", finalAction)
                .register(registry)
                .increment();
        Timer.builder("plang.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records the number of members of an executed stage.
     */
    public void recordStageWidth(int members) {
        DistributionSummary.builder("plang.stage.width")
                .description("Policies per executed stage")
                .register(registry)
                .record(members);
    }

    public void recordPolicyEvaluation(String category, long ms) {
        Timer.builder("plang.policy.duration")
                .tag("category", category)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPolicyFailure(String category) {
        Counter.builder("plang.policy.failures")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordArbitration(String strategy, int conflictsResolved) {
        Counter.builder("plang.arbitrations.total")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
        DistributionSummary.builder("plang.arbitration.conflicts")
                .description("Conflicts resolved per arbitration")
                .register(registry)
                .record(conflictsResolved);
    }

    public void recordCycleFallback() {
        Counter.builder("plang.dag.cycle_fallbacks")
                .description("Plans that scheduled a cycle as a fallback stage")
                .register(registry)
                .increment();
    }
}
