package com.plang.core.runtime;

import com.plang.core.grammar.ActionKind;
import com.plang.core.grammar.GovernanceCategory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable audit record of one execution.
 *
 * @param executionId        execution id from the context
 * @param tenantId           tenant, may be null
 * @param stageCount         number of stages in the plan
 * @param stages             results of the stages that ran, in order
 * @param finalAction        decision of the run; ALLOW if nothing fired
 * @param terminalState      how the run ended
 * @param governanceCounters successful evaluations per category
 * @param totalSteps         sum over stages of each stage's max member steps
 * @param intents            intents in stage order, then plan member order
 * @param startedAt          run start
 * @param finishedAt         run end
 */
public record ExecutionTrace(
    String executionId,
    String tenantId,
    int stageCount,
    List<StageResult> stages,
    ActionKind finalAction,
    TerminalState terminalState,
    Map<GovernanceCategory, Integer> governanceCounters,
    long totalSteps,
    List<Intent> intents,
    Instant startedAt,
    Instant finishedAt
) {
    public ExecutionTrace {
        stages = List.copyOf(stages);
        intents = List.copyOf(intents);
        var counters = new EnumMap<GovernanceCategory, Integer>(GovernanceCategory.class);
        for (GovernanceCategory category : GovernanceCategory.values()) {
            counters.put(category, governanceCounters != null ? governanceCounters.getOrDefault(category, 0) : 0);
        }
        governanceCounters = Collections.unmodifiableMap(counters);
    }

    public int stagesExecuted() {
        return stages.size();
    }

    public long durationMs() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }

    public List<PolicyResult> policyResults() {
        return stages.stream().flatMap(s -> s.results().stream()).toList();
    }

    /**
     * Flat key/value form for audit sinks and the CLI.
     */
    public Map<String, Object> toRecord() {
        var record = new LinkedHashMap<String, Object>();
        record.put("execution_id", executionId);
        record.put("tenant_id", tenantId);
        record.put("terminal_state", terminalState.name());
        record.put("final_action", finalAction.name());
        record.put("stage_count", stageCount);
        record.put("stages_executed", stagesExecuted());
        record.put("total_steps", totalSteps);
        record.put("started_at", startedAt.toString());
        record.put("finished_at", finishedAt.toString());
        record.put("duration_ms", durationMs());
        governanceCounters.forEach((category, count) ->
                record.put("governance." + category.name().toLowerCase(Locale.ROOT), count));

        for (StageResult stage : stages) {
            String prefix = "stage." + stage.index() + ".";
            record.put(prefix + "phase", stage.phase().name());
            record.put(prefix + "policies", String.join(",", stage.policies()));
            record.put(prefix + "net_action", stage.netAction() != null ? stage.netAction().name() : null);
            record.put(prefix + "steps", stage.steps());
            for (PolicyResult result : stage.results()) {
                String p = "policy." + result.policy() + ".";
                record.put(p + "passed", result.passed());
                record.put(p + "action", result.action() != null ? result.action().name() : null);
                record.put(p + "intents", result.intents().size());
                record.put(p + "steps", result.steps());
                if (result.error() != null) {
                    record.put(p + "error", result.error());
                }
            }
        }

        record.put("intent_count", intents.size());
        for (int i = 0; i < intents.size(); i++) {
            Intent intent = intents.get(i);
            String value = intent.block() + ":" + intent.action().name()
                    + (intent.target() != null ? "->" + intent.target() : "");
            record.put("intent." + i, value);
        }
        return record;
    }
}
